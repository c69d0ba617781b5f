package soadsl.drc;

import java.util.Locale;

/**
 * One validator finding. {@code subject} is the rule name, or {@code global} for the global section.
 */
public record Diagnostic(String subject, Level level, String message) {

  public enum Level { ERROR, WARNING }

  public boolean isError() { return level == Level.ERROR; }

  @Override
  public String toString() {
    return "[" + level.name().toUpperCase(Locale.ROOT) + "] " + subject + ": " + message;
  }
}
