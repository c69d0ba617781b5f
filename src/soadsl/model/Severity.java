package soadsl.model;

import java.util.Optional;
import java.util.stream.Stream;

/** Rule severity. */
public enum Severity {
  High("high"),
  Medium("medium"),
  Low("low"),
  Review("review");

  public final String serialName;

  private Severity(String serialName) { this.serialName = serialName; }

  public static Optional<Severity> fromSerialName(String serialName) {
    return Stream.of(Severity.values()).filter(sevVal -> sevVal.serialName.equals(serialName)).findAny();
  }
}
