package soadsl.library;

import java.util.Optional;

import soadsl.model.MonitorKind;

/** Read-only registry of checker models and time-limit aliases used during lowering. */
public interface MonitorLibrary {
  boolean isRegistered(MonitorKind kind);

  /** The tmaxfrac parameter name for a time-limit category, e.g. {@code steady} to {@code tmaxfrac0}. */
  Optional<String> timeLimitAlias(String category);
}
