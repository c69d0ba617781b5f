package soadsl.model;

import java.util.Objects;

/**
 * Fields shared by both document flavors.
 */
public abstract class SOADocument {
  public static final String DEFAULT_VERSION = "1.0";

  private final String version;
  private final String process;
  private final String date;
  private final GlobalConfig global;

  protected SOADocument(String version, String process, String date, GlobalConfig global) {
    this.version = Objects.requireNonNull(version);
    this.process = Objects.requireNonNull(process);
    this.date = Objects.requireNonNull(date);
    this.global = Objects.requireNonNull(global);
  }

  public String getVersion() { return version; }
  public String getProcess() { return process; }
  public String getDate() { return date; }
  public GlobalConfig getGlobal() { return global; }
}
