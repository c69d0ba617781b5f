package soadsl.ui;

/**
 * Data-Class to hold tool options.
 */
public class SOADSLConfig {

  public String devices_path = "./libraries/devices.yaml";
  public String monitors_path = "./libraries/monitors.yaml";

  /** Warnings fail validation as well. */
  public boolean strict = false;
  public boolean skip_validation = false;

  /** Output file; null writes to stdout. */
  public String output = null;
}
