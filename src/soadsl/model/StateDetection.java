package soadsl.model;

/**
 * The {@code monitor_params} block: which device parameter is probed to detect the on/off state, and its threshold.
 */
public record StateDetection(String param, LimitValue vgt, int pmosvthsign, String inst2probe) {
  public static final String DEFAULT_PARAM = "vth";
  public static final String DEFAULT_INST2PROBE = "fet";
}
