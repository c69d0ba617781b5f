package soadsl.model;

/** Self-heating monitor settings of a current_with_heating rule. */
public record SelfHeating(LimitValue dtmax, LimitValue theat, String monitor) {
  public static final double DEFAULT_DTMAX = 5;
  public static final double DEFAULT_THEAT = 1e-7;
  public static final String DEFAULT_MONITOR = "shmonitor_nofeedback";
}
