package soadsl.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Locale-independent rendering of numbers for netlist and YAML output.
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Integers print as-is; floating point values print in plain decimal notation with at least one fractional digit, e.g.
   * {@code 1e-7} as {@code 0.0000001} and {@code 5.0} as {@code 5.0}.
   */
  public static String format(Number number) {
    if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte ||
        number instanceof BigInteger)
      return number.toString();
    double d = number.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d))
      return Double.toString(d);
    if (d == 0)
      return "0.0";
    String ret = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    if (ret.indexOf('.') < 0)
      ret += ".0";
    return ret;
  }
}
