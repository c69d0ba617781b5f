package soadsl.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Bounds of a single-quantity rule. Every bound is optional (null if absent).
 */
public record Constraint(LimitValue vhigh, LimitValue vlow, LimitValue ihigh, LimitValue ilow, LimitValue vhighOn, LimitValue vhighOff,
                         LimitValue vlowOn, LimitValue vlowOff) {

  public boolean hasAnyBound() { return Stream.of(vhigh, vlow, ihigh, ilow, vhighOn, vhighOff, vlowOn, vlowOff).anyMatch(b -> b != null); }

  public boolean isStateDependent() { return vhighOn != null || vhighOff != null || vlowOn != null || vlowOff != null; }

  /** The bounds that are set, keyed by their document name, in declaration order. */
  public Map<String, LimitValue> setBounds() {
    LinkedHashMap<String, LimitValue> ret = new LinkedHashMap<>();
    putIfSet(ret, "vhigh", vhigh);
    putIfSet(ret, "vlow", vlow);
    putIfSet(ret, "ihigh", ihigh);
    putIfSet(ret, "ilow", ilow);
    putIfSet(ret, "vhigh_on", vhighOn);
    putIfSet(ret, "vhigh_off", vhighOff);
    putIfSet(ret, "vlow_on", vlowOn);
    putIfSet(ret, "vlow_off", vlowOff);
    return ret;
  }

  private static void putIfSet(Map<String, LimitValue> map, String key, LimitValue value) {
    if (value != null)
      map.put(key, value);
  }
}
