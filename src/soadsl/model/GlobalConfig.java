package soadsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code global} section of a document. All maps keep document order.
 */
public class GlobalConfig {
  public static final String[] TIMING_KEYS = {"tmin", "tdelay", "vballmsg", "stop"};
  public static final String[] TMAXFRAC_LEVELS = {"level0", "level1", "level2", "level3"};

  private final LinkedHashMap<String, LimitValue> timing;
  private final LinkedHashMap<String, LimitValue> temperature;
  private final LinkedHashMap<String, Double> tmaxfrac;
  private final LinkedHashMap<String, LimitValue> limits;

  public GlobalConfig(Map<String, LimitValue> timing, Map<String, LimitValue> temperature, Map<String, Double> tmaxfrac,
                      Map<String, LimitValue> limits) {
    this.timing = new LinkedHashMap<>(timing);
    this.temperature = new LinkedHashMap<>(temperature);
    this.tmaxfrac = new LinkedHashMap<>(tmaxfrac);
    this.limits = new LinkedHashMap<>(limits);
  }

  /** An empty configuration, as produced for a universal document without a global section. */
  public static GlobalConfig empty() { return new GlobalConfig(Map.of(), Map.of(), Map.of(), Map.of()); }

  public Map<String, LimitValue> getTiming() { return Collections.unmodifiableMap(timing); }
  public Map<String, LimitValue> getTemperature() { return Collections.unmodifiableMap(temperature); }
  public Map<String, Double> getTmaxfrac() { return Collections.unmodifiableMap(tmaxfrac); }
  public Map<String, LimitValue> getLimits() { return Collections.unmodifiableMap(limits); }

  /** tmaxfrac of level {@code level}, 0.0 if not declared. */
  public double getTmaxfrac(int level) { return tmaxfrac.getOrDefault("level" + level, 0.0); }

  /**
   * All names an expression may reference as a global parameter: limits, then timing, then temperature.
   * An earlier section wins on a name clash.
   */
  public Map<String, LimitValue> globalParameters() {
    LinkedHashMap<String, LimitValue> ret = new LinkedHashMap<>(limits);
    timing.forEach(ret::putIfAbsent);
    temperature.forEach(ret::putIfAbsent);
    return Collections.unmodifiableMap(ret);
  }

  @Override
  public int hashCode() {
    return timing.hashCode() ^ temperature.hashCode() ^ tmaxfrac.hashCode() ^ limits.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    GlobalConfig other = (GlobalConfig)obj;
    return timing.equals(other.timing) && temperature.equals(other.temperature) && tmaxfrac.equals(other.tmaxfrac) &&
        limits.equals(other.limits);
  }

  @Override
  public String toString() {
    return "GlobalConfig timing=" + timing + " temperature=" + temperature + " tmaxfrac=" + tmaxfrac + " limits=" + limits;
  }
}
