package soadsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One checker instance of the lowered document.
 * <p>
 * {@code extra} holds parameters the settings variant does not know, in document order. Values are the raw YAML scalars.
 */
public class Monitor {
  private final String name;
  private final String modelName;
  private final String section;
  private final String devicePattern;
  private final CommonParams common;
  private final MonitorSettings settings;
  private final LinkedHashMap<String, Object> extra;

  public Monitor(String name, String modelName, String section, String devicePattern, CommonParams common, MonitorSettings settings,
                 Map<String, Object> extra) {
    this.name = Objects.requireNonNull(name);
    this.modelName = Objects.requireNonNull(modelName);
    this.section = Objects.requireNonNull(section);
    this.devicePattern = Objects.requireNonNull(devicePattern);
    this.common = Objects.requireNonNull(common);
    this.settings = Objects.requireNonNull(settings);
    this.extra = new LinkedHashMap<>(extra);
  }

  public Monitor(String name, String modelName, String section, String devicePattern, CommonParams common, MonitorSettings settings) {
    this(name, modelName, section, devicePattern, common, settings, Map.of());
  }

  public String getName() { return name; }
  public MonitorKind getKind() { return settings.getKind(); }
  public String getModelName() { return modelName; }
  public String getSection() { return section; }
  public String getDevicePattern() { return devicePattern; }
  public CommonParams getCommon() { return common; }
  public MonitorSettings getSettings() { return settings; }
  public Map<String, Object> getExtra() { return Collections.unmodifiableMap(extra); }

  @Override
  public int hashCode() {
    return Objects.hash(name, modelName, section, devicePattern, common, settings, extra);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Monitor other = (Monitor)obj;
    return name.equals(other.name) && modelName.equals(other.modelName) && section.equals(other.section) &&
        devicePattern.equals(other.devicePattern) && common.equals(other.common) && settings.equals(other.settings) &&
        extra.equals(other.extra);
  }

  @Override
  public String toString() {
    return String.format("Monitor %s (%s %s, section %s, device %s)", name, getKind(), modelName, section, devicePattern);
  }
}
