package soadsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowered, backend-ready document. {@code parameters} are the netlist-level parameter declarations of the base section.
 */
public class MonitorDocument extends SOADocument {
  private final LinkedHashMap<String, LimitValue> parameters;
  private final List<Monitor> monitors;

  public MonitorDocument(String version, String process, String date, GlobalConfig global, Map<String, LimitValue> parameters,
                         List<Monitor> monitors) {
    super(version, process, date, global);
    this.parameters = new LinkedHashMap<>(parameters);
    this.monitors = List.copyOf(monitors);
  }

  public Map<String, LimitValue> getParameters() { return Collections.unmodifiableMap(parameters); }
  public List<Monitor> getMonitors() { return monitors; }

  @Override
  public String toString() {
    return String.format("MonitorDocument %s/%s with %d monitors", getProcess(), getVersion(), monitors.size());
  }
}
