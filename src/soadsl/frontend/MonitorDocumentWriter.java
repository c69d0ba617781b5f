package soadsl.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import soadsl.model.Branch;
import soadsl.model.CommonParams;
import soadsl.model.GlobalConfig;
import soadsl.model.LimitValue;
import soadsl.model.Monitor;
import soadsl.model.MonitorDocument;
import soadsl.model.MonitorSettings;

/**
 * Writes a monitor document as YAML in the schema {@link SpecParser#parseMonitor(String)} reads.
 */
public class MonitorDocumentWriter {

  public String write(MonitorDocument document) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(0);
    options.setWidth(120);
    Yaml yaml = new Yaml(options);
    return yaml.dump(toYamlTree(document));
  }

  /** The document as nested ordered maps and lists. */
  public Map<String, Object> toYamlTree(MonitorDocument document) {
    LinkedHashMap<String, Object> root = new LinkedHashMap<>();
    root.put("version", document.getVersion());
    root.put("process", document.getProcess());
    root.put("date", document.getDate());
    root.put("global", global(document.getGlobal()));
    if (!document.getParameters().isEmpty())
      root.put("parameters", limits(document.getParameters()));
    List<Object> monitors = new ArrayList<>();
    for (Monitor monitor : document.getMonitors())
      monitors.add(monitor(monitor));
    root.put("monitors", monitors);
    return root;
  }

  private static Map<String, Object> global(GlobalConfig global) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("timing", limits(global.getTiming()));
    if (!global.getTemperature().isEmpty())
      ret.put("temperature", limits(global.getTemperature()));
    ret.put("tmaxfrac", new LinkedHashMap<>(global.getTmaxfrac()));
    if (!global.getLimits().isEmpty())
      ret.put("limits", limits(global.getLimits()));
    return ret;
  }

  private static Map<String, Object> limits(Map<String, LimitValue> values) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    values.forEach((key, value) -> ret.put(key, value.toYamlValue()));
    return ret;
  }

  private static Map<String, Object> monitor(Monitor monitor) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("name", monitor.getName());
    ret.put("monitor_type", monitor.getKind().serialName);
    ret.put("model_name", monitor.getModelName());
    ret.put("section", monitor.getSection());
    ret.put("device_pattern", monitor.getDevicePattern());
    LinkedHashMap<String, Object> params = new LinkedHashMap<>();
    CommonParams common = monitor.getCommon();
    params.put("tmin", common.tmin().toYamlValue());
    params.put("tdelay", common.tdelay().toYamlValue());
    params.put("vballmsg", common.vballmsg().toYamlValue());
    params.put("stop", common.stop().toYamlValue());
    common.getTmaxfrac().ifPresent(alias -> params.put("tmaxfrac", alias));
    params.putAll(monitor.getSettings().accept(new SettingsParams()));
    params.putAll(monitor.getExtra());
    ret.put("parameters", params);
    return ret;
  }

  /** Kind-specific parameter entries, null fields left out. */
  private static class SettingsParams implements MonitorSettings.Visitor<Map<String, Object>> {
    private final LinkedHashMap<String, Object> params = new LinkedHashMap<>();

    private void put(String key, Object value) {
      if (value instanceof LimitValue)
        value = ((LimitValue)value).toYamlValue();
      if (value != null)
        params.put(key, value);
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.SingleBranch settings) {
      put("branch1", settings.branch());
      put("message1", settings.message());
      put("vlow", settings.vlow());
      put("vhigh", settings.vhigh());
      return params;
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.SelfHeatingCheck settings) {
      put("dtmax", settings.dtmax());
      put("theat", settings.theat());
      put("monitor", settings.monitor());
      put("idc_high", settings.idcHigh());
      put("ipeak_high", settings.ipeakHigh());
      put("irms_high", settings.irmsHigh());
      return params;
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.MultiBranch settings) {
      int i = 1;
      for (Branch branch : settings.branches()) {
        put("branch" + i, branch.branch());
        put("message" + i, branch.message());
        put("vlow" + i, branch.vlow());
        put("vhigh" + i, branch.vhigh());
        ++i;
      }
      return params;
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.StateDependent settings) {
      put("vhigh_on", settings.vhighOn());
      put("vhigh_off", settings.vhighOff());
      put("vhigh_gc", settings.vhighGc());
      put("vlow_gc", settings.vlowGc());
      put("param", settings.param());
      put("vgt", settings.vgt());
      put("pmosvthsign", settings.pmosvthsign());
      put("inst2probe", settings.inst2probe());
      return params;
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.TemperatureDependent settings) {
      put("branch1", settings.branch());
      put("message1", settings.message());
      put("vlow", settings.vlow());
      put("vhigh", settings.vhigh());
      return params;
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.Aging settings) {
      put("atype", settings.atype());
      settings.coefficients().forEach(this::put);
      return params;
    }

    @Override
    public Map<String, Object> visit(MonitorSettings.ParameterCheck settings) {
      put("param", settings.param());
      put("vgt", settings.vgt());
      put("vlow", settings.vlow());
      put("vhigh", settings.vhigh());
      return params;
    }
  }
}
