package soadsl.frontend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import soadsl.expr.ExpressionException;
import soadsl.expr.FormulaRenderer;
import soadsl.model.AgingCheck;
import soadsl.model.Branch;
import soadsl.model.CommonParams;
import soadsl.model.Constraint;
import soadsl.model.CurrentConstraint;
import soadsl.model.GateControl;
import soadsl.model.GlobalConfig;
import soadsl.model.LimitValue;
import soadsl.model.Monitor;
import soadsl.model.MonitorDocument;
import soadsl.model.MonitorKind;
import soadsl.model.MonitorSettings;
import soadsl.model.Rule;
import soadsl.model.SOADocument;
import soadsl.model.SelfHeating;
import soadsl.model.StateDetection;
import soadsl.model.TemperatureDependence;
import soadsl.model.UniversalDocument;

/**
 * Reads SOA documents from YAML text.
 * <p>
 * Monitor documents are read strictly: header, global timing and tmaxfrac levels, and every monitor field are mandatory.
 * Universal documents are read loosely: absent fields take their empty/zero defaults and are left to the validator. Both reject
 * fields of the wrong shape.
 */
public class SpecParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum Flavor { Universal, Monitor }

  /** Loads {@code file}, which must carry a {@code .yaml} or {@code .yml} extension. */
  public static String readYamlFile(Path file) throws SpecParseException {
    String fileName = file.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String ext = dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    if (!ext.equals(".yaml") && !ext.equals(".yml"))
      throw new SpecParseException("", "Only YAML format is supported. Got: " + (ext.isEmpty() ? "no extension" : ext) + " (" + file + ")");
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SpecParseException("", "Cannot read " + file + ": " + e.getMessage(), e);
    }
  }

  public SOADocument parseFile(Path file) throws SpecParseException {
    logger.info("SpecParser. Reading {}", file);
    return parse(readYamlFile(file));
  }

  public SOADocument parse(String text) throws SpecParseException {
    Object root = load(text);
    return flavorOf(root) == Flavor.Monitor ? monitorDocument(root) : universalDocument(root);
  }

  /** A document with a {@code monitors} key is a monitor document, anything else a universal one. */
  public Flavor detectFlavor(String text) throws SpecParseException { return flavorOf(load(text)); }

  public UniversalDocument parseUniversal(String text) throws SpecParseException { return universalDocument(load(text)); }

  public MonitorDocument parseMonitor(String text) throws SpecParseException { return monitorDocument(load(text)); }

  private static Object load(String text) throws SpecParseException {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    try {
      return yaml.load(text);
    } catch (YAMLException e) {
      throw new SpecParseException("", "YAML parsing error: " + e.getMessage(), e);
    }
  }

  private static Flavor flavorOf(Object root) {
    return (root instanceof Map && ((Map<?, ?>)root).containsKey("monitors")) ? Flavor.Monitor : Flavor.Universal;
  }

  //
  // Universal flavor
  //

  private UniversalDocument universalDocument(Object root) throws SpecParseException {
    YamlFields doc = new YamlFields("", root);
    GlobalConfig global = globalConfig(doc.map("global"), false);
    List<Rule> rules = new ArrayList<>();
    List<Object> rawRules = doc.list("rules");
    for (int i = 0; i < rawRules.size(); ++i)
      rules.add(rule(new YamlFields("rules[" + i + "]", rawRules.get(i))));
    UniversalDocument ret = new UniversalDocument(doc.string("version", SOADocument.DEFAULT_VERSION), doc.string("process", ""),
                                                  doc.string("date", ""), global, rules);
    logger.debug("SpecParser. Read {}", ret);
    return ret;
  }

  private GlobalConfig globalConfig(YamlFields global, boolean strict) throws SpecParseException {
    YamlFields timing = strict ? global.requiredMap("timing") : global.map("timing");
    YamlFields tmaxfrac = strict ? global.requiredMap("tmaxfrac") : global.map("tmaxfrac");
    if (strict) {
      for (String key : GlobalConfig.TIMING_KEYS)
        timing.requiredLimit(key);
      for (String level : GlobalConfig.TMAXFRAC_LEVELS) {
        if (tmaxfrac.number(level) == null)
          throw new SpecParseException(tmaxfrac.child(level), "Required field is missing");
      }
    }
    return new GlobalConfig(timing.limits(), global.map("temperature").limits(), tmaxfrac.numbers(), global.map("limits").limits());
  }

  private Rule rule(YamlFields fields) throws SpecParseException {
    Rule.Builder builder = Rule.builder(fields.string("name", ""));
    List<String> devices = new ArrayList<>();
    if (fields.has("device"))
      devices.addAll(fields.stringList("device"));
    if (fields.has("devices"))
      devices.addAll(fields.stringList("devices"));
    YamlFields appliesTo = fields.map("applies_to");
    if (appliesTo.has("devices"))
      devices.addAll(appliesTo.stringList("devices"));
    builder.devices(devices)
        .parameter(fields.string("parameter", ""))
        .type(fields.string("type", ""))
        .severity(fields.string("severity", ""))
        .description(fields.string("description", ""))
        .message(fields.string("message", null))
        .condition(fields.string("condition", null))
        .timeLimit(fields.string("time_limit", Rule.DEFAULT_TIME_LIMIT));

    YamlFields constraint = fields.map("constraint");
    if (!constraint.isEmpty())
      builder.constraint(new Constraint(constraint.limit("vhigh"), constraint.limit("vlow"), constraint.limit("ihigh"),
                                        constraint.limit("ilow"), constraint.limit("vhigh_on"), constraint.limit("vhigh_off"),
                                        constraint.limit("vlow_on"), constraint.limit("vlow_off")));
    builder.tmaxfrac(fields.map("tmaxfrac").numbers());

    List<Branch> branches = new ArrayList<>();
    List<Object> rawBranches = fields.list("branches");
    for (int i = 0; i < rawBranches.size(); ++i) {
      YamlFields branch = new YamlFields(fields.child("branches") + "[" + i + "]", rawBranches.get(i));
      branches.add(new Branch(branch.string("branch", ""), branch.limit("vhigh"), branch.limit("vlow"), branch.string("message", null)));
    }
    builder.branches(branches);

    YamlFields gateControl = fields.map("gate_control");
    if (!gateControl.isEmpty())
      builder.gateControl(new GateControl(gateControl.limit("vhigh_gc", 0.0), gateControl.limit("vlow_gc", 0.0)));
    YamlFields monitorParams = fields.map("monitor_params");
    if (!monitorParams.isEmpty())
      builder.monitorParams(new StateDetection(monitorParams.string("param", StateDetection.DEFAULT_PARAM), monitorParams.limit("vgt", 0.0),
                                               monitorParams.integer("pmosvthsign", 1),
                                               monitorParams.string("inst2probe", StateDetection.DEFAULT_INST2PROBE)));
    YamlFields agingCheck = fields.map("aging_check");
    if (!agingCheck.isEmpty())
      builder.agingCheck(new AgingCheck(agingCheck.string("type", ""), agingCheck.string("variant", ""), agingCheck.map("params").limits()));

    List<CurrentConstraint> constraints = new ArrayList<>();
    List<Object> rawConstraints = fields.list("constraints");
    for (int i = 0; i < rawConstraints.size(); ++i) {
      YamlFields current = new YamlFields(fields.child("constraints") + "[" + i + "]", rawConstraints.get(i));
      constraints.add(new CurrentConstraint(current.string("name", ""), current.string("type", ""), current.limit("ihigh", 0.0),
                                            current.string("message", "")));
    }
    builder.constraints(constraints);

    YamlFields selfHeating = fields.map("self_heating");
    if (!selfHeating.isEmpty())
      builder.selfHeating(new SelfHeating(selfHeating.limit("dtmax", SelfHeating.DEFAULT_DTMAX),
                                          selfHeating.limit("theat", SelfHeating.DEFAULT_THEAT),
                                          selfHeating.string("monitor", SelfHeating.DEFAULT_MONITOR)));
    YamlFields temperature = fields.map("temperature_dependent");
    if (!temperature.isEmpty()) {
      Double coefficient = temperature.number("temp_coefficient");
      builder.temperatureDependence(new TemperatureDependence(temperature.limit("reference_temp"), temperature.limit("reference_value", 0.0),
                                                              coefficient == null ? 0.0 : coefficient));
    }
    return builder.build();
  }

  //
  // Monitor flavor
  //

  private MonitorDocument monitorDocument(Object root) throws SpecParseException {
    YamlFields doc = new YamlFields("", root);
    String process = doc.requiredString("process");
    String date = doc.requiredString("date");
    GlobalConfig global = globalConfig(doc.requiredMap("global"), true);
    LinkedHashMap<String, LimitValue> parameters = renderFormulas(doc.map("parameters").limits(), doc.child("parameters"));
    if (!doc.has("monitors"))
      throw new SpecParseException("monitors", "Required section is missing");
    List<Monitor> monitors = new ArrayList<>();
    List<Object> rawMonitors = doc.list("monitors");
    for (int i = 0; i < rawMonitors.size(); ++i)
      monitors.add(monitor(new YamlFields("monitors[" + i + "]", rawMonitors.get(i))));
    MonitorDocument ret = new MonitorDocument(doc.string("version", SOADocument.DEFAULT_VERSION), process, date, global, parameters, monitors);
    logger.debug("SpecParser. Read {}", ret);
    return ret;
  }

  private static LinkedHashMap<String, LimitValue> renderFormulas(Map<String, LimitValue> values, String path) throws SpecParseException {
    LinkedHashMap<String, LimitValue> ret = new LinkedHashMap<>();
    for (Map.Entry<String, LimitValue> entry : values.entrySet())
      ret.put(entry.getKey(), renderFormula(entry.getValue(), path + "." + entry.getKey()));
    return ret;
  }

  private static LimitValue renderFormula(LimitValue value, String path) throws SpecParseException {
    try {
      return FormulaRenderer.toExpression(value);
    } catch (ExpressionException e) {
      throw new SpecParseException(path, e.getMessage(), e);
    }
  }

  private Monitor monitor(YamlFields fields) throws SpecParseException {
    String name = fields.requiredString("name");
    String kindName = fields.requiredString("monitor_type");
    Optional<MonitorKind> kind = MonitorKind.fromSerialName(kindName);
    if (kind.isEmpty())
      throw new SpecParseException(fields.child("monitor_type"), "Unknown monitor type '" + kindName + "'");
    String modelName = fields.requiredString("model_name");
    String section = fields.requiredString("section");
    String devicePattern = fields.requiredString("device_pattern");
    YamlFields params = fields.requiredMap("parameters");
    CommonParams common = new CommonParams(limit(params, "tmin", true), limit(params, "tdelay", true), limit(params, "vballmsg", true),
                                            limit(params, "stop", true), params.string("tmaxfrac", null));
    MonitorSettings settings = settings(kind.get(), params);
    return new Monitor(name, modelName, section, devicePattern, common, settings, params.remainingScalars());
  }

  private static LimitValue limit(YamlFields params, String key, boolean required) throws SpecParseException {
    LimitValue value = required ? params.requiredLimit(key) : params.limit(key);
    return renderFormula(value, params.child(key));
  }

  private static LimitValue limit(YamlFields params, String key) throws SpecParseException { return limit(params, key, false); }

  private static final String[] SELF_HEATING_KEYS = {"dtmax", "theat", "monitor", "idc_high", "ipeak_high", "irms_high"};

  private MonitorSettings settings(MonitorKind kind, YamlFields params) throws SpecParseException {
    switch (kind) {
    case Ovcheck:
      for (String key : SELF_HEATING_KEYS) {
        if (params.has(key))
          return new MonitorSettings.SelfHeatingCheck(limit(params, "dtmax"), limit(params, "theat"), params.string("monitor", null),
                                                      limit(params, "idc_high"), limit(params, "ipeak_high"), limit(params, "irms_high"));
      }
      return new MonitorSettings.SingleBranch(params.string("branch1", null), params.string("message1", null), limit(params, "vlow"),
                                              limit(params, "vhigh"));
    case Ovcheck6:
      List<Branch> branches = new ArrayList<>();
      for (int i = 1; i <= Branch.MAX_BRANCHES; ++i) {
        if (!params.has("branch" + i) && !params.has("message" + i) && !params.has("vlow" + i) && !params.has("vhigh" + i))
          continue;
        branches.add(new Branch(params.string("branch" + i, null), limit(params, "vhigh" + i), limit(params, "vlow" + i),
                                params.string("message" + i, null)));
      }
      return new MonitorSettings.MultiBranch(branches);
    case OvcheckvaMos2:
      return new MonitorSettings.StateDependent(limit(params, "vhigh_on"), limit(params, "vhigh_off"), limit(params, "vhigh_gc"),
                                                limit(params, "vlow_gc"), params.string("param", null), limit(params, "vgt"),
                                                params.has("pmosvthsign") ? Integer.valueOf(params.integer("pmosvthsign", 1)) : null,
                                                params.string("inst2probe", null));
    case OvcheckvaPwl:
      return new MonitorSettings.TemperatureDependent(params.string("branch1", null), params.string("message1", null), limit(params, "vlow"),
                                                      limit(params, "vhigh"));
    case OvcheckvaLdmosHciTddb:
      LinkedHashMap<String, LimitValue> coefficients = new LinkedHashMap<>();
      for (String key : new ArrayList<>(params.keys())) {
        if (key.startsWith(MonitorSettings.Aging.COEFFICIENT_PREFIX) && params.has(key))
          coefficients.put(key, limit(params, key));
      }
      return new MonitorSettings.Aging(params.string("atype", null), coefficients);
    case Parcheckva3:
      return new MonitorSettings.ParameterCheck(params.string("param", null), limit(params, "vgt"), limit(params, "vlow"),
                                                limit(params, "vhigh"));
    default:
      throw new IllegalStateException("Unhandled monitor kind " + kind);
    }
  }
}
