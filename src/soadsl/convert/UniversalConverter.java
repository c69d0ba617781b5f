package soadsl.convert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import soadsl.expr.ExpressionException;
import soadsl.expr.FormulaRenderer;
import soadsl.library.DeviceInfo;
import soadsl.library.DeviceLibrary;
import soadsl.library.MonitorLibrary;
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
import soadsl.model.RuleType;
import soadsl.model.SelfHeating;
import soadsl.model.StateDetection;
import soadsl.model.TemperatureDependence;
import soadsl.model.UniversalDocument;
import soadsl.util.Numbers;

/**
 * Lowers universal rules into monitor instances, one per rule and target device.
 */
public class UniversalConverter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String UNKNOWN = "UNKNOWN";
  public static final double DEFAULT_TREF = 25;

  private static final Map<String, Number> DEFAULT_TIMING = Map.of("tmin", 0, "tdelay", 0, "vballmsg", 1.0, "stop", 0);
  private static final double[] DEFAULT_TMAXFRAC = {0, 0.01, 0.10, -1};
  private static final String AGING_KEYS = "abcdefghijklmn";
  private static final Pattern VOLTAGE_NODES = Pattern.compile("^[vV][\\[(]\\s*([A-Za-z0-9_]+)\\s*(?:,\\s*([A-Za-z0-9_]+)\\s*)?[\\])]$");

  /** Lowering strategy, in classification precedence order. */
  public enum Category {
    StateDependent(MonitorKind.OvcheckvaMos2),
    TemperatureDependent(MonitorKind.OvcheckvaPwl),
    Aging(MonitorKind.OvcheckvaLdmosHciTddb),
    ParameterCheck(MonitorKind.Parcheckva3),
    SelfHeating(MonitorKind.Ovcheck),
    MultiBranch(MonitorKind.Ovcheck6),
    SingleBranch(MonitorKind.Ovcheck);

    public final MonitorKind kind;

    private Category(MonitorKind kind) { this.kind = kind; }
  }

  private final DeviceLibrary devices;
  private final MonitorLibrary monitors;

  public UniversalConverter(DeviceLibrary devices, MonitorLibrary monitors) {
    this.devices = devices;
    this.monitors = monitors;
  }

  public MonitorDocument convert(UniversalDocument document) throws ConversionException {
    GlobalConfig global = lowerGlobal(document.getGlobal());
    ConversionContext ctx = ConversionContext.of(global, devices, monitors);
    List<Monitor> lowered = new ArrayList<>();
    for (Rule rule : document.getRules())
      lowered.addAll(convertRule(rule, ctx));
    String process = document.getProcess().isEmpty() ? UNKNOWN : document.getProcess();
    String date = document.getDate().isEmpty() ? UNKNOWN : document.getDate();
    MonitorDocument ret = new MonitorDocument(document.getVersion(), process, date, global, netlistParameters(global), lowered);
    logger.info("UniversalConverter. Lowered {} rules into {} monitors", document.getRules().size(), lowered.size());
    return ret;
  }

  /** The universal global section with missing timing and tmaxfrac entries set to their defaults. */
  static GlobalConfig lowerGlobal(GlobalConfig global) {
    LinkedHashMap<String, LimitValue> timing = new LinkedHashMap<>();
    for (String key : GlobalConfig.TIMING_KEYS)
      timing.put(key, global.getTiming().getOrDefault(key, LimitValue.of(DEFAULT_TIMING.get(key))));
    global.getTiming().forEach(timing::putIfAbsent);
    LinkedHashMap<String, Double> tmaxfrac = new LinkedHashMap<>();
    for (int i = 0; i < GlobalConfig.TMAXFRAC_LEVELS.length; ++i) {
      String level = GlobalConfig.TMAXFRAC_LEVELS[i];
      tmaxfrac.put(level, global.getTmaxfrac().getOrDefault(level, DEFAULT_TMAXFRAC[i]));
    }
    global.getTmaxfrac().forEach(tmaxfrac::putIfAbsent);
    return new GlobalConfig(timing, global.getTemperature(), tmaxfrac, global.getLimits());
  }

  private static Map<String, LimitValue> netlistParameters(GlobalConfig global) throws ConversionException {
    LinkedHashMap<String, LimitValue> ret = new LinkedHashMap<>();
    for (String key : GlobalConfig.TIMING_KEYS)
      ret.put("global_" + key, global.getTiming().get(key));
    for (int i = 0; i < GlobalConfig.TMAXFRAC_LEVELS.length; ++i)
      ret.put("tmaxfrac" + i, LimitValue.of(global.getTmaxfrac(i)));
    for (Map.Entry<String, LimitValue> limit : global.getLimits().entrySet())
      ret.put(limit.getKey(), renderFormula("global", limit.getValue()));
    return ret;
  }

  /** One monitor per target device, in device order. */
  public List<Monitor> convertRule(Rule rule, ConversionContext ctx) throws ConversionException {
    List<Monitor> ret = new ArrayList<>();
    if (rule.getDevices().isEmpty())
      logger.warn("UniversalConverter. Rule '{}' targets no device, nothing to lower", rule.getName());
    for (String deviceName : rule.getDevices()) {
      Optional<DeviceInfo> device = ctx.devices().lookup(deviceName);
      if (device.isEmpty())
        throw new ConversionException(rule.getName(), "Unknown device: " + deviceName + " (rule " + rule.getName() + ")");
      Category category = classify(rule);
      Monitor monitor = lower(rule, device.get(), category, ctx);
      logger.debug("UniversalConverter. {} ({}) -> {}", rule.getName(), rule.getDescription(), monitor);
      ret.add(monitor);
    }
    return ret;
  }

  /** First match wins, following the order of {@link Category}. */
  public static Category classify(Rule rule) throws ConversionException {
    if (rule.isStateDependent())
      return Category.StateDependent;
    if (rule.isTemperatureDependent())
      return Category.TemperatureDependent;
    if (rule.isOfType(RuleType.Aging))
      return Category.Aging;
    if (rule.isOfType(RuleType.Parameter))
      return Category.ParameterCheck;
    if (rule.isCurrentWithHeating())
      return Category.SelfHeating;
    if (rule.isMultiBranch())
      return Category.MultiBranch;
    if (rule.getRuleType().map(RuleType::isSingleBranch).orElse(false))
      return Category.SingleBranch;
    throw new ConversionException(rule.getName(), "Cannot determine monitor type for rule: " + rule.getName());
  }

  /** Lower-case, spaces and hyphens folded to underscores. */
  public static String slugify(String text) { return text.toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_'); }

  private Monitor lower(Rule rule, DeviceInfo device, Category category, ConversionContext ctx) throws ConversionException {
    MonitorKind kind = category.kind;
    if (!ctx.monitors().isRegistered(kind))
      logger.warn("UniversalConverter. Monitor kind {} of rule '{}' is not in the monitor library", kind, rule.getName());
    String slug = slugify(rule.getName());
    String modelName = kind.serialName + "_" + device.name() + "_" + slug;
    String section = "soacheck_" + device.name() + "_" + slug + "_shared";

    Optional<String> alias = ctx.monitors().timeLimitAlias(rule.getTimeLimit());
    if (alias.isEmpty())
      logger.warn("UniversalConverter. No tmaxfrac alias for time limit '{}' of rule '{}', omitting tmaxfrac", rule.getTimeLimit(),
                  rule.getName());
    checkTerminals(rule, device);
    MonitorSettings settings = settings(rule, category, ctx);
    return new Monitor(rule.getName(), modelName, section, device.name(), CommonParams.symbolic(alias.orElse(null)), settings);
  }

  private MonitorSettings settings(Rule rule, Category category, ConversionContext ctx) throws ConversionException {
    Constraint constraint = rule.getConstraint();
    Limits limits = new Limits(rule.getName(), ctx);
    switch (category) {
    case SingleBranch:
      return new MonitorSettings.SingleBranch(rule.getParameter(), rule.getMessage(),
                                              limits.lower(firstSet(bound(constraint, "vlow"), bound(constraint, "ilow"))),
                                              limits.lower(firstSet(bound(constraint, "vhigh"), bound(constraint, "ihigh"))));
    case SelfHeating: {
      SelfHeating sh = rule.getSelfHeating();
      if (sh == null)
        sh = new SelfHeating(LimitValue.of(SelfHeating.DEFAULT_DTMAX), LimitValue.of(SelfHeating.DEFAULT_THEAT), SelfHeating.DEFAULT_MONITOR);
      return new MonitorSettings.SelfHeatingCheck(limits.lower(sh.dtmax()), limits.lower(sh.theat()), sh.monitor(),
                                                  limits.lower(currentLimit(rule, "idc")), limits.lower(currentLimit(rule, "ipeak")),
                                                  limits.lower(currentLimit(rule, "irms")));
    }
    case MultiBranch: {
      if (rule.getBranches().size() > Branch.MAX_BRANCHES)
        throw new ConversionException(rule.getName(), String.format("Too many branches (%d), maximum is %d in rule %s", rule.getBranches().size(),
                                                                    Branch.MAX_BRANCHES, rule.getName()));
      List<Branch> branches = new ArrayList<>();
      for (int i = 0; i < rule.getBranches().size(); ++i) {
        Branch branch = rule.getBranches().get(i);
        branches.add(new Branch(branch.branch(), limits.lower(firstSet(branch.vhigh(), bound(constraint, "vhigh"))),
                                limits.lower(firstSet(branch.vlow(), bound(constraint, "vlow"))),
                                branch.message() != null ? branch.message() : "Branch" + (i + 1)));
      }
      return new MonitorSettings.MultiBranch(branches);
    }
    case StateDependent: {
      GateControl gc = rule.getGateControl();
      StateDetection detection = rule.getMonitorParams();
      return new MonitorSettings.StateDependent(limits.lower(bound(constraint, "vhigh_on")), limits.lower(bound(constraint, "vhigh_off")),
                                                gc == null ? null : limits.lower(gc.vhighGc()), gc == null ? null : limits.lower(gc.vlowGc()),
                                                detection == null ? StateDetection.DEFAULT_PARAM : detection.param(),
                                                detection == null ? LimitValue.of(0.0) : limits.lower(detection.vgt()),
                                                detection == null ? null : detection.pmosvthsign(),
                                                detection == null ? null : detection.inst2probe());
    }
    case TemperatureDependent: {
      TemperatureDependence td = rule.getTemperatureDependence();
      if (td == null)
        return new MonitorSettings.TemperatureDependent(rule.getParameter(), rule.getMessage(), limits.lower(bound(constraint, "vlow")),
                                                        limits.lower(bound(constraint, "vhigh")));
      LimitValue tref = td.referenceTemp() != null ? td.referenceTemp()
                                                   : ctx.global().getTemperature().getOrDefault("tref_soa", LimitValue.of(DEFAULT_TREF));
      String ref = operand(limits.lower(td.referenceValue()), false);
      String negRef = operand(limits.lower(td.referenceValue()), true);
      double c = td.tempCoefficient();
      String delta = Numbers.format(Math.abs(c)) + " * (T - " + operand(limits.lower(tref), false) + ")";
      String vhigh = c >= 0 ? ref + " + " + delta : ref + " - " + delta;
      String vlow = c >= 0 ? negRef + " - " + delta : negRef + " + " + delta;
      return new MonitorSettings.TemperatureDependent(rule.getParameter(), rule.getMessage(), LimitValue.expression(vlow),
                                                      LimitValue.expression(vhigh));
    }
    case Aging: {
      AgingCheck aging = rule.getAgingCheck();
      LinkedHashMap<String, LimitValue> coefficients = new LinkedHashMap<>();
      if (aging != null) {
        for (char key : AGING_KEYS.toCharArray()) {
          LimitValue value = aging.params().get(String.valueOf(key));
          if (value != null)
            coefficients.put(MonitorSettings.Aging.COEFFICIENT_PREFIX + key, renderFormula(rule.getName(), value));
        }
      }
      return new MonitorSettings.Aging("atype", coefficients);
    }
    case ParameterCheck: {
      StateDetection detection = rule.getMonitorParams();
      String param = rule.getParameter().isEmpty() ? StateDetection.DEFAULT_PARAM : rule.getParameter();
      if (detection != null)
        param = detection.param();
      return new MonitorSettings.ParameterCheck(param, detection == null ? null : limits.lower(detection.vgt()),
                                                limits.lower(bound(constraint, "vlow")), limits.lower(bound(constraint, "vhigh")));
    }
    default:
      throw new IllegalStateException("Unhandled category " + category);
    }
  }

  /** Renders formulas and folds constants, per rule. */
  private static class Limits {
    private final String ruleName;
    private final ConversionContext ctx;

    Limits(String ruleName, ConversionContext ctx) {
      this.ruleName = ruleName;
      this.ctx = ctx;
    }

    LimitValue lower(LimitValue value) throws ConversionException {
      if (value == null)
        return null;
      return ctx.evaluator().evaluate(renderFormula(ruleName, value), Map.of());
    }
  }

  private static LimitValue renderFormula(String ruleName, LimitValue value) throws ConversionException {
    try {
      return FormulaRenderer.toExpression(value);
    } catch (ExpressionException e) {
      throw new ConversionException(ruleName, e.getMessage() + " (rule " + ruleName + ")", e);
    }
  }

  /** {@code value} as an operand of a sum, optionally negated. */
  private static String operand(LimitValue value, boolean negate) {
    if (value.isNumeric()) {
      if (!negate)
        return Numbers.format(value.getNumber());
      return Numbers.format(-value.doubleValue());
    }
    String text = value.getExpression();
    return negate ? "-(" + text + ")" : "(" + text + ")";
  }

  private static LimitValue bound(Constraint constraint, String name) {
    return constraint == null ? null : constraint.setBounds().get(name);
  }

  private static LimitValue firstSet(LimitValue first, LimitValue second) { return first != null ? first : second; }

  private static LimitValue currentLimit(Rule rule, String type) {
    return rule.getConstraints().stream().filter(c -> type.equals(c.type())).map(CurrentConstraint::ihigh).findFirst().orElse(null);
  }

  /** Warns about voltage nodes of the measured quantity or branches that the device does not have. */
  private static void checkTerminals(Rule rule, DeviceInfo device) {
    List<String> quantities = new ArrayList<>();
    quantities.add(rule.getParameter());
    rule.getBranches().forEach(branch -> quantities.add(branch.branch() == null ? "" : branch.branch()));
    for (String quantity : quantities) {
      Matcher nodes = VOLTAGE_NODES.matcher(quantity.trim());
      if (!nodes.matches())
        continue;
      for (int group = 1; group <= 2; ++group) {
        String terminal = nodes.group(group);
        if (terminal != null && !device.hasTerminal(terminal))
          logger.warn("UniversalConverter. Device {} has no terminal '{}' referenced by rule '{}'", device.name(), terminal, rule.getName());
      }
    }
  }
}
