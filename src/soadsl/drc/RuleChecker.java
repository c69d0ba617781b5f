package soadsl.drc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import soadsl.expr.ExpressionEvaluator;
import soadsl.expr.ExpressionException;
import soadsl.model.Branch;
import soadsl.model.Constraint;
import soadsl.model.GlobalConfig;
import soadsl.model.LimitValue;
import soadsl.model.Rule;
import soadsl.model.RuleType;
import soadsl.model.Severity;
import soadsl.model.UniversalDocument;

/**
 * Semantic checks on a universal document. All checks run on every rule; nothing is modified and nothing is thrown.
 */
public class RuleChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final Set<String> KNOWN_DEVICES =
      Set.of("nmos_core", "pmos_core", "nmos_5v", "pmos_5v", "nmos90_10hv", "pmos90_10hv", "nmos90b_10hv", "pmos90b_10hv", "nmoshs45_10hv",
             "pmoshs45_10hv", "nmoshs45b_10hv", "pmoshs45b_10hv", "dz5", "npn_b", "pnp_b", "poly_10hv", "rm1_10hv", "rm2_10hv", "rm3_10hv",
             "rm4_10hv", "rulm_10hv", "ralcap_10hv", "rphv_10hv", "cap_low", "cap_mid", "cap_high", "diode_n", "diode_p", "bandgap_ref",
             "temp_sensor");

  private static final List<Pattern> PARAMETER_SHAPES =
      Stream.of("v\\[[a-z_]+,[a-z_]+\\]", "v\\[[a-z_]+\\]", "i\\[[a-z_0-9]+\\]", "i_rms\\[[a-z_0-9]+\\]", "T", "temp", "multi")
          .map(Pattern::compile)
          .toList();
  private static final Pattern BRANCH_SHAPE = Pattern.compile("V\\([a-z_]+(?:,[a-z_]+)?\\)");
  private static final Pattern LEVEL_SUFFIX = Pattern.compile("(\\d+)$");

  private final Set<String> knownDevices;

  public RuleChecker(Set<String> knownDevices) { this.knownDevices = Set.copyOf(knownDevices); }

  public RuleChecker() { this(KNOWN_DEVICES); }

  /** Diagnostics collected by one {@link RuleChecker#check} call. */
  private static class Findings {
    final List<Diagnostic> errors = new ArrayList<>();
    final List<Diagnostic> warnings = new ArrayList<>();

    void error(String subject, String message) { errors.add(new Diagnostic(subject, Diagnostic.Level.ERROR, message)); }
    void warning(String subject, String message) { warnings.add(new Diagnostic(subject, Diagnostic.Level.WARNING, message)); }
  }

  public ValidationReport check(UniversalDocument document) {
    Findings findings = new Findings();
    GlobalConfig global = document.getGlobal();
    checkGlobal(global, findings);
    Set<String> globals = global.globalParameters().keySet();
    for (Rule rule : document.getRules())
      checkRule(rule, globals, findings);
    checkDuplicateNames(document.getRules(), findings);

    ValidationReport report = new ValidationReport(findings.errors, findings.warnings);
    report.getDiagnostics().forEach(diag -> logger.debug("RuleChecker. {}", diag));
    logger.info("RuleChecker. Checked {} rules: {} errors, {} warnings", document.getRules().size(), report.getErrors().size(),
                report.getWarnings().size());
    return report;
  }

  private void checkGlobal(GlobalConfig global, Findings findings) {
    for (String key : GlobalConfig.TIMING_KEYS) {
      if (!global.getTiming().containsKey(key))
        findings.warning("global", "Missing timing parameter: " + key);
    }
    for (String level : GlobalConfig.TMAXFRAC_LEVELS) {
      if (!global.getTmaxfrac().containsKey(level))
        findings.warning("global", "Missing tmaxfrac: " + level);
    }
    checkTmaxfracOrder("global", global.getTmaxfrac(), findings);
  }

  private void checkRule(Rule rule, Set<String> globals, Findings findings) {
    String name = rule.getName().isEmpty() ? "unnamed" : rule.getName();
    if (rule.getName().isEmpty())
      findings.error(name, "Rule name is required");
    if (rule.getDevices().isEmpty())
      findings.error(name, "Device type is required");
    if (rule.getParameter().isEmpty())
      findings.error(name, "Parameter is required");
    if (rule.getType().isEmpty())
      findings.error(name, "Rule type is required");
    if (rule.getSeverity().isEmpty())
      findings.error(name, "Severity is required");

    for (String device : rule.getDevices()) {
      if (!isKnownDevice(device))
        findings.warning(name, "Unknown device type: " + device);
    }
    if (!rule.getType().isEmpty() && rule.getRuleType().isEmpty())
      findings.error(name, "Invalid rule type: " + rule.getType());
    if (!rule.getSeverity().isEmpty() && Severity.fromSerialName(rule.getSeverity()).isEmpty())
      findings.error(name, "Invalid severity: " + rule.getSeverity());
    if (!rule.getParameter().isEmpty() && PARAMETER_SHAPES.stream().noneMatch(shape -> shape.matcher(rule.getParameter()).matches()))
      findings.warning(name, "Unusual parameter format: " + rule.getParameter());

    if (rule.getConstraint() != null) {
      checkConstraint(name, rule.getConstraint(), findings);
      checkExpressions(name, rule.getConstraint(), globals, findings);
    }
    if (rule.getCondition() != null)
      checkExpression(name, "condition", rule.getCondition(), globals, findings);
    checkBranches(name, rule.getBranches(), findings);
    checkTmaxfracOrder(name, rule.getTmaxfrac(), findings);

    if (rule.isStateDependent())
      checkStateDependent(name, rule, findings);
    if (rule.isMultiBranch()) {
      if (rule.getBranches().isEmpty())
        findings.error(name, "Multi-branch rule must have branches");
      if (rule.getBranches().size() > Branch.MAX_BRANCHES)
        findings.error(name, String.format("Too many branches (%d), maximum is %d", rule.getBranches().size(), Branch.MAX_BRANCHES));
    }
    if (rule.isCurrentWithHeating()) {
      if (rule.getConstraints().isEmpty())
        findings.error(name, "Current with heating rule must have constraints");
      if (rule.getSelfHeating() == null)
        findings.warning(name, "Current with heating rule should have self_heating");
    }
    if (rule.isOfType(RuleType.Aging) && rule.getAgingCheck() == null)
      findings.error(name, "Aging rule must have aging_check");
  }

  /** Exact match, or either name is a prefix of the other. */
  private boolean isKnownDevice(String device) {
    if (device.isBlank())
      return false;
    if (knownDevices.contains(device))
      return true;
    return knownDevices.stream().anyMatch(known -> device.startsWith(known) || known.startsWith(device));
  }

  private static void checkConstraint(String name, Constraint constraint, Findings findings) {
    if (!constraint.hasAnyBound())
      findings.error(name, "Constraint must specify at least one limit");
    LimitValue vhigh = constraint.vhigh();
    LimitValue vlow = constraint.vlow();
    if (vhigh != null && vlow != null && vhigh.isNumeric() && vlow.isNumeric() && vhigh.doubleValue() <= vlow.doubleValue())
      findings.error(name, "vhigh (" + vhigh + ") must be greater than vlow (" + vlow + ")");
  }

  private static void checkBranches(String name, List<Branch> branches, Findings findings) {
    for (int i = 0; i < branches.size(); ++i) {
      Branch branch = branches.get(i);
      if (!branch.hasBranch()) {
        findings.error(name, "Branch " + (i + 1) + " missing branch specification");
        continue;
      }
      if (!BRANCH_SHAPE.matcher(branch.branch()).matches())
        findings.warning(name, "Unusual branch format: " + branch.branch());
      if (branch.vhigh() == null && branch.vlow() == null)
        findings.error(name, "Branch " + branch.branch() + " must specify vhigh or vlow");
    }
  }

  /** Keys must appear in strictly ascending order of their numeric suffix ({@code level0}, {@code level1}, ...). */
  private static void checkTmaxfracOrder(String name, Map<String, Double> tmaxfrac, Findings findings) {
    long previous = Long.MIN_VALUE;
    for (String key : tmaxfrac.keySet()) {
      Matcher suffix = LEVEL_SUFFIX.matcher(key);
      if (!suffix.find()) {
        findings.error(name, "Invalid tmaxfrac level key: " + key);
        return;
      }
      long level = Long.parseLong(suffix.group(1));
      if (level <= previous) {
        findings.error(name, "tmaxfrac levels must be in ascending order");
        return;
      }
      previous = level;
    }
  }

  private static void checkExpressions(String name, Constraint constraint, Set<String> globals, Findings findings) {
    for (Map.Entry<String, LimitValue> bound : constraint.setBounds().entrySet()) {
      if (bound.getValue().isExpression())
        checkExpression(name, bound.getKey(), bound.getValue().getExpression(), globals, findings);
    }
  }

  /** Warns if {@code expression}, found under {@code field}, is malformed or references undeclared globals. */
  private static void checkExpression(String name, String field, String expression, Set<String> globals, Findings findings) {
    Set<String> identifiers;
    try {
      identifiers = ExpressionEvaluator.freeIdentifiers(expression);
    } catch (ExpressionException e) {
      findings.warning(name, "Malformed expression in " + field + ": " + e.getMessage());
      return;
    }
    for (String identifier : identifiers) {
      if (!globals.contains(identifier))
        findings.warning(name, "Undefined variable in " + field + ": " + identifier);
    }
  }

  private static void checkStateDependent(String name, Rule rule, Findings findings) {
    Constraint constraint = rule.getConstraint();
    if (constraint == null) {
      findings.error(name, "State-dependent rule must have constraint");
    } else if (!constraint.isStateDependent()) {
      findings.error(name, "State-dependent rule must specify vhigh_on or vhigh_off");
    }
    if (rule.getGateControl() == null)
      findings.warning(name, "State-dependent rule should have gate_control");
  }

  private static void checkDuplicateNames(List<Rule> rules, Findings findings) {
    Map<String, Integer> firstSeen = new HashMap<>();
    for (int i = 0; i < rules.size(); ++i) {
      String name = rules.get(i).getName();
      if (name.isEmpty())
        continue;
      Integer first = firstSeen.putIfAbsent(name, i + 1);
      if (first != null)
        findings.error(name, "Duplicate rule name (also at rule " + first + ")");
    }
  }
}
