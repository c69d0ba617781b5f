package soadsl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A universal SOA rule, as written by the user. Immutable once built; absent blocks are null, absent lists empty.
 */
public class Rule {
  public static final String DEFAULT_TIME_LIMIT = "steady";

  private final String name;
  private final List<String> devices;
  private final String parameter;
  private final String type;
  private final String severity;
  private final String description;
  private final String message;
  private final String condition;
  private final String timeLimit;
  private final Constraint constraint;
  private final LinkedHashMap<String, Double> tmaxfrac;
  private final List<Branch> branches;
  private final GateControl gateControl;
  private final StateDetection monitorParams;
  private final AgingCheck agingCheck;
  private final List<CurrentConstraint> constraints;
  private final SelfHeating selfHeating;
  private final TemperatureDependence temperatureDependence;

  private Rule(Builder b) {
    this.name = b.name;
    this.devices = List.copyOf(b.devices);
    this.parameter = b.parameter;
    this.type = b.type;
    this.severity = b.severity;
    this.description = b.description;
    this.message = b.message;
    this.condition = b.condition;
    this.timeLimit = b.timeLimit;
    this.constraint = b.constraint;
    this.tmaxfrac = new LinkedHashMap<>(b.tmaxfrac);
    this.branches = List.copyOf(b.branches);
    this.gateControl = b.gateControl;
    this.monitorParams = b.monitorParams;
    this.agingCheck = b.agingCheck;
    this.constraints = List.copyOf(b.constraints);
    this.selfHeating = b.selfHeating;
    this.temperatureDependence = b.temperatureDependence;
  }

  public static Builder builder(String name) { return new Builder(name); }

  public String getName() { return name; }
  public List<String> getDevices() { return devices; }
  /** The monitored quantity, e.g. {@code v[d,s]}, {@code i[r1]}, {@code T} or {@code multi}. */
  public String getParameter() { return parameter; }
  public String getType() { return type; }
  public Optional<RuleType> getRuleType() { return RuleType.fromSerialName(type); }
  public String getSeverity() { return severity; }
  public String getDescription() { return description; }
  public String getMessage() { return message; }
  public String getCondition() { return condition; }
  public String getTimeLimit() { return timeLimit; }
  public Constraint getConstraint() { return constraint; }
  public Map<String, Double> getTmaxfrac() { return Collections.unmodifiableMap(tmaxfrac); }
  public List<Branch> getBranches() { return branches; }
  public GateControl getGateControl() { return gateControl; }
  public StateDetection getMonitorParams() { return monitorParams; }
  public AgingCheck getAgingCheck() { return agingCheck; }
  public List<CurrentConstraint> getConstraints() { return constraints; }
  public SelfHeating getSelfHeating() { return selfHeating; }
  public TemperatureDependence getTemperatureDependence() { return temperatureDependence; }

  public boolean isOfType(RuleType ruleType) { return ruleType.serialName.equals(type); }

  public boolean isStateDependent() { return isOfType(RuleType.StateDependent) || (constraint != null && constraint.isStateDependent()); }

  public boolean isTemperatureDependent() { return temperatureDependence != null || isOfType(RuleType.Pwl); }

  public boolean isMultiBranch() { return !branches.isEmpty() || isOfType(RuleType.MultiBranch); }

  public boolean isCurrentWithHeating() { return isOfType(RuleType.CurrentWithHeating); }

  @Override
  public String toString() {
    return String.format("Rule %s (%s, %s) on %s", name, type, severity, devices);
  }

  public static class Builder {
    private String name;
    private List<String> devices = new ArrayList<>();
    private String parameter = "";
    private String type = "";
    private String severity = "";
    private String description = "";
    private String message = null;
    private String condition = null;
    private String timeLimit = DEFAULT_TIME_LIMIT;
    private Constraint constraint = null;
    private LinkedHashMap<String, Double> tmaxfrac = new LinkedHashMap<>();
    private List<Branch> branches = new ArrayList<>();
    private GateControl gateControl = null;
    private StateDetection monitorParams = null;
    private AgingCheck agingCheck = null;
    private List<CurrentConstraint> constraints = new ArrayList<>();
    private SelfHeating selfHeating = null;
    private TemperatureDependence temperatureDependence = null;

    private Builder(String name) { this.name = name; }

    public Builder devices(List<String> devices) {
      this.devices = new ArrayList<>(devices);
      return this;
    }
    public Builder device(String device) {
      this.devices.add(device);
      return this;
    }
    public Builder parameter(String parameter) {
      this.parameter = parameter;
      return this;
    }
    public Builder type(String type) {
      this.type = type;
      return this;
    }
    public Builder type(RuleType type) { return type(type.serialName); }
    public Builder severity(String severity) {
      this.severity = severity;
      return this;
    }
    public Builder description(String description) {
      this.description = description;
      return this;
    }
    public Builder message(String message) {
      this.message = message;
      return this;
    }
    public Builder condition(String condition) {
      this.condition = condition;
      return this;
    }
    public Builder timeLimit(String timeLimit) {
      this.timeLimit = timeLimit;
      return this;
    }
    public Builder constraint(Constraint constraint) {
      this.constraint = constraint;
      return this;
    }
    public Builder tmaxfrac(Map<String, Double> tmaxfrac) {
      this.tmaxfrac = new LinkedHashMap<>(tmaxfrac);
      return this;
    }
    public Builder branches(List<Branch> branches) {
      this.branches = new ArrayList<>(branches);
      return this;
    }
    public Builder gateControl(GateControl gateControl) {
      this.gateControl = gateControl;
      return this;
    }
    public Builder monitorParams(StateDetection monitorParams) {
      this.monitorParams = monitorParams;
      return this;
    }
    public Builder agingCheck(AgingCheck agingCheck) {
      this.agingCheck = agingCheck;
      return this;
    }
    public Builder constraints(List<CurrentConstraint> constraints) {
      this.constraints = new ArrayList<>(constraints);
      return this;
    }
    public Builder selfHeating(SelfHeating selfHeating) {
      this.selfHeating = selfHeating;
      return this;
    }
    public Builder temperatureDependence(TemperatureDependence temperatureDependence) {
      this.temperatureDependence = temperatureDependence;
      return this;
    }

    public Rule build() { return new Rule(this); }
  }
}
