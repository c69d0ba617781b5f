package soadsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kind-specific parameter set of a {@link Monitor}. Each implementation belongs to exactly one {@link MonitorKind}; a
 * {@link Visitor} dispatches over all of them.
 * <p>
 * Bounds are null when not set.
 */
public interface MonitorSettings {

  MonitorKind getKind();

  <R> R accept(Visitor<R> visitor);

  public interface Visitor<R> {
    R visit(SingleBranch settings);
    R visit(SelfHeatingCheck settings);
    R visit(MultiBranch settings);
    R visit(StateDependent settings);
    R visit(TemperatureDependent settings);
    R visit(Aging settings);
    R visit(ParameterCheck settings);
  }

  /** Plain {@code ovcheck} on one branch. */
  public static record SingleBranch(String branch, String message, LimitValue vlow, LimitValue vhigh) implements MonitorSettings {
    @Override
    public MonitorKind getKind() { return MonitorKind.Ovcheck; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }

  /** {@code ovcheck} driving a self-heating monitor with up to three current limits. */
  public static record SelfHeatingCheck(LimitValue dtmax, LimitValue theat, String monitor, LimitValue idcHigh, LimitValue ipeakHigh,
                                        LimitValue irmsHigh) implements MonitorSettings {
    @Override
    public MonitorKind getKind() { return MonitorKind.Ovcheck; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }

  /** {@code ovcheck6}; branch i of the list is rendered with index i+1. */
  public static record MultiBranch(List<Branch> branches) implements MonitorSettings {
    public MultiBranch {
      branches = List.copyOf(branches);
    }
    @Override
    public MonitorKind getKind() { return MonitorKind.Ovcheck6; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }

  /** {@code ovcheckva_mos2}. {@code pmosvthsign} and {@code inst2probe} are null unless the rule sets {@code monitor_params}. */
  public static record StateDependent(LimitValue vhighOn, LimitValue vhighOff, LimitValue vhighGc, LimitValue vlowGc, String param,
                                      LimitValue vgt, Integer pmosvthsign, String inst2probe) implements MonitorSettings {
    @Override
    public MonitorKind getKind() { return MonitorKind.OvcheckvaMos2; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }

  public static record TemperatureDependent(String branch, String message, LimitValue vlow, LimitValue vhigh) implements MonitorSettings {
    @Override
    public MonitorKind getKind() { return MonitorKind.OvcheckvaPwl; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }

  /** HCI/TDDB aging. Coefficient keys are the full parameter names, e.g. {@code soa_hcitddb_a}. */
  public static record Aging(String atype, Map<String, LimitValue> coefficients) implements MonitorSettings {
    public static final String COEFFICIENT_PREFIX = "soa_hcitddb_";

    public Aging {
      coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }
    @Override
    public MonitorKind getKind() { return MonitorKind.OvcheckvaLdmosHciTddb; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }

  public static record ParameterCheck(String param, LimitValue vgt, LimitValue vlow, LimitValue vhigh) implements MonitorSettings {
    @Override
    public MonitorKind getKind() { return MonitorKind.Parcheckva3; }
    @Override
    public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
  }
}
