package soadsl.model;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * The six checker models the generated netlist can instantiate.
 */
public enum MonitorKind {
  /** Single-branch voltage/current check; also carries the self-heating variant. */
  Ovcheck("ovcheck"),
  /** Up to six branches in one checker. */
  Ovcheck6("ovcheck6"),
  /** State-dependent MOS check (on/off limits, gate control). */
  OvcheckvaMos2("ovcheckva_mos2"),
  /** Temperature-dependent (piecewise linear) limits. */
  OvcheckvaPwl("ovcheckva_pwl"),
  /** LDMOS HCI/TDDB aging check. */
  OvcheckvaLdmosHciTddb("ovcheckva_ldmos_hci_tddb"),
  /** Device parameter check. */
  Parcheckva3("parcheckva3");

  public final String serialName;

  private MonitorKind(String serialName) { this.serialName = serialName; }

  public static Optional<MonitorKind> fromSerialName(String serialName) {
    return Stream.of(MonitorKind.values()).filter(kindVal -> kindVal.serialName.equals(serialName)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
