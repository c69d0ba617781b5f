package soadsl.model;

import java.util.Optional;
import java.util.stream.Stream;

/** The rule type tag of a universal rule. */
public enum RuleType {
  Voltage("voltage"),
  Current("current"),
  Range("range"),
  StateDependent("state_dependent"),
  MultiBranch("multi_branch"),
  CurrentWithHeating("current_with_heating"),
  Parameter("parameter"),
  Pwl("pwl"),
  Aging("aging"),
  /** Legacy single-bound tags. */
  VHigh("vhigh"),
  VLow("vlow"),
  IHigh("ihigh"),
  ILow("ilow");

  public final String serialName;

  private RuleType(String serialName) { this.serialName = serialName; }

  public static Optional<RuleType> fromSerialName(String serialName) {
    return Stream.of(RuleType.values()).filter(typeVal -> typeVal.serialName.equals(serialName)).findAny();
  }

  /** True for the tags lowered into a plain single-branch {@code ovcheck}. */
  public boolean isSingleBranch() {
    switch (this) {
    case Voltage:
    case Current:
    case Range:
    case VHigh:
    case VLow:
    case IHigh:
    case ILow:
      return true;
    default:
      return false;
    }
  }
}
