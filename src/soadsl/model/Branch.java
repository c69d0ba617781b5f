package soadsl.model;

/**
 * One electrical branch of a multi-branch rule, e.g. {@code V(d,s)}, with its own bounds and violation message.
 */
public record Branch(String branch, LimitValue vhigh, LimitValue vlow, String message) {
  /** Maximum number of branches a single {@code ovcheck6} monitor can observe. */
  public static final int MAX_BRANCHES = 6;

  public boolean hasBranch() { return branch != null && !branch.isEmpty(); }
}
