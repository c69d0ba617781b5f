package soadsl.expr;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.Set;

/** The fixed function set of the expression language. */
public final class Functions {
  public static final Set<String> NAMES = Set.of("min", "max", "abs", "sqrt", "exp", "log", "log10", "sin", "cos", "tan", "pow");

  private Functions() {}

  public static boolean isFunction(String name) { return NAMES.contains(name); }

  /** Applies {@code name}; empty for an unknown name or a wrong argument count. */
  public static OptionalDouble apply(String name, double[] args) {
    switch (name) {
    case "min":
      return args.length == 0 ? OptionalDouble.empty() : Arrays.stream(args).min();
    case "max":
      return args.length == 0 ? OptionalDouble.empty() : Arrays.stream(args).max();
    case "pow":
      return args.length == 2 ? OptionalDouble.of(Math.pow(args[0], args[1])) : OptionalDouble.empty();
    default:
      break;
    }
    if (args.length != 1)
      return OptionalDouble.empty();
    double x = args[0];
    switch (name) {
    case "abs":
      return OptionalDouble.of(Math.abs(x));
    case "sqrt":
      return OptionalDouble.of(Math.sqrt(x));
    case "exp":
      return OptionalDouble.of(Math.exp(x));
    case "log":
      return OptionalDouble.of(Math.log(x));
    case "log10":
      return OptionalDouble.of(Math.log10(x));
    case "sin":
      return OptionalDouble.of(Math.sin(x));
    case "cos":
      return OptionalDouble.of(Math.cos(x));
    case "tan":
      return OptionalDouble.of(Math.tan(x));
    default:
      return OptionalDouble.empty();
    }
  }
}
