package soadsl.expr;

import java.util.List;
import java.util.OptionalDouble;
import java.util.function.DoubleBinaryOperator;

/**
 * Parsed expression tree. Evaluation yields an empty result as soon as any leaf cannot be resolved in the given scope.
 */
public interface ExprNode {

  OptionalDouble eval(Scope scope);

  /** Value bindings visible to an evaluation. */
  public interface Scope {
    OptionalDouble variable(String name);
    OptionalDouble deviceParameter(String name);
    OptionalDouble temperature();
  }

  public static record Num(double value) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) { return OptionalDouble.of(value); }
  }

  public static record Variable(String name) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) { return scope.variable(name); }
  }

  public static record DeviceParam(String name) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) { return scope.deviceParameter(name); }
  }

  /** Electrical quantity, only known at simulation time. */
  public static record Probe(TokenType kind, String nodes) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) { return OptionalDouble.empty(); }
  }

  public static record Temperature() implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) { return scope.temperature(); }
  }

  public static record Negate(ExprNode operand) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) {
      OptionalDouble val = operand.eval(scope);
      return val.isPresent() ? OptionalDouble.of(-val.getAsDouble()) : val;
    }
  }

  public static record Binary(TokenType op, ExprNode left, ExprNode right) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) {
      OptionalDouble l = left.eval(scope);
      if (l.isEmpty())
        return l;
      OptionalDouble r = right.eval(scope);
      if (r.isEmpty())
        return r;
      return OptionalDouble.of(operator().applyAsDouble(l.getAsDouble(), r.getAsDouble()));
    }

    private DoubleBinaryOperator operator() {
      switch (op) {
      case PLUS:
        return (a, b) -> a + b;
      case MINUS:
        return (a, b) -> a - b;
      case STAR:
        return (a, b) -> a * b;
      case SLASH:
        return (a, b) -> a / b;
      case CARET:
        return Math::pow;
      case LT:
        return (a, b) -> a < b ? 1 : 0;
      case LE:
        return (a, b) -> a <= b ? 1 : 0;
      case GT:
        return (a, b) -> a > b ? 1 : 0;
      case GE:
        return (a, b) -> a >= b ? 1 : 0;
      case EQ:
        return (a, b) -> a == b ? 1 : 0;
      case NE:
        return (a, b) -> a != b ? 1 : 0;
      default:
        throw new IllegalStateException("Not a binary operator: " + op);
      }
    }
  }

  public static record Call(String function, List<ExprNode> args) implements ExprNode {
    public Call {
      args = List.copyOf(args);
    }

    @Override
    public OptionalDouble eval(Scope scope) {
      double[] values = new double[args.size()];
      for (int i = 0; i < values.length; ++i) {
        OptionalDouble val = args.get(i).eval(scope);
        if (val.isEmpty())
          return val;
        values[i] = val.getAsDouble();
      }
      return Functions.apply(function, values);
    }
  }

  public static record Conditional(ExprNode condition, ExprNode then, ExprNode otherwise) implements ExprNode {
    @Override
    public OptionalDouble eval(Scope scope) {
      OptionalDouble cond = condition.eval(scope);
      if (cond.isEmpty())
        return cond;
      return cond.getAsDouble() != 0 ? then.eval(scope) : otherwise.eval(scope);
    }
  }
}
