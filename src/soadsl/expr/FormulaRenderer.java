package soadsl.expr;

import java.util.ArrayList;
import java.util.List;

import soadsl.model.LimitValue;
import soadsl.util.Numbers;

/**
 * Turns a structured limit formula into an expression of the expression language.
 */
public final class FormulaRenderer {
  public static final String LINEAR = "linear";

  private FormulaRenderer() {}

  /**
   * {@code linear} with parameters {@code [w, l]} and coefficients {@code [c1, c2]} renders as {@code $w * c1 + $l * c2}.
   *
   * @throws ExpressionException for an unknown formula name or mismatched parameter/coefficient lists
   */
  public static String render(LimitValue.Formula formula) throws ExpressionException {
    if (!LINEAR.equals(formula.name()))
      throw new ExpressionException("Unsupported limit formula: " + formula.name());
    if (formula.parameters().isEmpty() || formula.parameters().size() != formula.coefficients().size())
      throw new ExpressionException(String.format("Formula %s needs one coefficient per parameter, got %d parameters and %d coefficients",
                                                  formula.name(), formula.parameters().size(), formula.coefficients().size()));
    List<String> terms = new ArrayList<>();
    for (int i = 0; i < formula.parameters().size(); ++i) {
      String param = formula.parameters().get(i);
      if (!param.startsWith(ExpressionEvaluator.DEVICE_PARAM_PREFIX))
        param = ExpressionEvaluator.DEVICE_PARAM_PREFIX + param;
      terms.add(param + " * " + Numbers.format(formula.coefficients().get(i)));
    }
    return String.join(" + ", terms);
  }

  /** {@code value} with a formula replaced by its rendered expression; other forms unchanged. */
  public static LimitValue toExpression(LimitValue value) throws ExpressionException {
    if (value == null || !value.isFormula())
      return value;
    return LimitValue.expression(render(value.getFormula()));
  }
}
