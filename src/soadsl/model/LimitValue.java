package soadsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * A scalar bound as written in a rule document: either a number, an expression in the SOA expression language, or a structured
 * formula that the converter renders to an expression.
 * <p>
 * Instances are immutable. Numbers keep the {@link Number} the YAML loader produced, so integers stay integers on output.
 */
public final class LimitValue {

  public enum Form { NUMBER, EXPRESSION, FORMULA }

  /**
   * Structured limit specification, e.g. {@code {formula: linear, parameters: [w], coefficients: [1.5e-3]}}.
   */
  public static record Formula(String name, List<String> parameters, List<Number> coefficients) {
    public Formula {
      parameters = List.copyOf(parameters);
      coefficients = List.copyOf(coefficients);
    }
  }

  private final Form form;
  private final Number number;
  private final String expression;
  private final Formula formula;

  private LimitValue(Form form, Number number, String expression, Formula formula) {
    this.form = form;
    this.number = number;
    this.expression = expression;
    this.formula = formula;
  }

  public static LimitValue of(Number number) {
    return new LimitValue(Form.NUMBER, Objects.requireNonNull(number), null, null);
  }

  public static LimitValue of(double number) { return of(Double.valueOf(number)); }

  /**
   * Creates an expression value. Text that reads as a plain number (e.g. {@code "1e-7"}, which YAML 1.1 loads as a string) becomes a
   * {@link Form#NUMBER} value instead.
   */
  public static LimitValue expression(String text) {
    Objects.requireNonNull(text);
    String trimmed = text.trim();
    if (looksNumeric(trimmed))
      return of(Double.parseDouble(trimmed));
    return new LimitValue(Form.EXPRESSION, null, trimmed, null);
  }

  public static LimitValue formula(Formula formula) { return new LimitValue(Form.FORMULA, null, null, Objects.requireNonNull(formula)); }

  private static boolean looksNumeric(String text) {
    return !text.isEmpty() && text.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  }

  public Form getForm() { return form; }
  public boolean isNumeric() { return form == Form.NUMBER; }
  public boolean isExpression() { return form == Form.EXPRESSION; }
  public boolean isFormula() { return form == Form.FORMULA; }

  public Number getNumber() {
    if (form != Form.NUMBER)
      throw new IllegalStateException("Not a numeric limit: " + this);
    return number;
  }
  public double doubleValue() { return getNumber().doubleValue(); }

  public String getExpression() {
    if (form != Form.EXPRESSION)
      throw new IllegalStateException("Not an expression limit: " + this);
    return expression;
  }

  public Formula getFormula() {
    if (form != Form.FORMULA)
      throw new IllegalStateException("Not a formula limit: " + this);
    return formula;
  }

  /** Value for YAML output: the number, the expression text, or the formula as a map-like string. */
  public Object toYamlValue() {
    switch (form) {
    case NUMBER:
      return number;
    case EXPRESSION:
      return expression;
    default:
      LinkedHashMap<String, Object> asMap = new LinkedHashMap<>();
      asMap.put("formula", formula.name());
      asMap.put("parameters", formula.parameters());
      asMap.put("coefficients", formula.coefficients());
      return Collections.unmodifiableMap(asMap);
    }
  }

  @Override
  public String toString() {
    switch (form) {
    case NUMBER:
      return number.toString();
    case EXPRESSION:
      return expression;
    default:
      return formula.toString();
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(form, number == null ? null : number.doubleValue(), expression, formula);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    LimitValue other = (LimitValue)obj;
    if (form != other.form)
      return false;
    if (form == Form.NUMBER)
      return Double.compare(number.doubleValue(), other.number.doubleValue()) == 0;
    return Objects.equals(expression, other.expression) && Objects.equals(formula, other.formula);
  }
}
