package soadsl.expr;

/**
 * Malformed expression text. Thrown by the lexer and parser; the evaluator turns it into pass-through everywhere except
 * {@link ExpressionEvaluator#parseConditional(String)}.
 */
public class ExpressionException extends Exception {
  private static final long serialVersionUID = 1L;

  public ExpressionException(String message) { super(message); }
}
