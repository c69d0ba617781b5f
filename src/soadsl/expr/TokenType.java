package soadsl.expr;

public enum TokenType {
  NUMBER,
  IDENT,
  /** {@code $w}: device instance parameter. */
  DEVICE_PARAM,
  /** {@code v[d,s]} or {@code v[n]}. */
  VOLTAGE_REF,
  /** {@code i[r1]}. */
  CURRENT_REF,
  /** {@code i_rms[r1]}. */
  RMS_CURRENT_REF,
  /** {@code T} or {@code temp}. */
  TEMP,
  IF,
  THEN,
  ELSE,
  PLUS,
  MINUS,
  STAR,
  SLASH,
  CARET,
  LT,
  LE,
  GT,
  GE,
  EQ,
  NE,
  LPAREN,
  RPAREN,
  COMMA,
  EOF;

  public boolean isReference() { return this == VOLTAGE_REF || this == CURRENT_REF || this == RMS_CURRENT_REF; }

  public boolean isComparison() { return this == LT || this == LE || this == GT || this == GE || this == EQ || this == NE; }
}
