package soadsl.expr;

/**
 * @param source the exact source text of the token
 * @param value  the payload: identifier or parameter name, the node list of a voltage reference ({@code d,s}), the element of a
 *               current reference; the source text otherwise
 * @param start  offset of the first character in the lexed text
 */
public record Token(TokenType type, String source, String value, int start) {
  public int end() { return start + source.length(); }

  @Override
  public String toString() {
    return type + "'" + source + "'@" + start;
  }
}
