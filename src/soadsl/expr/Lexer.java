package soadsl.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. The token list always ends with {@link TokenType#EOF}.
 */
public class Lexer {
  private final String text;
  private int pos = 0;

  public Lexer(String text) { this.text = text; }

  public static List<Token> tokenize(String text) throws ExpressionException { return new Lexer(text).tokenize(); }

  public List<Token> tokenize() throws ExpressionException {
    List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = next();
      tokens.add(token);
    } while (token.type() != TokenType.EOF);
    return tokens;
  }

  private Token next() throws ExpressionException {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
      ++pos;
    if (pos >= text.length())
      return new Token(TokenType.EOF, "", "", pos);
    char c = text.charAt(pos);
    int start = pos;
    if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))))
      return number(start);
    if (isIdentStart(c))
      return identOrReference(start);
    if (c == '$') {
      ++pos;
      if (pos >= text.length() || !isIdentStart(text.charAt(pos)))
        throw new ExpressionException("Expected parameter name after '$' at " + start + " in '" + text + "'");
      String name = identifier();
      return new Token(TokenType.DEVICE_PARAM, text.substring(start, pos), name, start);
    }
    if (pos + 1 < text.length()) {
      String two = text.substring(pos, pos + 2);
      TokenType twoType = null;
      switch (two) {
      case "<=":
        twoType = TokenType.LE;
        break;
      case ">=":
        twoType = TokenType.GE;
        break;
      case "==":
        twoType = TokenType.EQ;
        break;
      case "!=":
        twoType = TokenType.NE;
        break;
      default:
        break;
      }
      if (twoType != null) {
        pos += 2;
        return new Token(twoType, two, two, start);
      }
    }
    TokenType oneType;
    switch (c) {
    case '+':
      oneType = TokenType.PLUS;
      break;
    case '-':
      oneType = TokenType.MINUS;
      break;
    case '*':
      oneType = TokenType.STAR;
      break;
    case '/':
      oneType = TokenType.SLASH;
      break;
    case '^':
      oneType = TokenType.CARET;
      break;
    case '<':
      oneType = TokenType.LT;
      break;
    case '>':
      oneType = TokenType.GT;
      break;
    case '(':
      oneType = TokenType.LPAREN;
      break;
    case ')':
      oneType = TokenType.RPAREN;
      break;
    case ',':
      oneType = TokenType.COMMA;
      break;
    default:
      throw new ExpressionException("Unexpected character '" + c + "' at " + start + " in '" + text + "'");
    }
    ++pos;
    return new Token(oneType, String.valueOf(c), String.valueOf(c), start);
  }

  private Token number(int start) {
    skipDigits();
    if (pos < text.length() && text.charAt(pos) == '.') {
      ++pos;
      skipDigits();
    }
    if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
      int exp = pos + 1;
      if (exp < text.length() && (text.charAt(exp) == '+' || text.charAt(exp) == '-'))
        ++exp;
      if (exp < text.length() && Character.isDigit(text.charAt(exp))) {
        pos = exp;
        skipDigits();
      }
    }
    String source = text.substring(start, pos);
    return new Token(TokenType.NUMBER, source, source, start);
  }

  private Token identOrReference(int start) throws ExpressionException {
    String name = identifier();
    if (pos < text.length() && text.charAt(pos) == '[') {
      switch (name) {
      case "v":
        return reference(start, TokenType.VOLTAGE_REF, 2);
      case "i":
        return reference(start, TokenType.CURRENT_REF, 1);
      case "i_rms":
        return reference(start, TokenType.RMS_CURRENT_REF, 1);
      default:
        throw new ExpressionException("Unknown reference '" + name + "[' at " + start + " in '" + text + "'");
      }
    }
    switch (name) {
    case "if":
      return new Token(TokenType.IF, name, name, start);
    case "then":
      return new Token(TokenType.THEN, name, name, start);
    case "else":
      return new Token(TokenType.ELSE, name, name, start);
    case "T":
    case "temp":
      return new Token(TokenType.TEMP, name, name, start);
    default:
      return new Token(TokenType.IDENT, name, name, start);
    }
  }

  /** Reads {@code [a]} or {@code [a,b]} (up to {@code maxNodes} names) following a reference prefix. */
  private Token reference(int start, TokenType type, int maxNodes) throws ExpressionException {
    int close = text.indexOf(']', pos);
    if (close < 0)
      throw new ExpressionException("Unterminated reference at " + start + " in '" + text + "'");
    String[] nodes = text.substring(pos + 1, close).split(",", -1);
    if (nodes.length > maxNodes)
      throw new ExpressionException("Too many nodes in reference at " + start + " in '" + text + "'");
    List<String> names = new ArrayList<>();
    for (String node : nodes) {
      String trimmed = node.trim();
      if (!trimmed.matches("[A-Za-z0-9_]+"))
        throw new ExpressionException("Invalid node name '" + trimmed + "' in reference at " + start + " in '" + text + "'");
      names.add(trimmed);
    }
    pos = close + 1;
    return new Token(type, text.substring(start, pos), String.join(",", names), start);
  }

  private String identifier() {
    int start = pos;
    while (pos < text.length() && isIdentPart(text.charAt(pos)))
      ++pos;
    return text.substring(start, pos);
  }

  private void skipDigits() {
    while (pos < text.length() && Character.isDigit(text.charAt(pos)))
      ++pos;
  }

  private static boolean isIdentStart(char c) { return Character.isLetter(c) || c == '_'; }
  private static boolean isIdentPart(char c) { return Character.isLetterOrDigit(c) || c == '_'; }
}
