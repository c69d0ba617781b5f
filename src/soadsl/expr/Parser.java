package soadsl.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser over the token list of one expression.
 *
 * <pre>
 * expr        := conditional | comparison
 * conditional := 'if' comparison 'then' expr 'else' expr
 * comparison  := additive (CMP additive)?
 * additive    := term (('+'|'-') term)*
 * term        := unary (('*'|'/') unary)*
 * unary       := ('-'|'+') unary | power
 * power       := primary ('^' unary)?
 * primary     := NUMBER | IDENT | DEVICE_PARAM | reference | TEMP | IDENT '(' args ')' | '(' expr ')'
 * </pre>
 */
public class Parser {
  private final List<Token> tokens;
  private final String text;
  private int pos = 0;

  public Parser(List<Token> tokens, String text) {
    this.tokens = tokens;
    this.text = text;
  }

  public static ExprNode parse(String text) throws ExpressionException { return new Parser(Lexer.tokenize(text), text).parse(); }

  public ExprNode parse() throws ExpressionException {
    ExprNode ret = expr();
    if (peek().type() != TokenType.EOF)
      throw error("Unexpected " + peek().source());
    return ret;
  }

  private ExprNode expr() throws ExpressionException {
    if (peek().type() == TokenType.IF) {
      advance();
      ExprNode condition = comparison();
      expect(TokenType.THEN);
      ExprNode then = expr();
      expect(TokenType.ELSE);
      ExprNode otherwise = expr();
      return new ExprNode.Conditional(condition, then, otherwise);
    }
    return comparison();
  }

  private ExprNode comparison() throws ExpressionException {
    ExprNode left = additive();
    if (peek().type().isComparison()) {
      TokenType op = advance().type();
      return new ExprNode.Binary(op, left, additive());
    }
    return left;
  }

  private ExprNode additive() throws ExpressionException {
    ExprNode left = term();
    while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
      TokenType op = advance().type();
      left = new ExprNode.Binary(op, left, term());
    }
    return left;
  }

  private ExprNode term() throws ExpressionException {
    ExprNode left = unary();
    while (peek().type() == TokenType.STAR || peek().type() == TokenType.SLASH) {
      TokenType op = advance().type();
      left = new ExprNode.Binary(op, left, unary());
    }
    return left;
  }

  private ExprNode unary() throws ExpressionException {
    if (peek().type() == TokenType.MINUS) {
      advance();
      return new ExprNode.Negate(unary());
    }
    if (peek().type() == TokenType.PLUS) {
      advance();
      return unary();
    }
    return power();
  }

  private ExprNode power() throws ExpressionException {
    ExprNode base = primary();
    if (peek().type() == TokenType.CARET) {
      advance();
      return new ExprNode.Binary(TokenType.CARET, base, unary());
    }
    return base;
  }

  private ExprNode primary() throws ExpressionException {
    Token token = advance();
    switch (token.type()) {
    case NUMBER:
      try {
        return new ExprNode.Num(Double.parseDouble(token.source()));
      } catch (NumberFormatException e) {
        throw error("Bad number " + token.source());
      }
    case DEVICE_PARAM:
      return new ExprNode.DeviceParam(token.value());
    case VOLTAGE_REF:
    case CURRENT_REF:
    case RMS_CURRENT_REF:
      return new ExprNode.Probe(token.type(), token.value());
    case TEMP:
      return new ExprNode.Temperature();
    case IDENT:
      if (peek().type() == TokenType.LPAREN) {
        advance();
        List<ExprNode> args = new ArrayList<>();
        if (peek().type() != TokenType.RPAREN) {
          args.add(expr());
          while (peek().type() == TokenType.COMMA) {
            advance();
            args.add(expr());
          }
        }
        expect(TokenType.RPAREN);
        return new ExprNode.Call(token.value(), args);
      }
      return new ExprNode.Variable(token.value());
    case LPAREN:
      ExprNode inner = expr();
      expect(TokenType.RPAREN);
      return inner;
    default:
      throw error("Unexpected " + (token.type() == TokenType.EOF ? "end of expression" : token.source()));
    }
  }

  private Token peek() { return tokens.get(pos); }

  private Token advance() {
    Token ret = tokens.get(pos);
    if (ret.type() != TokenType.EOF)
      ++pos;
    return ret;
  }

  private void expect(TokenType type) throws ExpressionException {
    if (peek().type() != type)
      throw error("Expected " + type + " but found " + (peek().type() == TokenType.EOF ? "end of expression" : peek().source()));
    advance();
  }

  private ExpressionException error(String what) {
    return new ExpressionException(what + " at " + peek().start() + " in '" + text + "'");
  }
}
