package soadsl.expr;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import soadsl.model.LimitValue;
import soadsl.util.Numbers;

/**
 * Evaluates, inspects and rewrites expressions of the SOA expression language against a table of global parameters.
 * <p>
 * Evaluation is a best-effort constant fold: anything that cannot be resolved to a finite number at compile time is handed
 * back unchanged and ends up in the netlist, where the simulator resolves it.
 */
public class ExpressionEvaluator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Context key prefix under which device parameters ({@code $w}) are bound. */
  public static final String DEVICE_PARAM_PREFIX = "$";

  private final Map<String, LimitValue> globals;

  public ExpressionEvaluator(Map<String, LimitValue> globals) { this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(globals)); }

  public ExpressionEvaluator() { this(Map.of()); }

  public Map<String, LimitValue> getGlobals() { return globals; }

  /**
   * Folds {@code value} to a number if every reference in it resolves against the globals and {@code context} (context bindings
   * take precedence). Variables bound to expressions are resolved recursively. Returns {@code value} itself otherwise.
   *
   * @param context extra bindings; device parameters are keyed with their {@code $} marker, temperature as {@code T} or
   *                {@code temp}
   */
  public LimitValue evaluate(LimitValue value, Map<String, LimitValue> context) {
    if (!value.isExpression())
      return value;
    OptionalDouble result = fold(value.getExpression(), context, new HashSet<>());
    return result.isPresent() ? LimitValue.of(result.getAsDouble()) : value;
  }

  public LimitValue evaluate(String expression, Map<String, LimitValue> context) {
    return evaluate(LimitValue.expression(expression), context);
  }

  public LimitValue evaluate(String expression) { return evaluate(expression, Map.of()); }

  private OptionalDouble fold(String expression, Map<String, LimitValue> context, Set<String> inProgress) {
    ExprNode tree;
    try {
      tree = Parser.parse(expression);
    } catch (ExpressionException e) {
      logger.debug("ExpressionEvaluator. Not folding '{}': {}", expression, e.getMessage());
      return OptionalDouble.empty();
    }
    OptionalDouble result = tree.eval(new BindingScope(context, inProgress));
    if (result.isPresent() && !Double.isFinite(result.getAsDouble()))
      return OptionalDouble.empty();
    return result;
  }

  private class BindingScope implements ExprNode.Scope {
    private final Map<String, LimitValue> context;
    private final Set<String> inProgress;

    BindingScope(Map<String, LimitValue> context, Set<String> inProgress) {
      this.context = context;
      this.inProgress = inProgress;
    }

    @Override
    public OptionalDouble variable(String name) {
      LimitValue bound = context.containsKey(name) ? context.get(name) : globals.get(name);
      return resolve(name, bound);
    }

    @Override
    public OptionalDouble deviceParameter(String name) {
      String key = DEVICE_PARAM_PREFIX + name;
      return resolve(key, context.get(key));
    }

    @Override
    public OptionalDouble temperature() {
      String key = context.containsKey("T") ? "T" : "temp";
      return resolve(key, context.get(key));
    }

    private OptionalDouble resolve(String name, LimitValue bound) {
      if (bound == null || bound.isFormula())
        return OptionalDouble.empty();
      if (bound.isNumeric())
        return OptionalDouble.of(bound.doubleValue());
      if (!inProgress.add(name)) {
        logger.warn("ExpressionEvaluator. Cyclic reference through '{}', leaving it unresolved.", name);
        return OptionalDouble.empty();
      }
      try {
        return fold(bound.getExpression(), context, inProgress);
      } finally {
        inProgress.remove(name);
      }
    }
  }

  /**
   * True iff {@code expression} lexes and contains no free identifier, device parameter, electrical reference or temperature
   * token. Function names and the conditional keywords do not count as free identifiers.
   */
  public boolean canEvaluate(String expression) {
    List<Token> tokens;
    try {
      tokens = Lexer.tokenize(expression);
    } catch (ExpressionException e) {
      return false;
    }
    for (Token token : tokens) {
      switch (token.type()) {
      case IDENT:
        if (!Functions.isFunction(token.value()))
          return false;
        break;
      case DEVICE_PARAM:
      case VOLTAGE_REF:
      case CURRENT_REF:
      case RMS_CURRENT_REF:
      case TEMP:
        return false;
      default:
        break;
      }
    }
    return true;
  }

  public boolean canEvaluate(LimitValue value) { return value.isNumeric() || (value.isExpression() && canEvaluate(value.getExpression())); }

  /** True iff {@code text} parses as one expression; free text like {@code Gate oxide stress} does not. */
  public static boolean isExpression(String text) {
    try {
      Parser.parse(text);
      return true;
    } catch (ExpressionException e) {
      return false;
    }
  }

  /** Plain identifiers of {@code expression} that are neither function names nor keywords, in order of appearance. */
  public static Set<String> freeIdentifiers(String expression) throws ExpressionException {
    Set<String> ret = new LinkedHashSet<>();
    for (Token token : Lexer.tokenize(expression)) {
      if (token.type() == TokenType.IDENT && !Functions.isFunction(token.value()))
        ret.add(token.value());
    }
    return ret;
  }

  /**
   * Rewrites {@code expression} to netlist syntax without evaluating it: {@code $w} to {@code w}, {@code v[d,s]} to
   * {@code V(d,s)}, {@code v[n]} to {@code V(n)}, {@code i[r1]} to {@code I(r1)}, {@code T} to {@code temp} and
   * {@code if C then A else B} to {@code (C) ? A : B}. Spacing between other tokens is kept.
   */
  public String toBackendSyntax(String expression) {
    List<Token> tokens;
    try {
      tokens = Lexer.tokenize(expression);
    } catch (ExpressionException e) {
      logger.debug("ExpressionEvaluator. Rewriting unlexable '{}' textually: {}", expression, e.getMessage());
      return rewriteTextually(expression);
    }
    return rewrite(expression, tokens, 0, tokens.size() - 1);
  }

  public String toBackendSyntax(LimitValue value) {
    if (value.isNumeric())
      return Numbers.format(value.getNumber());
    if (value.isExpression())
      return toBackendSyntax(value.getExpression());
    return value.toString();
  }

  /** Rewrites tokens [from, to) and the text between them. */
  private String rewrite(String text, List<Token> tokens, int from, int to) {
    StringBuilder out = new StringBuilder();
    int i = from;
    while (i < to) {
      Token token = tokens.get(i);
      if (i > from)
        out.append(text, tokens.get(i - 1).end(), token.start());
      if (token.type() == TokenType.IF) {
        int groupEnd = groupEnd(tokens, i, to);
        int[] split = conditionalSplit(tokens, i, groupEnd);
        if (split != null) {
          out.append('(').append(rewrite(text, tokens, i + 1, split[0]).trim()).append(") ? ");
          out.append(rewrite(text, tokens, split[0] + 1, split[1]).trim()).append(" : ");
          out.append(rewrite(text, tokens, split[1] + 1, groupEnd).trim());
          i = groupEnd;
          continue;
        }
      }
      out.append(rewriteToken(token));
      ++i;
    }
    return out.toString();
  }

  private static String rewriteToken(Token token) {
    switch (token.type()) {
    case DEVICE_PARAM:
      return token.value();
    case VOLTAGE_REF:
      return "V(" + token.value() + ")";
    case CURRENT_REF:
      return "I(" + token.value() + ")";
    case TEMP:
      return "temp";
    default:
      return token.source();
    }
  }

  /** End (exclusive) of the parenthesis group or argument containing token {@code start}. */
  private static int groupEnd(List<Token> tokens, int start, int to) {
    int depth = 0;
    for (int j = start; j < to; ++j) {
      TokenType type = tokens.get(j).type();
      if (type == TokenType.LPAREN)
        ++depth;
      else if (type == TokenType.RPAREN) {
        if (depth == 0)
          return j;
        --depth;
      } else if (type == TokenType.COMMA && depth == 0)
        return j;
    }
    return to;
  }

  /** Indices of the THEN and ELSE matching the IF at {@code ifIndex}, or null. Nested conditionals are skipped. */
  private static int[] conditionalSplit(List<Token> tokens, int ifIndex, int to) {
    int depth = 0;
    int nestedIfs = 0;
    int thenIndex = -1;
    for (int j = ifIndex + 1; j < to; ++j) {
      TokenType type = tokens.get(j).type();
      if (type == TokenType.LPAREN)
        ++depth;
      else if (type == TokenType.RPAREN)
        --depth;
      if (depth != 0)
        continue;
      if (type == TokenType.IF)
        ++nestedIfs;
      else if (type == TokenType.THEN && nestedIfs == 0 && thenIndex < 0)
        thenIndex = j;
      else if (type == TokenType.ELSE) {
        if (nestedIfs > 0)
          --nestedIfs;
        else if (thenIndex >= 0)
          return new int[] {thenIndex, j};
      }
    }
    return null;
  }

  private static String rewriteTextually(String expression) {
    String ret = expression.replaceAll("\\$([A-Za-z_][A-Za-z0-9_]*)", "$1");
    ret = ret.replaceAll("\\bv\\[([A-Za-z0-9_]+),([A-Za-z0-9_]+)\\]", "V($1,$2)");
    ret = ret.replaceAll("\\bv\\[([A-Za-z0-9_]+)\\]", "V($1)");
    ret = ret.replaceAll("\\bi\\[([A-Za-z0-9_]+)\\]", "I($1)");
    return ret.replaceAll("\\bT\\b", "temp");
  }

  /**
   * Replaces identifiers naming a known global with its value. Expression values are parenthesized. Other tokens and all spacing
   * stay as written; unlexable text is returned unchanged.
   */
  public String substituteGlobals(String expression) {
    List<Token> tokens;
    try {
      tokens = Lexer.tokenize(expression);
    } catch (ExpressionException e) {
      return expression;
    }
    StringBuilder out = new StringBuilder();
    int last = 0;
    for (int i = 0; i < tokens.size(); ++i) {
      Token token = tokens.get(i);
      if (token.type() != TokenType.IDENT)
        continue;
      boolean isCall = tokens.get(i + 1).type() == TokenType.LPAREN;
      LimitValue bound = globals.get(token.value());
      if (isCall || bound == null || bound.isFormula())
        continue;
      out.append(expression, last, token.start());
      out.append(bound.isNumeric() ? Numbers.format(bound.getNumber()) : "(" + bound.getExpression() + ")");
      last = token.end();
    }
    out.append(expression.substring(last));
    return out.toString();
  }

  /** The parts of an {@code if C then A else B} expression. */
  public static record Conditional(String condition, String then, String otherwise) {}

  /**
   * Splits a conditional expression into its parts.
   *
   * @throws ExpressionException if {@code expression} is not a well-formed conditional
   */
  public Conditional parseConditional(String expression) throws ExpressionException {
    List<Token> tokens = Lexer.tokenize(expression);
    if (tokens.get(0).type() != TokenType.IF)
      throw new ExpressionException("Invalid conditional syntax: " + expression);
    int end = tokens.size() - 1;
    int[] split = conditionalSplit(tokens, 0, end);
    if (split == null || split[0] == 1 || split[1] == split[0] + 1 || split[1] == end - 1)
      throw new ExpressionException("Invalid conditional syntax: " + expression);
    new Parser(tokens, expression).parse();
    return new Conditional(expression.substring(tokens.get(1).start(), tokens.get(split[0] - 1).end()),
                           expression.substring(tokens.get(split[0] + 1).start(), tokens.get(split[1] - 1).end()),
                           expression.substring(tokens.get(split[1] + 1).start(), tokens.get(end - 1).end()));
  }
}
