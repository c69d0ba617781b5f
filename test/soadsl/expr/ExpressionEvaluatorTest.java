package soadsl.expr;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import soadsl.model.LimitValue;

class ExpressionEvaluatorTest {

  private final ExpressionEvaluator evaluator =
      new ExpressionEvaluator(Map.of("vmax", LimitValue.of(5), "vref", LimitValue.expression("vmax - 1"), "a", LimitValue.expression("b"),
                                     "b", LimitValue.expression("a")));

  @Test
  void testFoldsConstants() {
    Assertions.assertEquals(LimitValue.of(7.0), evaluator.evaluate("2 * 3 + 1"));
    Assertions.assertEquals(LimitValue.of(8.0), evaluator.evaluate("2 ^ 3"));
    Assertions.assertEquals(LimitValue.of(3.0), evaluator.evaluate("max(1, 3, 2)"));
    Assertions.assertEquals(LimitValue.of(-4.0), evaluator.evaluate("-(2 + 2)"));
  }

  @Test
  void testResolvesGlobalsRecursively() {
    Assertions.assertEquals(LimitValue.of(10.0), evaluator.evaluate("vmax * 2"));
    Assertions.assertEquals(LimitValue.of(8.0), evaluator.evaluate("vref * 2"));
  }

  @Test
  void testCyclicGlobalsStayUnresolved() {
    LimitValue result = evaluator.evaluate("a + 1");
    Assertions.assertTrue(result.isExpression());
    Assertions.assertEquals("a + 1", result.getExpression());
  }

  @Test
  void testUnresolvedReferencesPassThrough() {
    Assertions.assertEquals(LimitValue.expression("vmax + $w"), evaluator.evaluate("vmax + $w"));
    Assertions.assertEquals(LimitValue.expression("v[d,s] * 2"), evaluator.evaluate("v[d,s] * 2"));
    Assertions.assertEquals(LimitValue.expression("undefined_limit"), evaluator.evaluate("undefined_limit"));
  }

  @Test
  void testContextBindings() {
    Assertions.assertEquals(LimitValue.of(7.0), evaluator.evaluate("vmax + $w", Map.of("$w", LimitValue.of(2))));
    Assertions.assertEquals(LimitValue.of(5.0), evaluator.evaluate("if T > 100 then 5 else 6", Map.of("T", LimitValue.of(125))));
    Assertions.assertEquals(LimitValue.of(6.0), evaluator.evaluate("if temp > 100 then 5 else 6", Map.of("temp", LimitValue.of(25))));
    // context shadows globals
    Assertions.assertEquals(LimitValue.of(1.0), evaluator.evaluate("vmax", Map.of("vmax", LimitValue.of(1))));
  }

  @ParameterizedTest
  @ValueSource(strings = {"1 / 0", "log(0)", "sqrt(-1)", "2 *", "v[d,s,b]", "5 # 3"})
  void testNonFiniteOrMalformedStayExpressions(String text) {
    Assertions.assertFalse(evaluator.evaluate(text).isNumeric());
  }

  @Test
  void testNumbersPassThrough() {
    Assertions.assertEquals(LimitValue.of(3), evaluator.evaluate(LimitValue.of(3), Map.of()));
  }

  @Test
  void testCanEvaluate() {
    Assertions.assertTrue(evaluator.canEvaluate("2 * 3"));
    Assertions.assertTrue(evaluator.canEvaluate("max(1, 2)"));
    Assertions.assertFalse(evaluator.canEvaluate("vmax"));
    Assertions.assertFalse(evaluator.canEvaluate("v[d,s]"));
    Assertions.assertFalse(evaluator.canEvaluate("$w * 2"));
    Assertions.assertFalse(evaluator.canEvaluate("T"));
    Assertions.assertFalse(evaluator.canEvaluate("5 # 3"));
    Assertions.assertTrue(evaluator.canEvaluate(LimitValue.of(1.5)));
  }

  @Test
  void testFreeIdentifiers() throws ExpressionException {
    Assertions.assertEquals(Set.of("vmax", "a"), ExpressionEvaluator.freeIdentifiers("vmax * max(a, 2) + $w - v[d,s] + T"));
    Assertions.assertEquals(List.of("b", "a"), List.copyOf(ExpressionEvaluator.freeIdentifiers("b + a + b")));
    Assertions.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.freeIdentifiers("5 # 3"));
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {"$w * 2|w * 2", "v[d,s] > 5|V(d,s) > 5", "v[g]|V(g)", "i[r1] * 2|I(r1) * 2",
                                       "vmax - 0.01 * (T - 25)|vmax - 0.01 * (temp - 25)", "if T > 100 then 5 else 6|(temp > 100) ? 5 : 6",
                                       "if T > 150 then 3 else if T > 100 then 4 else 5|(temp > 150) ? 3 : (temp > 100) ? 4 : 5",
                                       "max(if T > 0 then 1 else 2, 3)|max((temp > 0) ? 1 : 2, 3)"})
  void testBackendSyntax(String expression, String expected) {
    Assertions.assertEquals(expected, evaluator.toBackendSyntax(expression));
  }

  @Test
  void testBackendSyntaxOfValues() {
    Assertions.assertEquals("5", evaluator.toBackendSyntax(LimitValue.of(Integer.valueOf(5))));
    Assertions.assertEquals("5.0", evaluator.toBackendSyntax(LimitValue.of(5)));
    Assertions.assertEquals("0.0000001", evaluator.toBackendSyntax(LimitValue.of(1e-7)));
    Assertions.assertEquals("global_tmin", evaluator.toBackendSyntax(LimitValue.expression("global_tmin")));
  }

  @Test
  void testSubstituteGlobals() {
    Assertions.assertEquals("5.0 * 2", evaluator.substituteGlobals("vmax * 2"));
    Assertions.assertEquals("(vmax - 1) + other", evaluator.substituteGlobals("vref + other"));
    Assertions.assertEquals("max(5.0, 1)", evaluator.substituteGlobals("max(vmax, 1)"));
  }

  @Test
  void testParseConditional() throws ExpressionException {
    ExpressionEvaluator.Conditional parts = evaluator.parseConditional("if T > 100 then vmax else vmax - 1");
    Assertions.assertEquals("T > 100", parts.condition());
    Assertions.assertEquals("vmax", parts.then());
    Assertions.assertEquals("vmax - 1", parts.otherwise());
  }

  @ParameterizedTest
  @ValueSource(strings = {"5 + 1", "if T > 100 then 5", "if then 5 else 6", "if T > 100 then else 6", "if T > 100 then 5 else"})
  void testParseConditionalRejectsMalformed(String text) {
    Assertions.assertThrows(ExpressionException.class, () -> evaluator.parseConditional(text));
  }

  @Test
  void testLinearFormula() throws ExpressionException {
    LimitValue.Formula formula = new LimitValue.Formula("linear", List.of("w", "$l"), List.of(0.5, 2));
    Assertions.assertEquals("$w * 0.5 + $l * 2", FormulaRenderer.render(formula));
    Assertions.assertEquals(LimitValue.of(3.0), evaluator.evaluate(FormulaRenderer.toExpression(LimitValue.formula(formula)),
                                                                   Map.of("$w", LimitValue.of(2), "$l", LimitValue.of(1))));
    Assertions.assertThrows(ExpressionException.class,
                            () -> FormulaRenderer.render(new LimitValue.Formula("quadratic", List.of("w"), List.of(1))));
    Assertions.assertThrows(ExpressionException.class,
                            () -> FormulaRenderer.render(new LimitValue.Formula("linear", List.of("w", "l"), List.of(1))));
  }
}
