package com.jmau.render;

import com.jmau.TemplateException;
import com.jmau.filter.FilterRegistry;
import com.jmau.template.ExpressionParser;
import com.jmau.value.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator(FilterRegistry.builtIn());

    private final Context context = Context.of(Map.of(
            "user", Map.of("name", "Alice", "tags", List.of("admin", "dev")),
            "items", List.of(10, 20, 30),
            "key", "name",
            "zero", 0));

    @Test
    public void testIntegerArithmetic() {
        assertEquals(Value.of(14L), eval("2 + 3 * 4"));
        assertEquals(Value.of(20L), eval("(2 + 3) * 4"));
        assertEquals(Value.of(-1L), eval("2 - 3"));
        assertEquals(Value.of(1L), eval("7 % 3"));
    }

    @Test
    public void testDivisionAlwaysYieldsFloat() {
        assertEquals(Value.of(5.0), eval("10 / 2"));
        assertEquals(Value.of(2.5), eval("5 / 2"));
    }

    @Test
    public void testFloatOperandPromotes() {
        assertEquals(Value.of(3.5), eval("1 + 2.5"));
        assertEquals(Value.of(5.0), eval("2.5 * 2"));
    }

    @Test
    public void testUnaryMinus() {
        assertEquals(Value.of(-20L), eval("-items[1]"));
        assertEquals(Value.of(-5L), eval("-5"));
        assertEquals(Value.of(8L), eval("3 - -5"));
    }

    @Test
    public void testStringConcatenation() {
        assertEquals(Value.of("ab"), eval("'a' + 'b'"));
        assertEquals(Value.of("n=5"), eval("'n=' + 5"));
        assertEquals(Value.of("2.5x"), eval("2.5 + 'x'"));
        assertEquals(Value.of("x"), eval("missing + 'x'"));
    }

    @Test
    public void testDivisionByZero() {
        TemplateException e = assertThrows(TemplateException.class, () -> eval("1 / 0"));
        assertEquals(TemplateException.Kind.RUNTIME, e.kind());
        assertEquals("Division by zero", e.getMessage());
        assertThrows(TemplateException.class, () -> eval("1.5 / 0.0"));
    }

    @Test
    public void testModuloErrors() {
        assertEquals("Modulo by zero", assertThrows(TemplateException.class, () -> eval("5 % 0")).getMessage());
        TemplateException e = assertThrows(TemplateException.class, () -> eval("5.5 % 2"));
        assertTrue(e.getMessage().startsWith("Unsupported binary operation"));
    }

    @Test
    public void testIntegerOverflow() {
        TemplateException e = assertThrows(TemplateException.class, () -> eval("9223372036854775807 + 1"));
        assertEquals("Integer overflow", e.getMessage());
    }

    @ParameterizedTest
    @CsvSource(quoteCharacter = '"', value = {
            "1 < 2, true",
            "2 <= 2, true",
            "3 > 4, false",
            "1.5 >= 1, true",
            "'apple' < 'banana', true",
            "'b' > 'a', true",
            "1 == 1.0, true",
            "5 == '5', false",
            "'a' != 'b', true",
            "null == missing, true",
            "\"[1, 2] == [1, 2]\", true"
    })
    public void testComparisons(String source, boolean expected) {
        assertEquals(Value.of(expected), eval(source));
    }

    @Test
    public void testCrossFamilyOrderingIsAnError() {
        TemplateException e = assertThrows(TemplateException.class, () -> eval("1 < 'a'"));
        assertEquals("Unsupported binary operation: 1 < \"a\"", e.getMessage());
        assertThrows(TemplateException.class, () -> eval("null > 1"));
    }

    @Test
    public void testStrictLogicReturnsBooleans() {
        assertEquals(Value.FALSE, eval("0 and true"));
        assertEquals(Value.TRUE, eval("'x' and [1]"));
        assertEquals(Value.FALSE, eval("'' or []"));
        assertEquals(Value.TRUE, eval("not zero"));
        assertEquals(Value.FALSE, eval("not user"));
    }

    @Test
    public void testLooseLogicPreservesValues() {
        assertEquals(Value.TRUE, eval("0 && true"));
        assertEquals(Value.of(0L), eval("0 || 5"));
        assertEquals(Value.of("fallback"), eval("missing || 'fallback'"));
        assertEquals(Value.FALSE, eval("false && 1"));
        assertEquals(Value.of(42L), eval("1 && 42"));
    }

    @Test
    public void testShortCircuitSkipsFailingOperand() {
        assertEquals(Value.TRUE, eval("true || (1 / 0)"));
        assertEquals(Value.FALSE, eval("false and (1 / 0 > 0)"));
        assertEquals(Value.TRUE, eval("true or unknown_fn(1)"));
        assertEquals(Value.NULL, eval("null && (1 / 0)"));
    }

    @Test
    public void testMixedLogicPrecedence() {
        assertEquals(Value.TRUE, eval("true || false && 42"));
    }

    @Test
    public void testPathResolution() {
        assertEquals(Value.of("Alice"), eval("user.name"));
        assertEquals(Value.of("dev"), eval("user.tags[1]"));
        assertEquals(Value.of(30L), eval("items[2]"));
        assertEquals(Value.of("Alice"), eval("user[key]"));
        assertEquals(Value.of("Alice"), eval("user['name']"));
    }

    @Test
    public void testPathResolutionIsTotal() {
        assertEquals(Value.NULL, eval("missing"));
        assertEquals(Value.NULL, eval("missing.deeper[0].x"));
        assertEquals(Value.NULL, eval("items[3]"));
        assertEquals(Value.NULL, eval("items[-1]"));
        assertEquals(Value.NULL, eval("items['x']"));
        assertEquals(Value.NULL, eval("items.length"));
        assertEquals(Value.NULL, eval("user.name.first"));
        assertEquals(Value.NULL, eval("user[1]"));
        assertEquals(Value.NULL, eval("items[1.0]"));
    }

    @Test
    public void testAtomKeyFallback() {
        Value.MapValue map = Value.MapValue.empty().with(Value.atom("status"), Value.of("ok"));
        Context withAtoms = Context.empty().with("result", map);

        assertEquals(Value.of("ok"), evaluator.evaluate(ExpressionParser.parseExpression("result.status"), withAtoms));
        assertEquals(Value.of("ok"), evaluator.evaluate(ExpressionParser.parseExpression("result['status']"), withAtoms));
        assertEquals(Value.of("ok"), evaluator.evaluate(ExpressionParser.parseExpression("result[:status]"), withAtoms));
    }

    @Test
    public void testArrayLiteral() {
        assertEquals(Value.ListValue.of(Value.of(1L), Value.of(21L)), eval("[1, items[1] + 1]"));
    }

    @Test
    public void testCallsAndPipes() {
        assertEquals(Value.of("ALICE"), eval("user.name | upper_case"));
        assertEquals(Value.of("ALICE"), eval("upper_case(user.name)"));
        assertEquals(Value.of(3L), eval("items | length"));
        assertEquals(Value.TRUE, eval("[1, 2, 3] | length > 2"));
    }

    @Test
    public void testUnknownFilter() {
        TemplateException e = assertThrows(TemplateException.class, () -> eval("x | frobnicate"));
        assertEquals("Unknown filter or function: frobnicate", e.getMessage());
    }

    @Test
    public void testArgumentErrorAbortsCall() {
        TemplateException e = assertThrows(TemplateException.class, () -> eval("frobnicate(1 / 0)"));
        assertEquals("Division by zero", e.getMessage());
    }

    @Test
    public void testTruthinessHelpers() {
        for (Value falsy : List.of(Value.NULL, Value.FALSE, Value.of(0L), Value.of(0.0), Value.of(""),
                Value.ListValue.empty(), Value.MapValue.empty())) {
            assertFalse(Evaluator.strictTruthy(falsy), falsy.toString());
        }
        assertTrue(Evaluator.looseTruthy(Value.of(0L)));
        assertTrue(Evaluator.looseTruthy(Value.of("")));
        assertFalse(Evaluator.looseTruthy(Value.NULL));
        assertFalse(Evaluator.looseTruthy(Value.FALSE));
    }

    private Value eval(String source) {
        return evaluator.evaluate(ExpressionParser.parseExpression(source), context);
    }
}
