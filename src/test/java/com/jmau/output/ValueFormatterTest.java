package com.jmau.output;

import com.jmau.value.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueFormatterTest {

    @Test
    public void testStringify() {
        assertEquals("", ValueFormatter.stringify(Value.NULL));
        assertEquals("raw \"text\"", ValueFormatter.stringify(Value.of("raw \"text\"")));
        assertEquals("42", ValueFormatter.stringify(Value.of(42L)));
        assertEquals("5.0", ValueFormatter.stringify(Value.of(5.0)));
        assertEquals("false", ValueFormatter.stringify(Value.FALSE));
        assertEquals(":ok", ValueFormatter.stringify(Value.atom("ok")));
    }

    @Test
    public void testInspectCollections() {
        Value list = Value.ListValue.of(Value.of(1L), Value.of("two"), Value.TRUE, Value.NULL);
        assertEquals("[1, \"two\", true, null]", ValueFormatter.inspect(list));

        Value map = Value.MapValue.empty()
                .with("name", Value.of("Alice"))
                .with(Value.atom("age"), Value.of(30L));
        assertEquals("{age: 30, \"name\": \"Alice\"}", ValueFormatter.inspect(map));
    }

    @Test
    public void testInspectEscapes() {
        assertEquals("\"a\\nb\"", ValueFormatter.inspect(Value.of("a\nb")));
    }

    @Test
    public void testFloatExponentIsLowerCase() {
        assertEquals("1.0e20", ValueFormatter.stringify(Value.of(1.0e20)));
        assertEquals("1.5e-7", ValueFormatter.stringify(Value.of(1.5e-7)));
        assertEquals("[2.5e30]", ValueFormatter.inspect(Value.ListValue.of(Value.of(2.5e30))));
        assertEquals("0.001", ValueFormatter.stringify(Value.of(0.001)));
    }

    @Test
    public void testJsonEscapesControlCharacters() {
        Value value = Value.of("a\u0001b\bc\fd\u001fe");

        assertEquals("\"a\\u0001b\\bc\\fd\\u001fe\"", new ValueFormatter(false).format(value));
    }

    @Test
    public void testCompactJson() {
        Value value = Value.MapValue.empty()
                .with("b", Value.ListValue.of(Value.of(1L), Value.atom("x"), Value.NULL))
                .with("a", Value.of(Double.NaN));

        assertEquals("{\"a\":null,\"b\":[1,\":x\",null]}", new ValueFormatter(false, true).format(value));
    }

    @Test
    public void testPrettyJson() {
        Value value = Value.MapValue.empty().with("items", Value.ListValue.of(Value.of(1L), Value.of(2L)));

        String expected = "{\n  \"items\": [\n    1,\n    2\n  ]\n}";
        assertEquals(expected, new ValueFormatter(true, true).format(value));
    }

    @Test
    public void testEmptyCollections() {
        ValueFormatter formatter = new ValueFormatter(true);

        assertEquals("{}", formatter.format(Value.MapValue.empty()));
        assertEquals("[]", formatter.format(Value.ListValue.empty()));
        assertEquals("\"s\"", formatter.format(Value.of("s")));
    }
}
