package com.jmau.json;

import com.jmau.value.Value;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class JsonValueParserTest {

    private final JsonValueParser parser = new JsonValueParser();

    @Test
    public void testObject() throws IOException {
        Value value = parser.parse(new ByteArrayInputStream(
                "{\"name\":\"John\",\"age\":30,\"score\":9.5,\"ok\":true,\"none\":null}".getBytes(StandardCharsets.UTF_8)));

        Value.MapValue map = assertInstanceOf(Value.MapValue.class, value);
        assertEquals(5, map.size());
        assertEquals(Value.of("John"), map.property("name"));
        assertEquals(Value.of(30L), map.property("age"));
        assertEquals(Value.of(9.5), map.property("score"));
        assertEquals(Value.TRUE, map.property("ok"));
        assertTrue(map.entries().containsKey(new Value.StringValue("none")));
    }

    @Test
    public void testNestedArrays() throws IOException {
        Value value = parser.parse("[1, [2, {\"a\": []}], \"x\"]");

        Value.ListValue list = assertInstanceOf(Value.ListValue.class, value);
        assertEquals(3, list.size());
        Value.ListValue inner = assertInstanceOf(Value.ListValue.class, list.elements().get(1));
        assertEquals(Value.ListValue.empty(), ((Value.MapValue) inner.elements().get(1)).property("a"));
    }

    @Test
    public void testScalars() throws IOException {
        assertEquals(Value.of(-7L), parser.parse("-7"));
        assertEquals(Value.of(1.0e3), parser.parse("1e3"));
        assertEquals(Value.NULL, parser.parse("null"));
        assertEquals(Value.of(1.8446744073709552E19), parser.parse("18446744073709551616"));
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IOException.class, () -> parser.parse(""));
        assertThrows(IOException.class, () -> parser.parse("{\"a\": }"));
        assertThrows(IOException.class, () -> parser.parse("1 2"));
    }
}
