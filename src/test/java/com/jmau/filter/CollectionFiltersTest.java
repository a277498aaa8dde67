package com.jmau.filter;

import com.jmau.TemplateException;
import com.jmau.value.Value;
import com.jmau.value.Values;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CollectionFiltersTest {

    private final Value people = Values.fromJava(List.of(
            Map.of("name", "Ann", "role", "admin", "age", 31),
            Map.of("name", "Bob", "role", "dev"),
            Map.of("name", "Cy", "role", "admin", "age", 25)));

    @Test
    public void testLength() {
        assertEquals(Value.of(3L), apply("length", list(1, 2, 3)));
        assertEquals(Value.of(5L), apply("length", Value.of("héllo")));
        assertEquals(Value.of(1L), apply("length", Value.MapValue.empty().with("a", Value.NULL)));
        assertThrows(TemplateException.class, () -> apply("length", Value.of(5L)));
    }

    @Test
    public void testFirstAndLast() {
        assertEquals(Value.of(1L), apply("first", list(1, 2, 3)));
        assertEquals(Value.of(3L), apply("last", list(1, 2, 3)));
        assertEquals(Value.of("a"), apply("first", Value.of("abc")));
        assertEquals(Value.of("c"), apply("last", Value.of("abc")));
        assertEquals(Value.NULL, apply("first", Value.ListValue.empty()));
        assertEquals(Value.NULL, apply("last", Value.of("")));
    }

    @Test
    public void testJoin() {
        assertEquals(Value.of("a, 1, true"), apply("join", Values.fromJava(List.of("a", 1, true)), Value.of(", ")));
        assertEquals(Value.of("ab"), apply("join", Values.fromJava(List.of("a", "b"))));
        assertThrows(TemplateException.class, () -> apply("join", Value.of("ab")));
    }

    @Test
    public void testSort() {
        assertEquals(list(1, 2, 3), apply("sort", list(3, 1, 2)));
        assertEquals(Values.fromJava(List.of("apple", "banana")), apply("sort", Values.fromJava(List.of("banana", "apple"))));
        assertEquals(Value.of("abc"), apply("sort", Value.of("cab")));
        assertEquals(Values.fromJava(List.of(2, "a")), apply("sort", Values.fromJava(List.of("a", 2))));
    }

    @Test
    public void testReverseAndUniq() {
        assertEquals(list(3, 2, 1), apply("reverse", list(1, 2, 3)));
        assertEquals(Value.of("cba"), apply("reverse", Value.of("abc")));
        assertEquals(list(1, 2, 3), apply("uniq", list(1, 2, 1, 3, 2)));
    }

    @Test
    public void testSlice() {
        assertEquals(list(3, 4, 5), apply("slice", list(1, 2, 3, 4, 5), Value.of(2L)));
        assertEquals(list(2, 3), apply("slice", list(1, 2, 3, 4, 5), Value.of(1L), Value.of(2L)));
        assertEquals(list(4, 5), apply("slice", list(1, 2, 3, 4, 5), Value.of(-2L)));
        assertEquals(Value.ListValue.empty(), apply("slice", list(1, 2), Value.of(5L)));
        assertEquals(Value.of("ell"), apply("slice", Value.of("hello"), Value.of(1L), Value.of(3L)));
        assertThrows(TemplateException.class, () -> apply("slice", list(1, 2)));
    }

    @Test
    public void testContains() {
        assertEquals(Value.TRUE, apply("contains", list(1, 2, 3), Value.of(2L)));
        assertEquals(Value.FALSE, apply("contains", list(1, 2, 3), Value.of(4L)));
        assertEquals(Value.TRUE, apply("contains", Value.of("hello"), Value.of("ell")));
        assertEquals(Value.TRUE, apply("contains", Value.MapValue.empty().with("k", Value.NULL), Value.of("k")));
        assertEquals(Value.FALSE, apply("contains", Value.MapValue.empty(), Value.of("k")));
    }

    @Test
    public void testCompactFlattenSum() {
        assertEquals(list(1, 2), apply("compact", Values.fromJava(Arrays.asList(1, null, 2, null))));
        assertEquals(list(1, 2, 3, 4), apply("flatten", Values.fromJava(List.of(1, List.of(2, List.of(3)), 4))));
        assertEquals(Value.of(6L), apply("sum", Values.fromJava(List.of(1, 2, "x", 3))));
        assertEquals(Value.of(3.5), apply("sum", Values.fromJava(List.of(1, 2.5))));
        assertEquals(Value.of(0L), apply("sum", Value.ListValue.empty()));
    }

    @Test
    public void testKeysAndValues() {
        Value map = Values.fromJava(Map.of("b", 2, "a", 1));

        assertEquals(Values.fromJava(List.of("a", "b")), apply("keys", map));
        assertEquals(list(1, 2), apply("values", map));
        assertThrows(TemplateException.class, () -> apply("keys", list(1)));
    }

    @Test
    public void testGroupBy() {
        Value.MapValue groups = assertInstanceOf(Value.MapValue.class, apply("group_by", people, Value.of("role")));

        assertEquals(2, groups.size());
        assertEquals(Value.of(2L), apply("length", groups.property("admin")));
        assertEquals(Value.of(1L), apply("length", groups.property("dev")));
    }

    @Test
    public void testMapFilterReject() {
        assertEquals(Values.fromJava(List.of("Ann", "Bob", "Cy")), apply("map", people, Value.of("name")));
        assertEquals(list(31, 25), apply("map", people, Value.of("age")));
        assertEquals(Value.of(2L), apply("length", apply("filter", people, Value.of("role"), Value.of("admin"))));
        assertEquals(Values.fromJava(List.of("Bob")),
                apply("map", apply("reject", people, Value.of("role"), Value.of("admin")), Value.of("name")));
        assertThrows(TemplateException.class, () -> apply("filter", people, Value.of("role")));
    }

    @Test
    public void testDump() {
        assertEquals(Value.of("[1, \"a\"]"), apply("dump", Values.fromJava(List.of(1, "a"))));
        assertEquals(Value.of("null"), apply("dump", Value.NULL));
    }

    private static Value list(long... values) {
        MutableList<Value> elements = Lists.mutable.empty();
        for (long value : values) {
            elements.add(Value.of(value));
        }
        return new Value.ListValue(elements.toImmutable());
    }

    private static Value apply(String filter, Value subject, Value... args) {
        return FilterRegistry.builtIn().apply(filter, subject, Lists.immutable.of(args));
    }
}
