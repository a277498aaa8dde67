package com.jmau.value;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between {@link Value}s and plain Java objects, plus a few helpers shared by the
 * evaluator, the filters and the formatter.
 */
public final class Values {

    /** Orders map keys by name, atoms before strings on equal names. */
    public static final Comparator<Value.Key> KEY_ORDER = Comparator
            .comparing(Value.Key::name)
            .thenComparing(key -> key instanceof Value.StringValue);

    private Values() {
    }

    /**
     * Converts a Java object graph into a value. Maps, iterables and arrays are converted
     * recursively; map keys become string keys unless they already are {@link Value.Key}s.
     *
     * @throws IllegalArgumentException for objects with no value counterpart
     */
    public static Value fromJava(Object object) {
        if (object == null) {
            return Value.NULL;
        }
        if (object instanceof Value value) {
            return value;
        }
        if (object instanceof String s) {
            return new Value.StringValue(s);
        }
        if (object instanceof Boolean b) {
            return Value.BoolValue.of(b);
        }
        if (object instanceof Integer || object instanceof Long || object instanceof Short
                || object instanceof Byte) {
            return new Value.IntValue(((Number) object).longValue());
        }
        if (object instanceof BigInteger big) {
            // beyond long range becomes a float, as in JSON input
            return big.bitLength() < 64 ? new Value.IntValue(big.longValue()) : new Value.FloatValue(big.doubleValue());
        }
        if (object instanceof Number n) {
            if (n instanceof BigDecimal d && d.scale() <= 0) {
                return fromJava(d.toBigInteger());
            }
            return new Value.FloatValue(n.doubleValue());
        }
        if (object instanceof Character c) {
            return new Value.StringValue(c.toString());
        }
        if (object instanceof Map<?, ?> map) {
            MutableMap<Value.Key, Value> entries = Maps.mutable.empty();
            map.forEach((key, value) -> entries.put(toKey(key), fromJava(value)));
            return new Value.MapValue(entries.toImmutable());
        }
        if (object instanceof Iterable<?> iterable) {
            MutableList<Value> elements = Lists.mutable.empty();
            iterable.forEach(element -> elements.add(fromJava(element)));
            return new Value.ListValue(elements.toImmutable());
        }
        if (object instanceof Object[] array) {
            return fromJava(List.of(array));
        }
        throw new IllegalArgumentException("Cannot convert " + object.getClass().getName() + " to a template value");
    }

    /**
     * Converts a value back into plain Java objects: {@code null}, Boolean, Long, Double, String,
     * {@link List} and {@link Map}. Atoms become their {@code :name} string form.
     */
    public static Object toJava(Value value) {
        if (value instanceof Value.NullValue) {
            return null;
        }
        if (value instanceof Value.BoolValue b) {
            return b.value();
        }
        if (value instanceof Value.IntValue i) {
            return i.value();
        }
        if (value instanceof Value.FloatValue f) {
            return f.value();
        }
        if (value instanceof Value.StringValue s) {
            return s.value();
        }
        if (value instanceof Value.AtomValue a) {
            return ":" + a.name();
        }
        if (value instanceof Value.ListValue list) {
            return list.elements().collect(Values::toJava).castToList();
        }
        Value.MapValue map = (Value.MapValue) value;
        Map<String, Object> result = new LinkedHashMap<>();
        map.entries().keysView().toSortedList(KEY_ORDER)
                .forEach(key -> result.put(key.name(), toJava(map.entries().get(key))));
        return result;
    }

    private static Value.Key toKey(Object key) {
        if (key instanceof Value.Key valueKey) {
            return valueKey;
        }
        return new Value.StringValue(String.valueOf(key));
    }

    /**
     * Equality used by {@code ==}, {@code !=} and membership tests: structural, with integers and
     * floats compared by numeric value.
     */
    public static boolean valueEquals(Value left, Value right) {
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            if (l instanceof Value.IntValue li && r instanceof Value.IntValue ri) {
                return li.value() == ri.value();
            }
            return l.doubleValue() == r.doubleValue();
        }
        if (left instanceof Value.ListValue l && right instanceof Value.ListValue r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!valueEquals(l.elements().get(i), r.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Value.MapValue l && right instanceof Value.MapValue r) {
            if (l.size() != r.size()) {
                return false;
            }
            return l.entries().keyValuesView().allSatisfy(pair -> {
                Value other = r.entries().get(pair.getOne());
                return other != null && valueEquals(pair.getTwo(), other);
            });
        }
        return left.equals(right);
    }
}
