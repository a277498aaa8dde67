package com.jmau.value;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;

/**
 * Runtime value of the template language. Values are immutable; collection variants wrap
 * eclipse-collections immutable containers so a value can be shared between renders.
 */
public sealed interface Value {

    NullValue NULL = new NullValue();
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    /** Values usable as map keys: strings and atoms. */
    sealed interface Key extends Value {
        String name();

        /** The key of the other key space with the same name (string for an atom, atom for a string). */
        Key counterpart();
    }

    record NullValue() implements Value {}

    record BoolValue(boolean value) implements Value {
        public static BoolValue of(boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    sealed interface NumberValue extends Value {
        double doubleValue();
    }

    record IntValue(long value) implements NumberValue {
        @Override
        public double doubleValue() {
            return value;
        }
    }

    record FloatValue(double value) implements NumberValue {
        @Override
        public double doubleValue() {
            return value;
        }
    }

    record StringValue(String value) implements Key {
        @Override
        public String name() {
            return value;
        }

        @Override
        public Key counterpart() {
            return new AtomValue(value);
        }
    }

    /** Symbol literal written {@code :name}. Equal names in the string and atom key spaces stay distinct. */
    record AtomValue(String name) implements Key {
        @Override
        public Key counterpart() {
            return new StringValue(name);
        }
    }

    record ListValue(ImmutableList<Value> elements) implements Value {
        public static ListValue empty() {
            return new ListValue(Lists.immutable.empty());
        }

        public static ListValue of(Value... elements) {
            return new ListValue(Lists.immutable.of(elements));
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }
    }

    record MapValue(ImmutableMap<Key, Value> entries) implements Value {
        public static MapValue empty() {
            return new MapValue(Maps.immutable.empty());
        }

        public MapValue with(Key key, Value value) {
            return new MapValue(entries.newWithKeyValue(key, value));
        }

        public MapValue with(String key, Value value) {
            return with(new StringValue(key), value);
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        /** Property lookup: the string key first, then the atom with the same name. Null when absent. */
        public Value property(String name) {
            Value value = entries.get(new StringValue(name));
            if (value == null) {
                value = entries.get(new AtomValue(name));
            }
            return value != null ? value : NULL;
        }

        /** Computed-key lookup: the key itself, then its counterpart in the other key space. */
        public Value lookup(Key key) {
            Value value = entries.get(key);
            if (value == null) {
                value = entries.get(key.counterpart());
            }
            return value != null ? value : NULL;
        }
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static Value of(boolean value) {
        return BoolValue.of(value);
    }

    static AtomValue atom(String name) {
        return new AtomValue(name);
    }
}
