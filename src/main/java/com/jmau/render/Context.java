package com.jmau.render;

import com.jmau.value.Value;
import com.jmau.value.Values;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;

/**
 * The variable environment a template renders against. Immutable: every binding change returns a
 * new context, so a context handed to one node is never changed under another.
 */
public final class Context {

    private static final Context EMPTY = new Context(Maps.immutable.empty());

    private final ImmutableMap<String, Value> variables;

    private Context(ImmutableMap<String, Value> variables) {
        this.variables = variables;
    }

    public static Context empty() {
        return EMPTY;
    }

    /**
     * Builds a context from a map value. Atom keys become plain names; when a string key and an
     * atom key share a name, the string key wins.
     */
    public static Context of(Value.MapValue map) {
        MutableMap<String, Value> variables = Maps.mutable.empty();
        map.entries().forEachKeyValue((key, value) -> {
            if (key instanceof Value.StringValue || !variables.containsKey(key.name())) {
                variables.put(key.name(), value);
            }
        });
        return new Context(variables.toImmutable());
    }

    /** Builds a context from plain Java objects, converting each value with {@link Values#fromJava}. */
    public static Context of(Map<String, ?> variables) {
        MutableMap<String, Value> converted = Maps.mutable.empty();
        variables.forEach((name, value) -> converted.put(name, Values.fromJava(value)));
        return new Context(converted.toImmutable());
    }

    /** The bound value, or {@link Value#NULL} when the name is unbound. */
    public Value get(String name) {
        Value value = variables.get(name);
        return value != null ? value : Value.NULL;
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Context with(String name, Value value) {
        return new Context(variables.newWithKeyValue(name, value));
    }

    public Context without(String name) {
        return variables.containsKey(name) ? new Context(variables.newWithoutKey(name)) : this;
    }

    /** Gives {@code name} the binding it had in {@code earlier}, removing it if it had none. */
    public Context restore(String name, Context earlier) {
        return earlier.contains(name) ? with(name, earlier.get(name)) : without(name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Context other && variables.equals(other.variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "Context" + variables;
    }
}
