package com.jmau.filter;

import com.jmau.output.ValueFormatter;
import com.jmau.value.Value;
import com.jmau.value.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Comparator;

/** Collection manipulation and utility filters. Most also accept strings, treated as character sequences. */
public final class CollectionFilters implements FilterModule {

    /**
     * Total order over values: numbers, then null, booleans and atoms by name, then maps, lists
     * and finally strings. Values of one family sort naturally.
     */
    static final Comparator<Value> VALUE_ORDER = CollectionFilters::compareValues;

    @Override
    public String category() {
        return "collection";
    }

    @Override
    public ImmutableList<FilterSpec> filters() {
        return Lists.immutable.of(
                new FilterSpec("length", "Returns the length of a collection", CollectionFilters::length),
                new FilterSpec("first", "Returns the first element of a collection", CollectionFilters::first),
                new FilterSpec("last", "Returns the last element of a collection", CollectionFilters::last),
                new FilterSpec("join", "Joins collection elements with a separator", CollectionFilters::join),
                new FilterSpec("sort", "Sorts a collection", CollectionFilters::sort),
                new FilterSpec("reverse", "Reverses a collection", CollectionFilters::reverse),
                new FilterSpec("uniq", "Returns unique elements from collection", CollectionFilters::uniq),
                new FilterSpec("slice", "Returns a slice of the collection", CollectionFilters::slice),
                new FilterSpec("contains", "Checks if collection contains a value", CollectionFilters::contains),
                new FilterSpec("compact", "Removes null values from collection", CollectionFilters::compact),
                new FilterSpec("flatten", "Flattens nested lists", CollectionFilters::flatten),
                new FilterSpec("sum", "Sums numeric values in collection", CollectionFilters::sum),
                new FilterSpec("keys", "Returns keys from a map", CollectionFilters::keys),
                new FilterSpec("values", "Returns values from a map", CollectionFilters::values),
                new FilterSpec("group_by", "Groups collection items by field value", CollectionFilters::groupBy),
                new FilterSpec("map", "Extracts field values from maps, filtering out nulls", CollectionFilters::map),
                new FilterSpec("filter", "Filters collection by field value", CollectionFilters::filter),
                new FilterSpec("reject", "Rejects items from collection by field value", CollectionFilters::reject),
                new FilterSpec("dump", "Formats data structures for display", CollectionFilters::dump));
    }

    static Value length(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return Value.of(list.size());
        }
        if (subject instanceof Value.MapValue map) {
            return Value.of(map.size());
        }
        if (subject instanceof Value.StringValue s) {
            return Value.of(s.value().codePointCount(0, s.value().length()));
        }
        throw new FilterException("length can only be applied to collections or strings");
    }

    static Value first(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return list.isEmpty() ? Value.NULL : list.elements().getFirst();
        }
        if (subject instanceof Value.StringValue s) {
            return s.value().isEmpty() ? Value.NULL : Value.of(Character.toString(s.value().codePointAt(0)));
        }
        throw new FilterException("first can only be applied to lists or strings");
    }

    static Value last(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return list.isEmpty() ? Value.NULL : list.elements().getLast();
        }
        if (subject instanceof Value.StringValue s) {
            String text = s.value();
            return text.isEmpty() ? Value.NULL : Value.of(Character.toString(text.codePointBefore(text.length())));
        }
        throw new FilterException("last can only be applied to lists or strings");
    }

    static Value join(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.ListValue list) || args.size() > 1) {
            throw new FilterException("join can only be applied to lists");
        }
        String separator = args.isEmpty() ? "" : ValueFormatter.stringify(args.get(0));
        return Value.of(list.elements().collect(ValueFormatter::stringify).makeString(separator));
    }

    static Value sort(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return new Value.ListValue(list.elements().toSortedList(VALUE_ORDER).toImmutable());
        }
        if (subject instanceof Value.StringValue s) {
            StringBuilder sorted = new StringBuilder();
            s.value().codePoints().sorted().forEach(sorted::appendCodePoint);
            return Value.of(sorted.toString());
        }
        throw new FilterException("sort can only be applied to lists or strings");
    }

    static Value reverse(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return new Value.ListValue(list.elements().toReversed());
        }
        if (subject instanceof Value.StringValue s) {
            return Value.of(new StringBuilder(s.value()).reverse().toString());
        }
        throw new FilterException("reverse can only be applied to lists or strings");
    }

    /** Keeps the first occurrence of each element; {@code 1} and {@code 1.0} are distinct. */
    static Value uniq(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return new Value.ListValue(list.elements().distinct());
        }
        throw new FilterException("uniq can only be applied to lists");
    }

    /** {@code slice(start)} or {@code slice(start, length)}; a negative start counts from the end. */
    static Value slice(Value subject, ImmutableList<Value> args) {
        if (args.isEmpty() || args.size() > 2 || !(args.get(0) instanceof Value.IntValue start)
                || (args.size() == 2 && !(args.get(1) instanceof Value.IntValue))) {
            throw new FilterException("slice requires start index and optional length");
        }
        long requested = args.size() == 2 ? ((Value.IntValue) args.get(1)).value() : Long.MAX_VALUE;
        if (requested < 0) {
            throw new FilterException("slice length must not be negative");
        }
        if (subject instanceof Value.ListValue list) {
            int from = sliceStart(start.value(), list.size());
            int to = sliceEnd(from, requested, list.size());
            return new Value.ListValue(list.elements().toList().subList(from, to).toImmutable());
        }
        if (subject instanceof Value.StringValue s) {
            String text = s.value();
            int size = text.codePointCount(0, text.length());
            int from = sliceStart(start.value(), size);
            int to = sliceEnd(from, requested, size);
            return Value.of(text.substring(text.offsetByCodePoints(0, from), text.offsetByCodePoints(0, to)));
        }
        throw new FilterException("slice requires start index and optional length");
    }

    private static int sliceStart(long start, int size) {
        long from = start < 0 ? size + start : start;
        return (int) Math.max(0, Math.min(from, size));
    }

    private static int sliceEnd(int from, long length, int size) {
        return (int) Math.min(size, from + Math.min(length, size));
    }

    /** List membership, substring test or map key test, depending on the subject. */
    static Value contains(Value subject, ImmutableList<Value> args) {
        if (args.size() != 1) {
            throw new FilterException("contains requires a value to search for");
        }
        Value needle = args.get(0);
        if (subject instanceof Value.ListValue list) {
            return Value.of(list.elements().anySatisfy(element -> Values.valueEquals(element, needle)));
        }
        if (subject instanceof Value.StringValue s) {
            return Value.of(s.value().contains(ValueFormatter.stringify(needle)));
        }
        if (subject instanceof Value.MapValue map) {
            return Value.of(needle instanceof Value.Key key && map.entries().containsKey(key));
        }
        throw new FilterException("contains requires a value to search for");
    }

    static Value compact(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            return new Value.ListValue(list.elements().reject(element -> element instanceof Value.NullValue));
        }
        throw new FilterException("compact can only be applied to lists");
    }

    static Value flatten(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.ListValue list) {
            MutableList<Value> flat = Lists.mutable.empty();
            flattenInto(list, flat);
            return new Value.ListValue(flat.toImmutable());
        }
        throw new FilterException("flatten can only be applied to lists");
    }

    private static void flattenInto(Value.ListValue list, MutableList<Value> target) {
        for (Value element : list.elements()) {
            if (element instanceof Value.ListValue nested) {
                flattenInto(nested, target);
            } else {
                target.add(element);
            }
        }
    }

    /** Sums the numeric members, skipping anything else. Stays an integer until a float is added. */
    static Value sum(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.ListValue list)) {
            throw new FilterException("sum can only be applied to lists");
        }
        long intSum = 0;
        double floatSum = 0;
        boolean anyFloat = false;
        for (Value element : list.elements()) {
            if (element instanceof Value.IntValue i) {
                intSum = Math.addExact(intSum, i.value());
            } else if (element instanceof Value.FloatValue f) {
                floatSum += f.value();
                anyFloat = true;
            }
        }
        return anyFloat ? Value.of(intSum + floatSum) : Value.of(intSum);
    }

    static Value keys(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.MapValue map) {
            return new Value.ListValue(map.entries().keysView()
                    .toSortedList(Values.KEY_ORDER)
                    .<Value>collect(key -> key)
                    .toImmutable());
        }
        throw new FilterException("keys can only be applied to maps");
    }

    static Value values(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.MapValue map) {
            return new Value.ListValue(map.entries().keysView()
                    .toSortedList(Values.KEY_ORDER)
                    .collect(key -> map.entries().get(key))
                    .toImmutable());
        }
        throw new FilterException("values can only be applied to maps");
    }

    /**
     * Groups the map items of a list by one of their fields. Group values that are not strings or
     * atoms become string keys in their output form, so a missing field groups under {@code ""}.
     */
    static Value groupBy(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.ListValue list) || args.size() != 1) {
            throw new FilterException("group_by requires a key field");
        }
        MutableMap<Value.Key, MutableList<Value>> groups = Maps.mutable.empty();
        for (Value element : list.elements()) {
            if (element instanceof Value.MapValue item) {
                Value group = field(item, args.get(0));
                Value.Key key = group instanceof Value.Key k ? k : new Value.StringValue(ValueFormatter.stringify(group));
                groups.getIfAbsentPut(key, Lists.mutable::empty).add(item);
            }
        }
        MutableMap<Value.Key, Value> result = Maps.mutable.empty();
        groups.forEachKeyValue((key, items) -> result.put(key, new Value.ListValue(items.toImmutable())));
        return new Value.MapValue(result.toImmutable());
    }

    static Value map(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.ListValue list) || args.size() != 1) {
            throw new FilterException("map requires a field name");
        }
        return new Value.ListValue(list.elements()
                .collect(element -> element instanceof Value.MapValue item ? field(item, args.get(0)) : Value.NULL)
                .reject(value -> value instanceof Value.NullValue));
    }

    static Value filter(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.ListValue list) || args.size() != 2) {
            throw new FilterException("filter requires field name and value");
        }
        return new Value.ListValue(list.elements().select(element -> fieldMatches(element, args)));
    }

    static Value reject(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.ListValue list) || args.size() != 2) {
            throw new FilterException("reject requires field name and value");
        }
        return new Value.ListValue(list.elements().reject(element -> fieldMatches(element, args)));
    }

    static Value dump(Value subject, ImmutableList<Value> args) {
        return Value.of(ValueFormatter.inspect(subject));
    }

    private static boolean fieldMatches(Value element, ImmutableList<Value> args) {
        return element instanceof Value.MapValue item && Values.valueEquals(field(item, args.get(0)), args.get(1));
    }

    private static Value field(Value.MapValue item, Value name) {
        return name instanceof Value.Key key ? item.lookup(key) : Value.NULL;
    }

    private static int compareValues(Value left, Value right) {
        int byFamily = Integer.compare(family(left), family(right));
        if (byFamily != 0) {
            return byFamily;
        }
        if (left instanceof Value.NumberValue) {
            return MathFilters.compare(left, right);
        }
        if (left instanceof Value.StringValue l) {
            return l.value().compareTo(((Value.StringValue) right).value());
        }
        if (left instanceof Value.ListValue l) {
            Value.ListValue r = (Value.ListValue) right;
            for (int i = 0; i < Math.min(l.size(), r.size()); i++) {
                int byElement = compareValues(l.elements().get(i), r.elements().get(i));
                if (byElement != 0) {
                    return byElement;
                }
            }
            return Integer.compare(l.size(), r.size());
        }
        if (left instanceof Value.MapValue l) {
            int bySize = Integer.compare(l.size(), ((Value.MapValue) right).size());
            return bySize != 0 ? bySize : ValueFormatter.inspect(left).compareTo(ValueFormatter.inspect(right));
        }
        return atomName(left).compareTo(atomName(right));
    }

    private static int family(Value value) {
        if (value instanceof Value.NumberValue) {
            return 0;
        }
        if (value instanceof Value.MapValue) {
            return 2;
        }
        if (value instanceof Value.ListValue) {
            return 3;
        }
        if (value instanceof Value.StringValue) {
            return 4;
        }
        return 1;
    }

    private static String atomName(Value value) {
        if (value instanceof Value.NullValue) {
            return "nil";
        }
        if (value instanceof Value.BoolValue b) {
            return String.valueOf(b.value());
        }
        return ((Value.AtomValue) value).name();
    }
}
