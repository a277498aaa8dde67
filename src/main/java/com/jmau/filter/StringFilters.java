package com.jmau.filter;

import com.jmau.output.ValueFormatter;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** String manipulation and formatting filters. Non-string subjects are stringified first. */
public final class StringFilters implements FilterModule {

    @Override
    public String category() {
        return "string";
    }

    @Override
    public ImmutableList<FilterSpec> filters() {
        return Lists.immutable.of(
                new FilterSpec("upper_case", "Converts string to uppercase", StringFilters::upperCase),
                new FilterSpec("lower_case", "Converts string to lowercase", StringFilters::lowerCase),
                new FilterSpec("capitalize", "Capitalizes the first letter of each word", StringFilters::capitalize),
                new FilterSpec("strip", "Removes whitespace from beginning and end", StringFilters::strip),
                new FilterSpec("truncate", "Truncates string to specified length", StringFilters::truncate),
                new FilterSpec("default", "Returns default value if input is null or empty", StringFilters::defaultValue));
    }

    static Value upperCase(Value subject, ImmutableList<Value> args) {
        return Value.of(ValueFormatter.stringify(subject).toUpperCase(Locale.ROOT));
    }

    static Value lowerCase(Value subject, ImmutableList<Value> args) {
        return Value.of(ValueFormatter.stringify(subject).toLowerCase(Locale.ROOT));
    }

    static Value capitalize(Value subject, ImmutableList<Value> args) {
        String capitalized = Arrays.stream(ValueFormatter.stringify(subject).split(" ", -1))
                .map(StringFilters::capitalizeWord)
                .collect(Collectors.joining(" "));
        return Value.of(capitalized);
    }

    private static String capitalizeWord(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int first = word.codePointAt(0);
        int rest = Character.charCount(first);
        return new StringBuilder()
                .appendCodePoint(Character.toTitleCase(first))
                .append(word.substring(rest).toLowerCase(Locale.ROOT))
                .toString();
    }

    static Value strip(Value subject, ImmutableList<Value> args) {
        return Value.of(ValueFormatter.stringify(subject).strip());
    }

    static Value truncate(Value subject, ImmutableList<Value> args) {
        if (args.size() != 1 || !(args.get(0) instanceof Value.IntValue length) || length.value() < 0) {
            throw new FilterException("truncate requires a positive integer length");
        }
        String text = ValueFormatter.stringify(subject);
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints <= length.value()) {
            return Value.of(text);
        }
        return Value.of(text.substring(0, text.offsetByCodePoints(0, (int) length.value())));
    }

    static Value defaultValue(Value subject, ImmutableList<Value> args) {
        if (args.size() != 1) {
            throw new FilterException("default requires a default value");
        }
        boolean missing = subject instanceof Value.NullValue
                || (subject instanceof Value.StringValue s && s.value().isEmpty());
        return missing ? args.get(0) : subject;
    }
}
