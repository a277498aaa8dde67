package com.jmau.filter;

import com.jmau.output.ValueFormatter;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;

/** Number formatting filters. */
public final class NumberFilters implements FilterModule {

    private static final String DEFAULT_CURRENCY_SYMBOL = "$";

    @Override
    public String category() {
        return "number";
    }

    @Override
    public ImmutableList<FilterSpec> filters() {
        return Lists.immutable.of(
                new FilterSpec("format_currency", "Formats number as currency", NumberFilters::formatCurrency));
    }

    /** {@code 1234.5 | format_currency} gives {@code $1234.50}; an argument replaces the symbol. */
    static Value formatCurrency(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.NumberValue number) || args.size() > 1) {
            throw new FilterException("format_currency can only be applied to numbers");
        }
        String symbol = args.isEmpty() ? DEFAULT_CURRENCY_SYMBOL : ValueFormatter.stringify(args.get(0));
        return Value.of(symbol + String.format(Locale.ROOT, "%.2f", number.doubleValue()));
    }
}
