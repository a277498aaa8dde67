package com.jmau.filter;

import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;

/** A pure function of a subject value and its arguments. Misuse is reported with a {@link FilterException}. */
@FunctionalInterface
public interface Filter {
    Value apply(Value subject, ImmutableList<Value> args);
}
