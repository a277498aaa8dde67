package com.jmau.filter;

import org.eclipse.collections.api.list.ImmutableList;

/** A category of built-in filters. */
public interface FilterModule {

    record FilterSpec(String name, String description, Filter function) {}

    String category();

    ImmutableList<FilterSpec> filters();
}
