package com.jmau.filter;

import com.jmau.TemplateException;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Name to filter mapping consulted by every call and pipe expression. Built once from a fixed set
 * of modules and never changed afterwards, so one registry can serve concurrent renders.
 */
public final class FilterRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FilterRegistry.class);

    private final ImmutableMap<String, FilterModule.FilterSpec> filters;

    public FilterRegistry(Iterable<? extends FilterModule> modules) {
        MutableMap<String, FilterModule.FilterSpec> byName = Maps.mutable.empty();
        for (FilterModule module : modules) {
            for (FilterModule.FilterSpec spec : module.filters()) {
                FilterModule.FilterSpec previous = byName.put(spec.name(), spec);
                if (previous != null) {
                    LOG.debug("Filter '{}' from category {} replaces an earlier definition", spec.name(), module.category());
                }
            }
            LOG.debug("Registered {} {} filters", module.filters().size(), module.category());
        }
        this.filters = byName.toImmutable();
    }

    /** The registry holding the string, collection, math and number filters. */
    public static FilterRegistry builtIn() {
        return BuiltIn.INSTANCE;
    }

    public Optional<Filter> lookup(String name) {
        FilterModule.FilterSpec spec = filters.get(name);
        return spec == null ? Optional.empty() : Optional.of(spec.function());
    }

    public boolean contains(String name) {
        return filters.containsKey(name);
    }

    public int size() {
        return filters.size();
    }

    /** Every registered filter, ordered by name. */
    public ImmutableList<FilterModule.FilterSpec> filters() {
        return filters.valuesView().toSortedListBy(FilterModule.FilterSpec::name).toImmutable();
    }

    /**
     * Applies the named filter.
     *
     * @throws TemplateException a runtime error when the name is unknown or the filter fails
     */
    public Value apply(String name, Value subject, ImmutableList<Value> args) {
        Filter filter = lookup(name)
                .orElseThrow(() -> TemplateException.runtime("Unknown filter or function: " + name));
        try {
            return filter.apply(subject, args);
        } catch (TemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TemplateException(TemplateException.Kind.RUNTIME,
                    "Filter error in " + name + ": " + e.getMessage(), e);
        }
    }

    private static final class BuiltIn {
        static final FilterRegistry INSTANCE = new FilterRegistry(Lists.immutable.of(
                new StringFilters(),
                new CollectionFilters(),
                new MathFilters(),
                new NumberFilters()));
    }
}
