package com.jmau.filter;

import com.jmau.TemplateException;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FilterRegistryTest {

    @Test
    public void testBuiltInCategoriesAreRegistered() {
        FilterRegistry registry = FilterRegistry.builtIn();

        for (String name : new String[]{"upper_case", "format_currency", "sqrt", "group_by", "dump", "default"}) {
            assertTrue(registry.contains(name), name);
        }
        assertEquals(36, registry.size());
    }

    @Test
    public void testFiltersAreListedByNameWithDescriptions() {
        ImmutableList<FilterModule.FilterSpec> filters = FilterRegistry.builtIn().filters();

        assertEquals(36, filters.size());
        assertEquals("abs", filters.getFirst().name());
        ImmutableList<String> names = filters.collect(FilterModule.FilterSpec::name);
        assertEquals(names.toSortedList(), names.toList());
        assertTrue(filters.allSatisfy(filter -> !filter.description().isBlank()));
    }

    @Test
    public void testLookup() {
        assertTrue(FilterRegistry.builtIn().lookup("length").isPresent());
        assertTrue(FilterRegistry.builtIn().lookup("nope").isEmpty());
    }

    @Test
    public void testUnknownFilter() {
        TemplateException e = assertThrows(TemplateException.class,
                () -> FilterRegistry.builtIn().apply("nope", Value.NULL, Lists.immutable.empty()));
        assertEquals(TemplateException.Kind.RUNTIME, e.kind());
        assertEquals("Unknown filter or function: nope", e.getMessage());
    }

    @Test
    public void testFilterErrorsNameTheFilter() {
        TemplateException e = assertThrows(TemplateException.class,
                () -> FilterRegistry.builtIn().apply("sqrt", Value.of(-4L), Lists.immutable.empty()));
        assertEquals("Filter error in sqrt: sqrt cannot be applied to negative numbers", e.getMessage());
        assertInstanceOf(FilterException.class, e.getCause());
    }

    @Test
    public void testUnexpectedExceptionsAreWrapped() {
        FilterRegistry registry = new FilterRegistry(Lists.immutable.of(module("broken", (subject, args) -> {
            throw new IllegalStateException("boom");
        })));

        TemplateException e = assertThrows(TemplateException.class,
                () -> registry.apply("broken", Value.NULL, Lists.immutable.empty()));
        assertEquals("Filter error in broken: boom", e.getMessage());
    }

    @Test
    public void testLaterModulesReplaceEarlierNames() {
        FilterRegistry registry = new FilterRegistry(Lists.immutable.of(
                module("twice", (subject, args) -> Value.of("first")),
                module("twice", (subject, args) -> Value.of("second"))));

        assertEquals(1, registry.size());
        assertEquals(Value.of("second"), registry.apply("twice", Value.NULL, Lists.immutable.empty()));
    }

    private static FilterModule module(String name, Filter filter) {
        return new FilterModule() {
            @Override
            public String category() {
                return "test";
            }

            @Override
            public ImmutableList<FilterSpec> filters() {
                return Lists.immutable.of(new FilterSpec(name, "test filter", filter));
            }
        };
    }
}
