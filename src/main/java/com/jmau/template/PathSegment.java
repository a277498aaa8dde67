package com.jmau.template;

/**
 * One step of a variable path. A path always starts with a {@link Root}; an {@link Index} key is
 * either an {@link Expression.Literal} or an {@link Expression.Variable}.
 */
public sealed interface PathSegment {
    record Root(String name) implements PathSegment {
        public boolean isWorkflow() {
            return name.startsWith("$");
        }
    }

    record Property(String name) implements PathSegment {}

    record Index(Expression key) implements PathSegment {}
}
