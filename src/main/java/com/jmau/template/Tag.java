package com.jmau.template;

/** The directive inside a {@code {% ... %}} span. */
public sealed interface Tag {
    record Assign(String name, Expression value) implements Tag {}
    record If(Expression condition) implements Tag {}
    record Elsif(Expression condition) implements Tag {}
    record Else() implements Tag {}
    record EndIf() implements Tag {}
    record For(String variable, Expression source) implements Tag {}
    record EndFor() implements Tag {}
}
