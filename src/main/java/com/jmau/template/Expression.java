package com.jmau.template;

import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;

public sealed interface Expression {
    record Literal(Value value) implements Expression {}
    record ArrayLiteral(ImmutableList<Expression> elements) implements Expression {}
    record Variable(ImmutableList<PathSegment> path) implements Expression {}
    record BinaryOp(String operator, Expression left, Expression right) implements Expression {}
    record LogicalOp(String operator, Expression left, Expression right) implements Expression {}
    record Not(Expression operand) implements Expression {}
    record Call(String name, ImmutableList<Expression> arguments) implements Expression {}  // filters and name(args)
}
