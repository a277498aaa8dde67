package com.jmau.template;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * A compiled template element. The parser produces {@link Text}, {@link ExpressionNode} and
 * {@link TagNode}; the block resolver folds matched tag runs into {@link IfBlock} and
 * {@link ForBlock}, which own their bodies.
 */
public sealed interface Node {

    default boolean trimLeft() {
        return false;
    }

    default boolean trimRight() {
        return false;
    }

    record Text(String content) implements Node {
        public Text withContent(String newContent) {
            return newContent.equals(content) ? this : new Text(newContent);
        }
    }

    record ExpressionNode(Expression expression, boolean trimLeft, boolean trimRight) implements Node {
        public ExpressionNode(Expression expression) {
            this(expression, false, false);
        }
    }

    record TagNode(Tag tag, boolean trimLeft, boolean trimRight) implements Node {
        public TagNode(Tag tag) {
            this(tag, false, false);
        }
    }

    record Branch(Expression condition, ImmutableList<Node> body) {}

    record IfBlock(ImmutableList<Branch> branches, ImmutableList<Node> elseBody) implements Node {}

    record ForBlock(String variable, Expression source, ImmutableList<Node> body) implements Node {}
}
