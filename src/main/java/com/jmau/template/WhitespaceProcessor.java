package com.jmau.template;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

/**
 * Applies trim markers: a node marked {@code trimLeft} strips trailing whitespace from the text
 * node right before it, a node marked {@code trimRight} strips leading whitespace from the text
 * node right after it. Only direct neighbours are touched.
 */
public final class WhitespaceProcessor {

    private WhitespaceProcessor() {
    }

    public static ImmutableList<Node> apply(ImmutableList<Node> nodes) {
        MutableList<Node> result = nodes.toList();
        for (int i = 0; i < result.size(); i++) {
            Node node = result.get(i);
            if (node.trimLeft() && i > 0 && result.get(i - 1) instanceof Node.Text before) {
                result.set(i - 1, before.withContent(before.content().stripTrailing()));
            }
            if (node.trimRight() && i + 1 < result.size() && result.get(i + 1) instanceof Node.Text after) {
                result.set(i + 1, after.withContent(after.content().stripLeading()));
            }
        }
        return result.toImmutable();
    }
}
