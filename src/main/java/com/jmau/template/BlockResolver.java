package com.jmau.template;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Folds {@code if/elsif/else/endif} and {@code for/endfor} tag runs into {@link Node.IfBlock} and
 * {@link Node.ForBlock} using one stack entry per open block.
 *
 * <p>Irregular input never fails. A closer, {@code elsif} or {@code else} that does not fit the
 * innermost open block stays in place as an inert tag, which renders as nothing. A block still
 * open at the end of input is closed there.
 */
public final class BlockResolver {

    private BlockResolver() {
    }

    public static ImmutableList<Node> resolve(ImmutableList<Node> nodes) {
        Deque<OpenBlock> stack = new ArrayDeque<>();
        MutableList<Node> root = Lists.mutable.empty();
        for (Node node : nodes) {
            if (node instanceof Node.TagNode tagNode && handleTag(tagNode.tag(), stack, root)) {
                continue;
            }
            emit(node, stack, root);
        }
        while (!stack.isEmpty()) {
            emit(stack.pop().close(), stack, root);
        }
        return root.toImmutable();
    }

    /** Returns {@code false} when the tag does not take part in block structure here. */
    private static boolean handleTag(Tag tag, Deque<OpenBlock> stack, MutableList<Node> root) {
        OpenBlock top = stack.peek();
        if (tag instanceof Tag.If opener) {
            stack.push(new OpenIf(opener.condition()));
            return true;
        }
        if (tag instanceof Tag.For opener) {
            stack.push(new OpenFor(opener.variable(), opener.source()));
            return true;
        }
        if (tag instanceof Tag.Elsif elsif && top instanceof OpenIf openIf && openIf.acceptsBranches()) {
            openIf.addBranch(elsif.condition());
            return true;
        }
        if (tag instanceof Tag.Else && top instanceof OpenIf openIf && openIf.acceptsBranches()) {
            openIf.startElse();
            return true;
        }
        if (tag instanceof Tag.EndIf && top instanceof OpenIf) {
            emit(stack.pop().close(), stack, root);
            return true;
        }
        if (tag instanceof Tag.EndFor && top instanceof OpenFor) {
            emit(stack.pop().close(), stack, root);
            return true;
        }
        return false;
    }

    private static void emit(Node node, Deque<OpenBlock> stack, MutableList<Node> root) {
        if (stack.isEmpty()) {
            root.add(node);
        } else {
            stack.peek().add(node);
        }
    }

    private abstract static class OpenBlock {
        abstract void add(Node node);

        abstract Node close();
    }

    private static final class OpenIf extends OpenBlock {
        private final MutableList<Expression> conditions = Lists.mutable.empty();
        private final MutableList<MutableList<Node>> bodies = Lists.mutable.empty();
        private MutableList<Node> elseBody;

        OpenIf(Expression condition) {
            addBranch(condition);
        }

        boolean acceptsBranches() {
            return elseBody == null;
        }

        void addBranch(Expression condition) {
            conditions.add(condition);
            bodies.add(Lists.mutable.empty());
        }

        void startElse() {
            elseBody = Lists.mutable.empty();
        }

        @Override
        void add(Node node) {
            if (elseBody != null) {
                elseBody.add(node);
            } else {
                bodies.getLast().add(node);
            }
        }

        @Override
        Node close() {
            ImmutableList<Node.Branch> branches = conditions.zip(bodies)
                    .collect(pair -> new Node.Branch(pair.getOne(), pair.getTwo().toImmutable()))
                    .toImmutable();
            ImmutableList<Node> otherwise = elseBody == null ? Lists.immutable.empty() : elseBody.toImmutable();
            return new Node.IfBlock(branches, otherwise);
        }
    }

    private static final class OpenFor extends OpenBlock {
        private final String variable;
        private final Expression source;
        private final MutableList<Node> body = Lists.mutable.empty();

        OpenFor(String variable, Expression source) {
            this.variable = variable;
            this.source = source;
        }

        @Override
        void add(Node node) {
            body.add(node);
        }

        @Override
        Node close() {
            return new Node.ForBlock(variable, source, body.toImmutable());
        }
    }
}
