package com.jmau.render;

import com.jmau.TemplateException;
import com.jmau.output.ValueFormatter;
import com.jmau.template.Node;
import com.jmau.template.Tag;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Walks resolved nodes, writing output and threading the context from node to node. An
 * {@code assign} rebinds a name for every later node, including nodes after the enclosing block.
 *
 * <p>A {@code for} loop restores its variable and {@code forloop} to their outer bindings when it
 * ends, so an {@code assign} to the loop variable's own name inside the body does not outlive the
 * loop. Block nesting deeper than {@value #MAX_BLOCK_DEPTH} is a runtime error.
 */
public class Renderer {

    static final String FORLOOP = "forloop";
    static final int MAX_BLOCK_DEPTH = 512;

    private final Evaluator evaluator;

    public Renderer(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Renders the nodes to a string value, or, when types are preserved and the nodes are a single
     * expression, to that expression's value.
     *
     * @throws TemplateException a runtime error, which aborts the whole render
     */
    public Value render(ImmutableList<Node> nodes, Context context, RenderOptions options) {
        if (options.preserveTypes() && nodes.size() == 1 && nodes.getFirst() instanceof Node.ExpressionNode only) {
            return evaluator.evaluate(only.expression(), context);
        }
        StringBuilder out = new StringBuilder();
        renderNodes(nodes, context, out, 0);
        return Value.of(out.toString());
    }

    private Context renderNodes(ImmutableList<Node> nodes, Context context, StringBuilder out, int depth) {
        if (depth > MAX_BLOCK_DEPTH) {
            throw TemplateException.runtime("Blocks nested too deeply");
        }
        Context current = context;
        for (Node node : nodes) {
            current = renderNode(node, current, out, depth);
        }
        return current;
    }

    private Context renderNode(Node node, Context context, StringBuilder out, int depth) {
        if (node instanceof Node.Text text) {
            out.append(text.content());
            return context;
        }
        if (node instanceof Node.ExpressionNode expression) {
            out.append(ValueFormatter.stringify(evaluator.evaluate(expression.expression(), context)));
            return context;
        }
        if (node instanceof Node.IfBlock block) {
            return renderIf(block, context, out, depth);
        }
        if (node instanceof Node.ForBlock block) {
            return renderFor(block, context, out, depth);
        }
        Tag tag = ((Node.TagNode) node).tag();
        if (tag instanceof Tag.Assign assign) {
            return context.with(assign.name(), evaluator.evaluate(assign.value(), context));
        }
        // unmatched block tags are inert
        return context;
    }

    private Context renderIf(Node.IfBlock block, Context context, StringBuilder out, int depth) {
        for (Node.Branch branch : block.branches()) {
            if (Evaluator.strictTruthy(evaluator.evaluate(branch.condition(), context))) {
                return renderNodes(branch.body(), context, out, depth + 1);
            }
        }
        return renderNodes(block.elseBody(), context, out, depth + 1);
    }

    private Context renderFor(Node.ForBlock block, Context context, StringBuilder out, int depth) {
        Value source = evaluator.evaluate(block.source(), context);
        if (source instanceof Value.NullValue) {
            return context;
        }
        if (!(source instanceof Value.ListValue list)) {
            throw TemplateException.runtime("For loop iterable must be a list");
        }
        Value parentloop = context.get(FORLOOP);
        int length = list.size();
        Context current = context;
        for (int i = 0; i < length; i++) {
            Value.MapValue forloop = Value.MapValue.empty()
                    .with("index", Value.of(i))
                    .with("rindex", Value.of(length - 1 - i))
                    .with("first", Value.of(i == 0))
                    .with("last", Value.of(i == length - 1))
                    .with("length", Value.of(length))
                    .with("parentloop", parentloop);
            Context iteration = current
                    .with(block.variable(), list.elements().get(i))
                    .with(FORLOOP, forloop);
            current = renderNodes(block.body(), iteration, out, depth + 1);
        }
        return current.restore(block.variable(), context).restore(FORLOOP, context);
    }
}
