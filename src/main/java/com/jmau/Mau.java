package com.jmau;

import com.jmau.directive.MapRenderer;
import com.jmau.filter.FilterRegistry;
import com.jmau.output.ValueFormatter;
import com.jmau.render.Context;
import com.jmau.render.Evaluator;
import com.jmau.render.RenderOptions;
import com.jmau.render.Renderer;
import com.jmau.value.Value;

import java.util.Map;

/**
 * Entry point of the template engine.
 *
 * <pre>{@code
 * Mau mau = Mau.create();
 * String greeting = mau.renderToString("Hello {{ name | capitalize }}!", Map.of("name", "ada"));
 * }</pre>
 *
 * <p>Instances hold no per-render state and are safe to share.
 */
public class Mau {

    private final Renderer renderer;
    private final MapRenderer mapRenderer;

    public Mau(FilterRegistry filters) {
        this.renderer = new Renderer(new Evaluator(filters));
        this.mapRenderer = new MapRenderer(renderer);
    }

    /** An engine with the built-in filters. */
    public static Mau create() {
        return new Mau(FilterRegistry.builtIn());
    }

    public CompiledTemplate compile(String template) {
        return CompiledTemplate.compile(template);
    }

    /**
     * Renders a compiled template.
     *
     * @return a string value, or with {@link RenderOptions#preserveTypes()} the typed value of a
     *         template that is one bare expression
     * @throws TemplateException on a runtime error; no partial output is produced
     */
    public Value render(CompiledTemplate template, Context context, RenderOptions options) {
        return renderer.render(template.nodes(), context, options);
    }

    public Value render(String template, Context context, RenderOptions options) {
        return render(compile(template), context, options);
    }

    public Value render(String template, Map<String, ?> variables, RenderOptions options) {
        return render(compile(template), Context.of(variables), options);
    }

    public String renderToString(String template, Map<String, ?> variables) {
        return ValueFormatter.stringify(render(template, variables, RenderOptions.defaults()));
    }

    public String renderToString(CompiledTemplate template, Context context) {
        return ValueFormatter.stringify(render(template, context, RenderOptions.defaults()));
    }

    /**
     * Renders every template string nested inside {@code template}, applying map directives. A
     * string whose render fails is kept unchanged.
     */
    public Value renderMap(Value template, Context context, RenderOptions options) {
        return mapRenderer.render(template, context, options);
    }
}
