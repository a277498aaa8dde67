package com.jmau.directive;

import com.jmau.CompiledTemplate;
import com.jmau.TemplateException;
import com.jmau.render.Context;
import com.jmau.render.RenderOptions;
import com.jmau.render.Renderer;
import com.jmau.value.Value;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Renders a nested map or list whose strings may contain template syntax. Maps carrying a
 * directive key are replaced by the directive's result; other maps keep their keys and have their
 * values rendered.
 */
public class MapRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(MapRenderer.class);

    private final Renderer renderer;

    public MapRenderer(Renderer renderer) {
        this.renderer = renderer;
    }

    public Value render(Value template, Context context, RenderOptions options) {
        if (template instanceof Value.StringValue s) {
            return renderString(s, context, options);
        }
        if (template instanceof Value.ListValue list) {
            return new Value.ListValue(list.elements().collect(element -> render(element, context, options)));
        }
        if (template instanceof Value.MapValue map) {
            Optional<MapDirectives.Match> directive = MapDirectives.match(map);
            if (directive.isPresent()) {
                return MapDirectives.apply(directive.get(), context, options, this::render);
            }
            MutableMap<Value.Key, Value> rendered = Maps.mutable.empty();
            map.entries().forEachKeyValue((key, value) -> rendered.put(key, render(value, context, options)));
            return new Value.MapValue(rendered.toImmutable());
        }
        return template;
    }

    /** A string that fails to render is kept as written. */
    private Value renderString(Value.StringValue template, Context context, RenderOptions options) {
        if (!hasTemplateSyntax(template.value())) {
            return template;
        }
        try {
            return renderer.render(CompiledTemplate.compile(template.value()).nodes(), context, options);
        } catch (TemplateException e) {
            LOG.warn("Keeping template string '{}' unrendered: {}", template.value(), e.getMessage());
            return template;
        }
    }

    static boolean hasTemplateSyntax(String text) {
        return text.contains("{{") || text.contains("{%") || text.contains("{#");
    }
}
