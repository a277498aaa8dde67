package com.jmau.directive;

import com.jmau.render.Context;
import com.jmau.render.RenderOptions;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Reserved {@code #} keys that turn a map template into a transformation. A directive's arguments
 * are templates themselves and are rendered through the {@link TemplateRenderer} handed in, so
 * directives nest.
 *
 * <p>Loop-style directives bind {@code $loop} to {@code {item, index, parentloop}} while rendering
 * their per-item template; {@code #pipe} binds {@code $self} to the value threaded so far.
 */
public final class MapDirectives {

    private static final Logger LOG = LoggerFactory.getLogger(MapDirectives.class);

    static final String LOOP = "$loop";
    static final String SELF = "$self";

    /** Renders a nested template value. */
    @FunctionalInterface
    public interface TemplateRenderer {
        Value render(Value template, Context context, RenderOptions options);
    }

    public enum Directive {
        MAP("#map", arity -> arity > 0),
        FLAT_MAP("#flat_map", arity -> arity == 2),
        MERGE("#merge", arity -> arity > 0),
        IF("#if", arity -> arity == 2 || arity == 3),
        FILTER("#filter", arity -> arity == 2),
        PICK("#pick", arity -> arity == 2),
        PIPE("#pipe", arity -> arity == 2);

        private final String key;
        private final IntPredicate arity;

        Directive(String key, IntPredicate arity) {
            this.key = key;
            this.arity = arity;
        }

        public String key() {
            return key;
        }

        boolean accepts(ImmutableList<Value> args) {
            if (!arity.test(args.size())) {
                return false;
            }
            return this != PIPE || args.get(1) instanceof Value.ListValue;
        }
    }

    public record Match(Directive directive, ImmutableList<Value> args) {}

    private MapDirectives() {
    }

    /**
     * Finds the directive a map template asks for. Directives are tried in declaration order and
     * only a list argument of an accepted length counts; anything else leaves the map a plain map.
     */
    public static Optional<Match> match(Value.MapValue template) {
        for (Directive directive : Directive.values()) {
            Value args = template.entries().get(new Value.StringValue(directive.key()));
            if (args instanceof Value.ListValue list && directive.accepts(list.elements())) {
                return Optional.of(new Match(directive, list.elements()));
            }
        }
        return Optional.empty();
    }

    public static Value apply(Match match, Context context, RenderOptions options, TemplateRenderer renderer) {
        LOG.debug("Applying {} directive with {} arguments", match.directive().key(), match.args().size());
        ImmutableList<Value> args = match.args();
        switch (match.directive()) {
            case MAP:
                return map(args, context, options, renderer);
            case FLAT_MAP:
                return flatMap(args, context, options, renderer);
            case MERGE:
                return merge(args, context, options, renderer);
            case IF:
                return conditional(args, context, options, renderer);
            case FILTER:
                return filter(args, context, options, renderer);
            case PICK:
                return pick(args, context, options, renderer);
            case PIPE:
                return pipe(args, context, options, renderer);
            default:
                throw new IllegalStateException("Unhandled directive " + match.directive());
        }
    }

    private static Value map(ImmutableList<Value> args, Context context, RenderOptions options,
                             TemplateRenderer renderer) {
        if (args.size() != 2) {
            return Value.ListValue.empty();
        }
        ImmutableList<Value> items = items(renderer.render(args.get(0), context, options));
        MutableList<Value> results = Lists.mutable.empty();
        items.forEachWithIndex((item, index) ->
                results.add(renderer.render(args.get(1), loopContext(context, item, index), options)));
        return new Value.ListValue(results.toImmutable());
    }

    private static Value flatMap(ImmutableList<Value> args, Context context, RenderOptions options,
                                 TemplateRenderer renderer) {
        ImmutableList<Value> items = items(renderer.render(args.get(0), context, options));
        MutableList<Value> results = Lists.mutable.empty();
        items.forEachWithIndex((item, index) ->
                results.addAllIterable(items(renderer.render(args.get(1), loopContext(context, item, index), options))));
        return new Value.ListValue(results.toImmutable());
    }

    private static Value merge(ImmutableList<Value> args, Context context, RenderOptions options,
                               TemplateRenderer renderer) {
        MutableMap<Value.Key, Value> merged = Maps.mutable.empty();
        for (Value template : args) {
            if (renderer.render(template, context, options) instanceof Value.MapValue map) {
                merged.putAll(map.entries().castToMap());
            }
        }
        return new Value.MapValue(merged.toImmutable());
    }

    private static Value conditional(ImmutableList<Value> args, Context context, RenderOptions options,
                                     TemplateRenderer renderer) {
        if (truthy(renderer.render(args.get(0), context, options))) {
            return renderer.render(args.get(1), context, options);
        }
        return args.size() == 3 ? renderer.render(args.get(2), context, options) : Value.NULL;
    }

    private static Value filter(ImmutableList<Value> args, Context context, RenderOptions options,
                                TemplateRenderer renderer) {
        ImmutableList<Value> items = items(renderer.render(args.get(0), context, options));
        MutableList<Value> kept = Lists.mutable.empty();
        items.forEachWithIndex((item, index) -> {
            if (truthy(renderer.render(args.get(1), loopContext(context, item, index), options))) {
                kept.add(item);
            }
        });
        return new Value.ListValue(kept.toImmutable());
    }

    private static Value pick(ImmutableList<Value> args, Context context, RenderOptions options,
                              TemplateRenderer renderer) {
        if (!(args.get(1) instanceof Value.ListValue keys)
                || !(renderer.render(args.get(0), context, options) instanceof Value.MapValue map)) {
            return Value.MapValue.empty();
        }
        MutableMap<Value.Key, Value> picked = Maps.mutable.empty();
        for (Value key : keys.elements()) {
            if (key instanceof Value.Key k && map.entries().containsKey(k)) {
                picked.put(k, map.entries().get(k));
            }
        }
        return new Value.MapValue(picked.toImmutable());
    }

    /** Threads a value through directive maps, injecting it as the first argument of each step. */
    private static Value pipe(ImmutableList<Value> args, Context context, RenderOptions options,
                              TemplateRenderer renderer) {
        Value accumulated = renderer.render(args.get(0), context, options);
        for (Value step : ((Value.ListValue) args.get(1)).elements()) {
            Value injected = step instanceof Value.MapValue stepMap ? inject(stepMap, accumulated) : step;
            accumulated = renderer.render(injected, context.with(SELF, accumulated), options);
        }
        return accumulated;
    }

    private static Value.MapValue inject(Value.MapValue step, Value piped) {
        MutableMap<Value.Key, Value> entries = Maps.mutable.empty();
        step.entries().forEachKeyValue((key, args) -> entries.put(key,
                key.name().startsWith("#") ? Value.ListValue.of(piped, args) : args));
        return new Value.MapValue(entries.toImmutable());
    }

    private static Context loopContext(Context context, Value item, int index) {
        Value.MapValue loop = Value.MapValue.empty()
                .with("item", item)
                .with("index", Value.of(index))
                .with("parentloop", context.get(LOOP));
        return context.with(LOOP, loop);
    }

    private static ImmutableList<Value> items(Value collection) {
        return collection instanceof Value.ListValue list ? list.elements() : Lists.immutable.empty();
    }

    /** Directive truthiness: null, false, the empty string and empty collections are false. */
    static boolean truthy(Value value) {
        if (value instanceof Value.NullValue || Value.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof Value.StringValue s) {
            return !s.value().isEmpty();
        }
        if (value instanceof Value.ListValue list) {
            return !list.isEmpty();
        }
        if (value instanceof Value.MapValue map) {
            return !map.isEmpty();
        }
        return true;
    }
}
