package com.jmau;

import com.jmau.template.BlockResolver;
import com.jmau.template.Node;
import com.jmau.template.TemplateParser;
import com.jmau.template.WhitespaceProcessor;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * A template run through parsing, whitespace trimming and block resolution. Immutable, so one
 * compiled template can be rendered by many threads at once.
 */
public record CompiledTemplate(String source, ImmutableList<Node> nodes) {

    /**
     * Compiles template text. Grammar problems inside a span never fail the compile; the span is
     * kept as text instead.
     *
     * @throws IllegalArgumentException when {@code source} is null
     */
    public static CompiledTemplate compile(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Template must not be null");
        }
        ImmutableList<Node> parsed = TemplateParser.parse(source);
        ImmutableList<Node> trimmed = WhitespaceProcessor.apply(parsed);
        return new CompiledTemplate(source, BlockResolver.resolve(trimmed));
    }
}
