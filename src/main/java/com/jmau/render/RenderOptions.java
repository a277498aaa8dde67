package com.jmau.render;

/**
 * Render switches.
 *
 * @param preserveTypes when the template is a single bare expression, return its value with its
 *                      own type instead of its string form
 */
public record RenderOptions(boolean preserveTypes) {

    private static final RenderOptions DEFAULTS = new RenderOptions(false);
    private static final RenderOptions PRESERVING_TYPES = new RenderOptions(true);

    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public static RenderOptions preservingTypes() {
        return PRESERVING_TYPES;
    }
}
