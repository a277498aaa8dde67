package com.jmau.template;

import com.jmau.TemplateException;

/** Grammar failure inside one expression or tag span. */
public final class TemplateSyntaxException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public TemplateSyntaxException(String message, int position) {
        super(Kind.PARSE, message + " at position " + position);
        this.position = position;
    }

    /** Offset of the failure within the span's source. */
    public int position() {
        return position;
    }
}
