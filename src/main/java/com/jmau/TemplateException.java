package com.jmau;

/**
 * Base for all template failures. A {@link Kind#RUNTIME} failure aborts the whole render; a
 * {@link Kind#PARSE} failure normally stays inside the parser, where the offending span is kept
 * as literal text.
 */
public class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        PARSE,
        RUNTIME
    }

    private final Kind kind;

    public TemplateException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TemplateException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TemplateException runtime(String message) {
        return new TemplateException(Kind.RUNTIME, message);
    }

    public Kind kind() {
        return kind;
    }
}
