package com.jmau.filter;

/** Raised by a filter implementation that cannot handle its subject or arguments. */
public class FilterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FilterException(String message) {
        super(message);
    }
}
