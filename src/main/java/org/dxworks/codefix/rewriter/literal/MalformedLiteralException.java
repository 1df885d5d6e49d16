package org.dxworks.codefix.rewriter.literal;

/**
 * A construction expression whose content cannot be split into {@code name: value} fields.
 * The span is left untouched.
 */
public class MalformedLiteralException extends Exception {

    private final Span span;

    public MalformedLiteralException(Span span, String message) {
        super(message);
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
