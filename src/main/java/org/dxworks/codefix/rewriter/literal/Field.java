package org.dxworks.codefix.rewriter.literal;

/**
 * One {@code name: value} entry of a construction expression.
 * The raw value is trimmed, keeps its internal line breaks and has comments removed.
 */
public final class Field {

    private final String name;
    private final String rawValue;
    private final Span valueSpan;

    public Field(String name, String rawValue, Span valueSpan) {
        this.name = name;
        this.rawValue = rawValue;
        this.valueSpan = valueSpan;
    }

    public String getName() {
        return name;
    }

    public String getRawValue() {
        return rawValue;
    }

    public Span getValueSpan() {
        return valueSpan;
    }

    @Override
    public String toString() {
        return name + ": " + rawValue;
    }
}
