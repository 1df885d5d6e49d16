package org.dxworks.codefix.rewriter.literal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replacement of one span of a buffer. An empty span is an insertion.
 */
public final class Rewrite {

    private final Span span;
    private final String replacementText;

    public Rewrite(Span span, String replacementText) {
        this.span = span;
        this.replacementText = replacementText;
    }

    public Span getSpan() {
        return span;
    }

    public String getReplacementText() {
        return replacementText;
    }

    /**
     * Builds a new buffer left to right, copying the text between rewrites unchanged.
     *
     * @throws IllegalArgumentException if two rewrites overlap or a span lies outside the buffer
     */
    public static String apply(String buffer, List<Rewrite> rewrites) {
        List<Rewrite> ordered = new ArrayList<>(rewrites);
        ordered.sort(Comparator.comparingInt((Rewrite r) -> r.span.getStart())
                .thenComparingInt(r -> r.span.getEnd()));

        StringBuilder sb = new StringBuilder(buffer.length());
        int cursor = 0;
        for (Rewrite rewrite : ordered) {
            Span span = rewrite.span;
            if (span.getStart() < cursor) {
                throw new IllegalArgumentException("Overlapping rewrite at " + span);
            }
            if (span.getEnd() > buffer.length()) {
                throw new IllegalArgumentException("Rewrite " + span + " exceeds buffer length " + buffer.length());
            }
            sb.append(buffer, cursor, span.getStart());
            sb.append(rewrite.replacementText);
            cursor = span.getEnd();
        }
        sb.append(buffer, cursor, buffer.length());
        return sb.toString();
    }

    @Override
    public String toString() {
        return span + " -> " + replacementText;
    }
}
