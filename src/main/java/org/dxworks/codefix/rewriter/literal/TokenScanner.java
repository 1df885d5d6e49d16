package org.dxworks.codefix.rewriter.literal;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds construction expressions opened by a fixed marker (for example {@code &Device})
 * immediately followed by '{', and bounds each one at its balanced closing '}'.
 * Markers and braces inside strings and comments are ignored.
 */
public final class TokenScanner {

    private final String marker;

    public TokenScanner(String marker) {
        Objects.requireNonNull(marker, "marker");
        if (marker.isBlank() || marker.contains("{")) {
            throw new IllegalArgumentException("Invalid literal marker: '" + marker + "'");
        }
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    /**
     * Scans forward from {@code from}, which must be a position outside any string or comment.
     *
     * @return the span from the marker to the matching '}' inclusive, or empty when no marker remains
     * @throws UnterminatedLiteralException when a marker is found but its braces never balance
     */
    public Optional<Span> scan(String buffer, int from) throws UnterminatedLiteralException {
        int i = Math.max(0, from);
        while (i < buffer.length()) {
            int skipped = SourceTextUtils.skipLiteralOrComment(buffer, i);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            if (buffer.startsWith(marker, i) && startsOnBoundary(buffer, i)) {
                int open = i + marker.length();
                if (open < buffer.length() && buffer.charAt(open) == '{') {
                    int close = SourceTextUtils.findMatchingBrace(buffer, open);
                    if (close < 0) {
                        throw new UnterminatedLiteralException(i, marker);
                    }
                    return Optional.of(new Span(i, close + 1));
                }
            }
            i++;
        }
        return Optional.empty();
    }

    private boolean startsOnBoundary(String buffer, int i) {
        if (i == 0) return true;
        char prev = buffer.charAt(i - 1);
        char first = marker.charAt(0);
        if (SourceTextUtils.isIdentifierChar(first)) {
            return !SourceTextUtils.isIdentifierChar(prev) && prev != '.';
        }
        return prev != first && !SourceTextUtils.isIdentifierChar(prev);
    }
}
