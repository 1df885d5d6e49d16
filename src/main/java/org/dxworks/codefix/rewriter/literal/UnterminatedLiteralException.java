package org.dxworks.codefix.rewriter.literal;

/**
 * Raised when a marker opens a construction expression that is still unbalanced at end of buffer.
 */
public class UnterminatedLiteralException extends Exception {

    private final int markerStart;

    public UnterminatedLiteralException(int markerStart, String marker) {
        super("Unterminated literal " + marker + "{ starting at offset " + markerStart);
        this.markerStart = markerStart;
    }

    public int getMarkerStart() {
        return markerStart;
    }
}
