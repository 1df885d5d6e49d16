package org.dxworks.codefix.rewriter.literal;

import org.dxworks.codefix.model.Diagnostic;

import java.util.List;
import java.util.Set;

/**
 * Result of one scan-extract-decide-emit pass over a buffer.
 */
public final class PassResult {

    private final String text;
    private final int rewriteCount;
    private final List<Diagnostic> diagnostics;
    private final Set<String> helpersUsed;

    public PassResult(String text, int rewriteCount, List<Diagnostic> diagnostics, Set<String> helpersUsed) {
        this.text = text;
        this.rewriteCount = rewriteCount;
        this.diagnostics = List.copyOf(diagnostics);
        this.helpersUsed = Set.copyOf(helpersUsed);
    }

    public String getText() {
        return text;
    }

    public int getRewriteCount() {
        return rewriteCount;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public Set<String> getHelpersUsed() {
        return helpersUsed;
    }
}
