package org.dxworks.codefix.rewriter;

import org.dxworks.codefix.Language;
import org.dxworks.codefix.model.Diagnostic;

import java.util.List;

/**
 * In-memory result of rewriting one file. Nothing has been written yet.
 */
public final class FileOutcome {

    private final String filePath;
    private final Language language;
    private final String originalText;
    private final String rewrittenText;
    private final int literalRewrites;
    private final int substitutions;
    private final List<String> insertedHelpers;
    private final List<Diagnostic> diagnostics;

    public FileOutcome(String filePath, Language language, String originalText, String rewrittenText,
                       int literalRewrites, int substitutions,
                       List<String> insertedHelpers, List<Diagnostic> diagnostics) {
        this.filePath = filePath;
        this.language = language;
        this.originalText = originalText;
        this.rewrittenText = rewrittenText;
        this.literalRewrites = literalRewrites;
        this.substitutions = substitutions;
        this.insertedHelpers = List.copyOf(insertedHelpers);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean isChanged() {
        return !originalText.equals(rewrittenText);
    }

    public int getRewriteCount() {
        return literalRewrites + substitutions;
    }

    public String getFilePath() {
        return filePath;
    }

    public Language getLanguage() {
        return language;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getRewrittenText() {
        return rewrittenText;
    }

    public int getLiteralRewrites() {
        return literalRewrites;
    }

    public int getSubstitutions() {
        return substitutions;
    }

    public List<String> getInsertedHelpers() {
        return insertedHelpers;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
