package org.dxworks.codefix.rewriter.literal;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where a construction expression sits: as the whole right-hand side of a declaration or
 * assignment statement, or somewhere inside a larger expression.
 */
public final class EmitContext {

    public enum Kind {
        DECLARATION,
        EXPRESSION
    }

    // w := &T{...}   var w = &T{...}   s.child = &T{...}
    private static final Pattern DECLARATION_PREFIX = Pattern.compile(
            "^\\s*(?:var\\s+)?([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\s*(?::=|=)\\s*$");

    private final Kind kind;
    private final String receiver;
    private final String indent;
    private final String lineSeparator;

    public EmitContext(Kind kind, String receiver, String indent, String lineSeparator) {
        this.kind = kind;
        this.receiver = receiver;
        this.indent = indent;
        this.lineSeparator = lineSeparator;
    }

    /**
     * Classifies the span. In expression context the receiver is the configured one, possibly null.
     */
    public static EmitContext detect(String buffer, Span span, String configuredReceiver) {
        int lineStart = SourceTextUtils.lineStart(buffer, span.getStart());
        String indent = SourceTextUtils.indentationAt(buffer, span.getStart());
        String separator = SourceTextUtils.lineSeparatorOf(buffer);

        Matcher m = DECLARATION_PREFIX.matcher(buffer.substring(lineStart, span.getStart()));
        if (m.matches() && endsStatement(buffer, span.getEnd())) {
            return new EmitContext(Kind.DECLARATION, m.group(1), indent, separator);
        }
        return new EmitContext(Kind.EXPRESSION, configuredReceiver, indent, separator);
    }

    private static boolean endsStatement(String buffer, int offset) {
        String rest = buffer.substring(offset, SourceTextUtils.lineEnd(buffer, offset));
        return SourceTextUtils.stripComments(rest).isBlank();
    }

    public Kind getKind() {
        return kind;
    }

    public String getReceiver() {
        return receiver;
    }

    public String getIndent() {
        return indent;
    }

    public String getLineSeparator() {
        return lineSeparator;
    }

    public boolean isDeclaration() {
        return kind == Kind.DECLARATION;
    }

    public boolean hasReceiver() {
        return receiver != null && !receiver.isBlank();
    }
}
