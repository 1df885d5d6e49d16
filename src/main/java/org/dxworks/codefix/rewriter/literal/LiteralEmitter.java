package org.dxworks.codefix.rewriter.literal;

/**
 * Renders the replacement text for a matched construction expression.
 * Values are relocated as written; only their line breaks are collapsed.
 */
public final class LiteralEmitter {

    private final String marker;

    public LiteralEmitter(String marker) {
        this.marker = marker;
    }

    /**
     * {@code helper(args)}, or the empty literal {@code marker{}} for assignment rules.
     */
    public String renderCall(RewriteDecision decision) {
        if (!decision.getRule().isHelperCall()) {
            return marker + "{}";
        }
        return decision.getRule().getHelper() + "(" + String.join(", ", decision.getArguments()) + ")";
    }

    /**
     * Call or empty literal followed by one {@code receiver.Field = value} line per extra field.
     */
    public String render(EmitContext context, RewriteDecision decision) {
        StringBuilder sb = new StringBuilder(renderCall(decision));
        for (Field extra : decision.getExtraFields()) {
            sb.append(context.getLineSeparator())
              .append(context.getIndent())
              .append(context.getReceiver())
              .append('.')
              .append(extra.getName())
              .append(" = ")
              .append(SourceTextUtils.collapseLineBreaks(extra.getRawValue()));
        }
        return sb.toString();
    }

    /**
     * Statements that build the receiver ahead of the line that used the literal inline.
     */
    public String renderHoisted(EmitContext context, RewriteDecision decision) {
        return context.getIndent() + context.getReceiver() + " := "
                + render(context, decision) + context.getLineSeparator();
    }
}
