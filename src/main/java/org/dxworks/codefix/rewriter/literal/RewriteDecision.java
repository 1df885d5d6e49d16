package org.dxworks.codefix.rewriter.literal;

import java.util.List;

/**
 * Outcome of {@link RewritePolicy#decide}: either a matched rule with its argument list and
 * extra fields, or no rewrite together with the reason.
 */
public final class RewriteDecision {

    public enum Reason {
        MATCHED,
        NO_FIELDS,
        NO_MATCHING_RULE
    }

    private final Reason reason;
    private final RewriteRule rule;
    private final List<String> arguments;
    private final List<Field> coreFields;
    private final List<Field> extraFields;

    private RewriteDecision(Reason reason, RewriteRule rule, List<String> arguments,
                            List<Field> coreFields, List<Field> extraFields) {
        this.reason = reason;
        this.rule = rule;
        this.arguments = arguments;
        this.coreFields = coreFields;
        this.extraFields = extraFields;
    }

    static RewriteDecision matched(RewriteRule rule, List<String> arguments,
                                   List<Field> coreFields, List<Field> extraFields) {
        return new RewriteDecision(Reason.MATCHED, rule, List.copyOf(arguments),
                List.copyOf(coreFields), List.copyOf(extraFields));
    }

    static RewriteDecision noRewrite(Reason reason) {
        return new RewriteDecision(reason, null, List.of(), List.of(), List.of());
    }

    public boolean isRewrite() {
        return reason == Reason.MATCHED;
    }

    public Reason getReason() {
        return reason;
    }

    public RewriteRule getRule() {
        return rule;
    }

    /** Helper call arguments in rule order: field values, defaults for absent optional fields, then trailing constants. */
    public List<String> getArguments() {
        return arguments;
    }

    public List<Field> getCoreFields() {
        return coreFields;
    }

    public List<Field> getExtraFields() {
        return extraFields;
    }
}
