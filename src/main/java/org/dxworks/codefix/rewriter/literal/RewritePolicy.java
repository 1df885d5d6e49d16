package org.dxworks.codefix.rewriter.literal;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Picks the replacement for an extracted field list.
 * <p>
 * Rules are tried in the given order and the first one whose required fields are all present wins,
 * even when a later rule would consume more fields. Callers order rules from the most required
 * fields to the fewest.
 * <p>
 * A literal without fields is never rewritten: it is the shape the rewritten code itself
 * uses ({@code &Device{}} followed by assignments), so leaving it alone keeps reruns stable.
 */
public final class RewritePolicy {

    public RewriteDecision decide(List<Field> fields, List<RewriteRule> rules) {
        if (fields.isEmpty()) {
            return RewriteDecision.noRewrite(RewriteDecision.Reason.NO_FIELDS);
        }

        Map<String, Field> byName = fields.stream()
                .collect(Collectors.toMap(Field::getName, f -> f, (a, b) -> a, LinkedHashMap::new));

        for (RewriteRule rule : rules) {
            if (!rule.matches(byName.keySet())) {
                continue;
            }
            if (!rule.isHelperCall()) {
                return RewriteDecision.matched(rule, List.of(), List.of(), fields);
            }

            List<String> arguments = new ArrayList<>();
            List<Field> core = new ArrayList<>();
            for (RuleParameter parameter : rule.getParameters()) {
                Field field = byName.get(parameter.getField());
                if (field != null) {
                    core.add(field);
                    arguments.add(SourceTextUtils.collapseLineBreaks(field.getRawValue()));
                } else {
                    arguments.add(parameter.getDefaultValue());
                }
            }
            arguments.addAll(rule.getTrailingArguments());

            List<Field> extras = fields.stream()
                    .filter(f -> !rule.covers(f.getName()))
                    .collect(Collectors.toList());

            return RewriteDecision.matched(rule, arguments, core, extras);
        }

        return RewriteDecision.noRewrite(RewriteDecision.Reason.NO_MATCHING_RULE);
    }
}
