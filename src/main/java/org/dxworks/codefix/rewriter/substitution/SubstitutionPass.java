package org.dxworks.codefix.rewriter.substitution;

import org.dxworks.codefix.Language;

import java.util.List;
import java.util.regex.Matcher;

/**
 * Applies the configured token substitutions, in order, to one buffer.
 */
public final class SubstitutionPass {

    private final List<TokenSubstitution> substitutions;

    public SubstitutionPass(List<TokenSubstitution> substitutions) {
        this.substitutions = List.copyOf(substitutions);
    }

    public boolean isEmpty() {
        return substitutions.isEmpty();
    }

    public Result apply(String buffer, Language language) {
        String current = buffer;
        int count = 0;
        for (TokenSubstitution substitution : substitutions) {
            if (!substitution.appliesTo(language)) continue;

            Matcher matcher = substitution.getPattern().matcher(current);
            StringBuilder sb = new StringBuilder(current.length());
            int replaced = 0;
            while (matcher.find()) {
                matcher.appendReplacement(sb, substitution.getReplacement());
                replaced++;
            }
            if (replaced > 0) {
                matcher.appendTail(sb);
                current = sb.toString();
                count += replaced;
            }
        }
        return new Result(current, count);
    }

    public static final class Result {
        private final String text;
        private final int count;

        Result(String text, int count) {
            this.text = text;
            this.count = count;
        }

        public String getText() {
            return text;
        }

        public int getCount() {
            return count;
        }
    }
}
