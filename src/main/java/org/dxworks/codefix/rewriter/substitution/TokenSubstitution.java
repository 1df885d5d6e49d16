package org.dxworks.codefix.rewriter.substitution;

import org.dxworks.codefix.Language;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Verbatim rename of a call prefix, e.g. {@code console.log(} to {@code window.__pm_shared.log(}.
 * The replacement may reference pattern groups as {@code $1}.
 */
public final class TokenSubstitution {

    private final Pattern pattern;
    private final String replacement;
    private final Set<Language> languages;

    public TokenSubstitution(String pattern, String replacement, Set<Language> languages) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        try {
            this.pattern = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid substitution pattern: " + pattern, e);
        }
        this.replacement = replacement;
        this.languages = languages == null || languages.isEmpty()
                ? EnumSet.allOf(Language.class)
                : EnumSet.copyOf(languages);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public boolean appliesTo(Language language) {
        return languages.contains(language);
    }
}
