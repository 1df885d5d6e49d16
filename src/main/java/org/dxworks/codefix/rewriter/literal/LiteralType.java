package org.dxworks.codefix.rewriter.literal;

import org.dxworks.codefix.Language;

import java.util.*;

/**
 * One literal shape being migrated: its marker, the ordered rule table, the receiver used when a
 * construction with extra fields has to be hoisted out of an expression, and the source text of
 * the helper declarations to insert into files that lack them.
 */
public final class LiteralType {

    private final String marker;
    private final Language language;
    private final String receiver;
    private final List<RewriteRule> rules;
    private final Map<String, String> helperDeclarations;

    public LiteralType(String marker, Language language, String receiver,
                       List<RewriteRule> rules, Map<String, String> helperDeclarations) {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(language, "language");
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Literal " + marker + " has no rewrite rules");
        }
        this.marker = marker.trim();
        this.language = language;
        this.receiver = receiver == null || receiver.isBlank() ? null : receiver.trim();
        this.rules = List.copyOf(rules);
        this.helperDeclarations = helperDeclarations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(helperDeclarations));
    }

    public static LiteralType of(String marker, RewriteRule... rules) {
        return new LiteralType(marker, Language.GO, null, Arrays.asList(rules), Map.of());
    }

    public String getMarker() {
        return marker;
    }

    public Language getLanguage() {
        return language;
    }

    public String getReceiver() {
        return receiver;
    }

    public List<RewriteRule> getRules() {
        return rules;
    }

    public Map<String, String> getHelperDeclarations() {
        return helperDeclarations;
    }

    public Optional<String> helperDeclaration(String helper) {
        return Optional.ofNullable(helperDeclarations.get(helper));
    }
}
