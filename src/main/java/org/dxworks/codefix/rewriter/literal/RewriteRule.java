package org.dxworks.codefix.rewriter.literal;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a field profile to a replacement.
 * The rule applies when every required parameter's field is present in the literal.
 * <p>
 * A {@link Style#HELPER_CALL} rule replaces the literal with a helper constructor call. An
 * {@link Style#ASSIGNMENTS} rule keeps the type, empties the literal and moves every field into
 * a {@code receiver.Field = value} line; its parameters only gate which literals it accepts.
 */
public final class RewriteRule {

    public enum Style {
        HELPER_CALL,
        ASSIGNMENTS;

        public static Optional<Style> fromName(String name) {
            if (name == null) return Optional.empty();
            String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            if (normalized.equals("HELPER")) return Optional.of(HELPER_CALL);
            return Arrays.stream(values()).filter(s -> s.name().equals(normalized)).findFirst();
        }
    }

    private static final Pattern HELPER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final Style style;
    private final String helper;
    private final List<RuleParameter> parameters;
    private final List<String> trailingArguments;

    public RewriteRule(String helper, List<RuleParameter> parameters, List<String> trailingArguments) {
        this(Style.HELPER_CALL, helper, parameters, trailingArguments);
    }

    public RewriteRule(Style style, String helper, List<RuleParameter> parameters, List<String> trailingArguments) {
        this.style = Objects.requireNonNull(style, "style");
        if (style == Style.HELPER_CALL) {
            if (helper == null || !HELPER_NAME.matcher(helper.trim()).matches()) {
                throw new IllegalArgumentException("Invalid helper name: '" + helper + "'");
            }
        } else {
            if (helper != null && !helper.isBlank()) {
                throw new IllegalArgumentException("Assignment rules take no helper: '" + helper + "'");
            }
            if (trailingArguments != null && !trailingArguments.isEmpty()) {
                throw new IllegalArgumentException("Assignment rules take no trailing arguments");
            }
            if (parameters.stream().anyMatch(p -> !p.isRequired())) {
                throw new IllegalArgumentException("Assignment rules take no parameter defaults");
            }
        }
        Set<String> seen = new HashSet<>();
        for (RuleParameter p : parameters) {
            if (!seen.add(p.getField())) {
                throw new IllegalArgumentException("Duplicate parameter '" + p.getField() + "' in rule " + helper);
            }
        }
        this.helper = style == Style.HELPER_CALL ? helper.trim() : null;
        this.parameters = List.copyOf(parameters);
        this.trailingArguments = trailingArguments == null ? List.of() : List.copyOf(trailingArguments);
    }

    /**
     * Helper-call rule whose parameters are all required, in the given order.
     */
    public static RewriteRule of(String helper, String... requiredFields) {
        List<RuleParameter> params = Arrays.stream(requiredFields)
                .map(RuleParameter::required)
                .collect(Collectors.toList());
        return new RewriteRule(helper, params, List.of());
    }

    /**
     * Assignment-style rule that accepts literals holding at least the given fields.
     */
    public static RewriteRule assignments(String... requiredFields) {
        List<RuleParameter> params = Arrays.stream(requiredFields)
                .map(RuleParameter::required)
                .collect(Collectors.toList());
        return new RewriteRule(Style.ASSIGNMENTS, null, params, List.of());
    }

    public Style getStyle() {
        return style;
    }

    public boolean isHelperCall() {
        return style == Style.HELPER_CALL;
    }

    /** Helper name, null for assignment rules. */
    public String getHelper() {
        return helper;
    }

    public List<RuleParameter> getParameters() {
        return parameters;
    }

    public List<String> getTrailingArguments() {
        return trailingArguments;
    }

    public List<String> requiredFieldNames() {
        return parameters.stream()
                .filter(RuleParameter::isRequired)
                .map(RuleParameter::getField)
                .collect(Collectors.toList());
    }

    public boolean covers(String fieldName) {
        return parameters.stream().anyMatch(p -> p.getField().equals(fieldName));
    }

    public boolean matches(Set<String> presentFields) {
        return presentFields.containsAll(requiredFieldNames());
    }

    @Override
    public String toString() {
        return (isHelperCall() ? helper : "assignments") + requiredFieldNames();
    }
}
