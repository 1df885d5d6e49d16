package org.dxworks.codefix.rewriter.literal;

import java.util.Objects;

/**
 * Positional parameter of a helper constructor, bound to a literal field.
 * A parameter with a default value is optional: the default is passed when the field is absent.
 */
public final class RuleParameter {

    private final String field;
    private final String defaultValue;

    public RuleParameter(String field, String defaultValue) {
        Objects.requireNonNull(field, "field");
        if (field.isBlank()) {
            throw new IllegalArgumentException("Rule parameter field must not be blank");
        }
        this.field = field.trim();
        this.defaultValue = defaultValue;
    }

    public static RuleParameter required(String field) {
        return new RuleParameter(field, null);
    }

    public static RuleParameter optional(String field, String defaultValue) {
        return new RuleParameter(field, Objects.requireNonNull(defaultValue, "defaultValue"));
    }

    public String getField() {
        return field;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return defaultValue == null;
    }
}
