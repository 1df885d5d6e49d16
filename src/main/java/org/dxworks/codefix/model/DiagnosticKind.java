package org.dxworks.codefix.model;

public enum DiagnosticKind {
    MALFORMED_LITERAL,
    UNTERMINATED_LITERAL,
    NO_MATCHING_RULE,
    UNSUPPORTED_CONTEXT,
    PASS_LIMIT_REACHED
}
