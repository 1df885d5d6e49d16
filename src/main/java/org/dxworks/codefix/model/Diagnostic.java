package org.dxworks.codefix.model;

public class Diagnostic {
    public DiagnosticKind kind;
    public int line;
    public String message;

    public Diagnostic() {
    }

    public Diagnostic(DiagnosticKind kind, int line, String message) {
        this.kind = kind;
        this.line = line;
        this.message = message;
    }

    @Override
    public String toString() {
        return kind + " at line " + line + ": " + message;
    }
}
