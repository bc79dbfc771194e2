package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"line", "message", "severity"})
public class Diagnostic {
    private final int line;
    private final String message;
    private final Severity severity;

    public Diagnostic(int line, String message, Severity severity) {
        this.line = line;
        this.message = message;
        this.severity = severity;
    }

    public static Diagnostic error(int line, String message) {
        return new Diagnostic(line, message, Severity.ERROR);
    }

    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return line == that.line && Objects.equals(message, that.message) && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, message, severity);
    }

    @Override
    public String toString() {
        return "Diagnostic{line=" + line + ", message='" + message + "', severity=" + severity + "}";
    }
}
