package com.sentrius.yang;

import com.sentrius.yang.model.Diagnostic;
import com.sentrius.yang.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics in detection order and normalizes them into the
 * {@code {line, message, severity}} shape shared by both parsers.
 */
public class DiagnosticReporter {
    public static final String NO_MODULE_MESSAGE = "No module or submodule declaration found";
    public static final String UNKNOWN_ERROR_MESSAGE = "Unknown parsing error";

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void error(int line, String message) {
        report(line, message, Severity.ERROR);
    }

    public void warning(int line, String message) {
        report(line, message, Severity.WARNING);
    }

    public void info(int line, String message) {
        report(line, message, Severity.INFO);
    }

    public void report(int line, String message, Severity severity) {
        diagnostics.add(normalize(line, message, severity));
    }

    /**
     * Record a document the grammar engine rejected. The engine's line is kept
     * when it has one, otherwise the error is placed on line 1.
     */
    public void grammarError(YangParseException e) {
        int line = e.getLine() > 0 ? e.getLine() : 1;
        error(line, withHint(e.getMessage()));
    }

    /**
     * Record an unexpected failure while scanning a document.
     */
    public void parseFailure(Exception e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        error(1, "Parse error: " + detail);
    }

    public void unmatchedBraces(int lastLine, int depth) {
        error(lastLine, "Unmatched braces detected. Depth: " + depth);
    }

    public void missingModule() {
        error(1, NO_MODULE_MESSAGE);
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getSeverity() == Severity.ERROR) {
                return true;
            }
        }
        return false;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * Diagnostics from {@code candidates} that are not already in {@code existing},
     * in their original order.
     */
    public static List<Diagnostic> missingFrom(List<Diagnostic> existing, List<Diagnostic> candidates) {
        List<Diagnostic> missing = new ArrayList<>();
        for (Diagnostic candidate : candidates) {
            if (!existing.contains(candidate) && !missing.contains(candidate)) {
                missing.add(candidate);
            }
        }
        return missing;
    }

    static Diagnostic normalize(int line, String message, Severity severity) {
        String text = message == null || message.isBlank() ? UNKNOWN_ERROR_MESSAGE : message.trim();
        return new Diagnostic(Math.max(line, 0), text, severity != null ? severity : Severity.ERROR);
    }

    private static String withHint(String message) {
        if (message == null) {
            return null;
        }
        if (message.contains("';'")) {
            return message + " (missing semicolon?)";
        }
        if (message.contains("<EOF>") && message.contains("'}'")) {
            return message + " (unmatched braces?)";
        }
        return message;
    }
}
