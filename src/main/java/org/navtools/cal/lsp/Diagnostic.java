package org.navtools.cal.lsp;

public record Diagnostic(Range range, Severity severity, String code, String source, String message) {

    public enum Severity {
        ERROR, WARNING, INFORMATION, HINT
    }
}
