package org.navtools.cal.lsp;

import org.navtools.cal.dsl.ParseError;
import org.navtools.cal.dsl.ParseErrorCode;
import org.navtools.cal.dsl.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts parser diagnostics into editor diagnostics with zero-based ranges.
 */
public final class DiagnosticConverter {

    private final CalSettings settings;

    public DiagnosticConverter(CalSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<Diagnostic> convert(List<ParseError> errors) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ParseError error : errors) {
            if (diagnostics.size() >= settings.maxProblems()) {
                break;
            }
            if (!settings.includeRecoveryDiagnostics() && error.getCode() == ParseErrorCode.ERROR_RECOVERY) {
                continue;
            }
            diagnostics.add(convert(error));
        }
        return diagnostics;
    }

    public Diagnostic convert(ParseError error) {
        return new Diagnostic(rangeOf(error.getToken()), Diagnostic.Severity.ERROR, error.getCode().tag(),
                settings.diagnosticSource(), error.getRawMessage());
    }

    /**
     * Underlines the token's source span on its first line. Quotes count towards the span.
     */
    static Range rangeOf(Token token) {
        if (token == null) {
            return new Range(0, 0, 0, 0);
        }
        int line = Math.max(0, token.line() - 1);
        int character = Math.max(0, token.column() - 1);
        return new Range(line, character, line, character + Math.max(0, token.length()));
    }
}
