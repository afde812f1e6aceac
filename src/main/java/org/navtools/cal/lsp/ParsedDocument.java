package org.navtools.cal.lsp;

import org.navtools.cal.dsl.ParseError;
import org.navtools.cal.dsl.SkippedRegion;
import org.navtools.cal.dsl.Token;
import org.navtools.cal.dsl.ast.Document;
import org.navtools.cal.symbols.SymbolTable;

import java.util.List;

/**
 * Everything one parse of a document produced. Immutable once built.
 */
public record ParsedDocument(List<Token> tokens, Document document, SymbolTable symbols, List<ParseError> errors,
        List<SkippedRegion> skippedRegions) {

    public ParsedDocument {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
        skippedRegions = List.copyOf(skippedRegions);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
