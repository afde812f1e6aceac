package org.navtools.cal.symbols;

public enum SymbolKind {
    FIELD,
    VARIABLE,
    PARAMETER,
    PROCEDURE,
    FUNCTION
}
