package org.navtools.cal.symbols;

import org.navtools.cal.dsl.Token;

/**
 * A declared name.
 *
 * @param name  The name as declared
 * @param kind  What declared it
 * @param token The name token, or the declaration's first token when the name has none
 * @param type  Data type name, the return type for procedures, or null
 */
public record Symbol(String name, SymbolKind kind, Token token, String type) {

    /**
     * Textual length of the declaring token, for building editor ranges.
     */
    public int length() {
        return token != null ? token.length() : name.length();
    }
}
