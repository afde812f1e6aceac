package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token.TokenType;

public enum ObjectKind {
    TABLE, PAGE, REPORT, CODEUNIT, QUERY, XMLPORT, MENUSUITE;

    /**
     * Maps an object kind keyword, or returns null for any other token type.
     */
    public static ObjectKind fromTokenType(TokenType type) {
        return switch (type) {
            case TABLE -> TABLE;
            case PAGE -> PAGE;
            case REPORT -> REPORT;
            case CODEUNIT -> CODEUNIT;
            case QUERY -> QUERY;
            case XMLPORT -> XMLPORT;
            case MENUSUITE -> MENUSUITE;
            default -> null;
        };
    }
}
