package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

/**
 * A name; {@code quoted} for {@code "Name With Spaces"}. The parser uses the name
 * {@value #ERROR_NAME} for placeholders it inserts after an error.
 */
public record Identifier(String name, boolean quoted, Token startToken, Token endToken) implements Expression {

    public static final String ERROR_NAME = "<error>";

    public static Identifier of(Token token) {
        return new Identifier(token.value(), token.type() == Token.TokenType.QUOTED_IDENTIFIER, token, token);
    }

    public static Identifier error(Token token) {
        return new Identifier(ERROR_NAME, false, token, token);
    }

    public boolean isError() {
        return ERROR_NAME.equals(name);
    }
}
