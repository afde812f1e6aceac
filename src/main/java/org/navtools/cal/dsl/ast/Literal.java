package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

/**
 * A literal; {@code value} is the source text of numbers, dates and times, the unescaped
 * text of strings, and {@code TRUE}/{@code FALSE} for booleans.
 */
public record Literal(String value, LiteralType literalType, Token startToken, Token endToken)
        implements Expression {

    public enum LiteralType {
        INTEGER, DECIMAL, STRING, BOOLEAN, DATE, TIME, DATETIME
    }
}
