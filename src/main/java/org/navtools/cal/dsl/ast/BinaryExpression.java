package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code left operator right}; word operators are stored upper-case ({@code AND}, {@code DIV}, {@code IN}).
 */
public record BinaryExpression(String operator, Expression left, Expression right, Token startToken,
        Token endToken) implements Expression {

    @Override
    public List<Node> children() {
        return Node.collect(left, right);
    }
}
