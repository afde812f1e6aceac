package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code object.property}, or {@code object::property} for option values when {@code optionAccess}.
 */
public record MemberExpression(Expression object, Identifier property, boolean optionAccess, Token startToken,
        Token endToken) implements Expression {

    @Override
    public List<Node> children() {
        return Node.collect(object, property);
    }
}
