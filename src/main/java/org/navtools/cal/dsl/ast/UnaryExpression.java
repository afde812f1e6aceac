package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record UnaryExpression(String operator, Expression operand, Token startToken, Token endToken)
        implements Expression {

    @Override
    public List<Node> children() {
        return Node.collect(operand);
    }
}
