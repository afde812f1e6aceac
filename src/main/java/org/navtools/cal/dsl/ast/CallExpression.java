package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record CallExpression(Expression callee, List<Expression> arguments, Token startToken, Token endToken)
        implements Expression {

    @Override
    public List<Node> children() {
        return Node.collect(callee, arguments);
    }
}
