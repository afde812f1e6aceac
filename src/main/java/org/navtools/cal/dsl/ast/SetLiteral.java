package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code [1, 5..10, ..20]}
 */
public record SetLiteral(List<Expression> elements, Token startToken, Token endToken) implements Expression {

    @Override
    public List<Node> children() {
        return Node.collect(elements);
    }
}
