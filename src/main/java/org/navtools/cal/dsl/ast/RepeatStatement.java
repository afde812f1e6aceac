package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code REPEAT statements UNTIL condition}
 */
public record RepeatStatement(List<Statement> body, Expression condition, Token startToken, Token endToken)
        implements Statement {

    @Override
    public List<Node> children() {
        return Node.collect(body, condition);
    }
}
