package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code target := value}. Compound forms such as {@code x += 1} store {@code x + 1} as the value.
 */
public record AssignmentStatement(Expression target, Expression value, Token startToken, Token endToken)
        implements Statement {

    @Override
    public List<Node> children() {
        return Node.collect(target, value);
    }
}
