package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code start..end}; either bound may be null for open ranges.
 */
public record RangeExpression(Expression start, Expression end, Token startToken, Token endToken)
        implements Expression {

    @Override
    public List<Node> children() {
        return Node.collect(start, end);
    }
}
