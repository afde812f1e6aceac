package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code value, low..high: statement}. A branch kept after an error may have no statements.
 */
public record CaseBranch(List<Expression> values, List<Statement> statements, Token startToken, Token endToken)
        implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(values, statements);
    }
}
