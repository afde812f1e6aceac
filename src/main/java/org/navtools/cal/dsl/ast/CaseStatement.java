package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code CASE expression OF branches [ELSE statements] END}
 */
public record CaseStatement(Expression expression, List<CaseBranch> branches, List<Statement> elseBranch,
        Token startToken, Token endToken) implements Statement {

    @Override
    public List<Node> children() {
        return Node.collect(expression, branches, elseBranch);
    }
}
