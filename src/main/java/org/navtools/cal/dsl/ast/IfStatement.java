package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record IfStatement(Expression condition, Statement thenBranch, Statement elseBranch, Token startToken,
        Token endToken) implements Statement {

    @Override
    public List<Node> children() {
        return Node.collect(condition, thenBranch, elseBranch);
    }
}
