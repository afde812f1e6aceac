package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record ForStatement(Expression variable, Expression from, Expression to, boolean downto, Statement body,
        Token startToken, Token endToken) implements Statement {

    @Override
    public List<Node> children() {
        return Node.collect(variable, from, to, body);
    }
}
