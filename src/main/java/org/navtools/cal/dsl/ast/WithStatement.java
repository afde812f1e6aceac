package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record WithStatement(Expression record, Statement body, Token startToken, Token endToken)
        implements Statement {

    @Override
    public List<Node> children() {
        return Node.collect(record, body);
    }
}
