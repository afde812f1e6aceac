package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * A named statement block: a CODE section trigger or an OnValidate-style item trigger.
 */
public record TriggerDeclaration(String name, List<VariableDeclaration> variables, BlockStatement body,
        Token startToken, Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(variables, body);
    }
}
