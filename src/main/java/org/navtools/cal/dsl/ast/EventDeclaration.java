package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code EVENT Subscriber@n::Event@n(params);} handler of a DotNet or Automation variable.
 */
public record EventDeclaration(
        String subscriberName,
        String eventName,
        List<ParameterDeclaration> parameters,
        List<VariableDeclaration> variables,
        BlockStatement body,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(parameters, variables, body);
    }
}
