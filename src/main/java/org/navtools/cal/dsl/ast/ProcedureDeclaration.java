package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * A PROCEDURE or FUNCTION. {@code body} is null when the declaration broke off before BEGIN.
 */
public record ProcedureDeclaration(
        String name,
        Token nameToken,
        List<ParameterDeclaration> parameters,
        DataType returnType,
        boolean local,
        boolean function,
        List<VariableDeclaration> variables,
        BlockStatement body,
        List<ProcedureAttribute> attributes,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(attributes, parameters, returnType, variables, body);
    }
}
