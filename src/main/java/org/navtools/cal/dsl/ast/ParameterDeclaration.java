package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record ParameterDeclaration(
        String name,
        Token nameToken,
        DataType dataType,
        boolean isVar,
        boolean temporary,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(dataType);
    }
}
