package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * Root of a parsed file. {@code object} is null when no object header could be read.
 */
public record Document(ObjectDeclaration object, Token startToken, Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(object);
    }
}
