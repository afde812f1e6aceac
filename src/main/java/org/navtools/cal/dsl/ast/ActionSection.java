package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * An ACTIONS block; {@code actions} holds the root items of the rebuilt hierarchy.
 */
public record ActionSection(List<ActionDeclaration> actions, Source source, Token startToken, Token endToken)
        implements Node {

    public enum Source {
        TOP_LEVEL, // ACTIONS section of the object
        PROPERTY, // ActionList=ACTIONS { ... } in PROPERTIES
        CONTROL_PROPERTY // ActionList=ACTIONS { ... } on a control
    }

    @Override
    public List<Node> children() {
        return Node.collect(actions);
    }
}
