package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code { id ; indent ; type ; properties }}
 */
public record ActionDeclaration(
        int id,
        int indentLevel,
        ActionType actionType,
        String rawActionType,
        List<Property> properties,
        List<TriggerDeclaration> triggers,
        List<ActionDeclaration> nested,
        Token startToken,
        Token endToken) implements IndentedItem<ActionDeclaration> {

    @Override
    public List<Node> children() {
        return Node.collect(properties, triggers, nested);
    }
}
