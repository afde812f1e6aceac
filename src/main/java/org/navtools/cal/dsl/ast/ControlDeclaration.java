package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * A page control, {@code { id ; indent ; type ; properties }}.
 */
public record ControlDeclaration(
        int id,
        int indentLevel,
        ControlType controlType,
        String rawControlType,
        List<Property> properties,
        List<TriggerDeclaration> triggers,
        List<ControlDeclaration> nested,
        Token startToken,
        Token endToken) implements IndentedItem<ControlDeclaration> {

    @Override
    public List<Node> children() {
        return Node.collect(properties, triggers, nested);
    }
}
