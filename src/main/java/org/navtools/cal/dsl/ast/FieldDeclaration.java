package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * A table field: {@code { no ; class ; name ; type ; properties }}.
 * {@code fieldClass} is the reserved second column and is usually empty.
 */
public record FieldDeclaration(
        int fieldNo,
        String fieldClass,
        String fieldName,
        Token nameToken,
        DataType dataType,
        List<Property> properties,
        List<TriggerDeclaration> triggers,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(dataType, properties, triggers);
    }
}
