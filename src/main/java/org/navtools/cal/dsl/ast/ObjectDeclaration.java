package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * An {@code OBJECT <kind> <id> <name>} declaration with at most one of each supported section.
 * Sections that are absent from the source are null.
 */
public record ObjectDeclaration(
        ObjectKind objectKind,
        int objectId,
        String objectName,
        PropertySection properties,
        FieldSection fields,
        KeySection keys,
        FieldGroupSection fieldGroups,
        ActionSection actions,
        ControlSection controls,
        ElementsSection elements,
        CodeSection code,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(properties, fields, keys, fieldGroups, actions, controls, elements, code);
    }
}
