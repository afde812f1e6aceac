package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;
import java.util.Locale;

/**
 * An XMLport node, {@code { [{guid}] ; indent ; name ; Element|Attribute ; Text|Table|Field ; properties }}.
 */
public record XmlPortElement(
        String guid,
        int indentLevel,
        String name,
        NodeType nodeType,
        SourceType sourceType,
        List<Property> properties,
        List<TriggerDeclaration> triggers,
        List<XmlPortElement> nested,
        Token startToken,
        Token endToken) implements IndentedItem<XmlPortElement> {

    public enum NodeType {
        ELEMENT, ATTRIBUTE;

        public static NodeType fromRaw(String raw) {
            return raw.equalsIgnoreCase("attribute") ? ATTRIBUTE : ELEMENT;
        }
    }

    public enum SourceType {
        TEXT, TABLE, FIELD;

        public static SourceType fromRaw(String raw) {
            return switch (raw.toLowerCase(Locale.ROOT)) {
                case "text" -> TEXT;
                case "table" -> TABLE;
                case "field" -> FIELD;
                default -> null;
            };
        }
    }

    @Override
    public List<Node> children() {
        return Node.collect(properties, triggers, nested);
    }
}
