package org.navtools.cal.dsl.ast;

import java.util.Locale;

public enum ControlType {
    CONTAINER, GROUP, FIELD, PART, SEPARATOR, ACTION, ACTION_CONTAINER, ACTION_GROUP;

    public static ControlType fromRaw(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "container" -> CONTAINER;
            case "group" -> GROUP;
            case "field" -> FIELD;
            case "part" -> PART;
            case "separator" -> SEPARATOR;
            case "action" -> ACTION;
            case "actioncontainer" -> ACTION_CONTAINER;
            case "actiongroup" -> ACTION_GROUP;
            default -> null;
        };
    }
}
