package org.navtools.cal.dsl.ast;

import java.util.Locale;

public enum ActionType {
    ACTION_CONTAINER, ACTION_GROUP, ACTION, SEPARATOR;

    /**
     * Case-insensitive lookup of a raw type column such as {@code ActionContainer}.
     */
    public static ActionType fromRaw(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "actioncontainer" -> ACTION_CONTAINER;
            case "actiongroup" -> ACTION_GROUP;
            case "action" -> ACTION;
            case "separator" -> SEPARATOR;
            default -> null;
        };
    }
}
