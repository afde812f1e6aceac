package org.navtools.cal.dsl.antlr;

import java.util.Locale;

/**
 * Right-hand side kind of a WHERE condition.
 */
public enum PredicateType {
    FIELD, CONST, FILTER;

    public static PredicateType fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
