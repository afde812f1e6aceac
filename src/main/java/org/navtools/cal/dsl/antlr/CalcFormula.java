package org.navtools.cal.dsl.antlr;

import java.util.Locale;

/**
 * Structured {@code CalcFormula} value, e.g.
 * {@code Sum("Cust. Ledger Entry".Amount WHERE ("Customer No."=FIELD("No.")))}.
 *
 * @param aggregate   The aggregation function
 * @param negated     True for a leading minus, e.g. {@code -Sum(...)}
 * @param sourceTable Table name, quotes stripped
 * @param sourceField Field name, or null for {@code Count} and {@code Exist}
 * @param whereClause Filter, or null when absent
 */
public record CalcFormula(Aggregate aggregate, boolean negated, String sourceTable, String sourceField,
        WhereClause whereClause) {

    public enum Aggregate {
        SUM, COUNT, LOOKUP, EXIST, MIN, MAX, AVERAGE;

        public static Aggregate fromKeyword(String keyword) {
            return valueOf(keyword.toUpperCase(Locale.ROOT));
        }
    }
}
