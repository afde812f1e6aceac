package org.navtools.cal.dsl.antlr;

import java.util.List;

/**
 * Structured {@code TableRelation} value. A plain relation has a table name and no
 * conditional branches; {@code IF (...) A ELSE IF (...) B ELSE C} has only branches.
 */
public record TableRelation(String tableName, String fieldName, WhereClause whereClause,
        List<ConditionalTableRelation> conditionalRelations) {

    public TableRelation {
        conditionalRelations = List.copyOf(conditionalRelations);
    }

    public static TableRelation simple(String tableName, String fieldName, WhereClause whereClause) {
        return new TableRelation(tableName, fieldName, whereClause, List.of());
    }

    public boolean isConditional() {
        return !conditionalRelations.isEmpty();
    }
}
