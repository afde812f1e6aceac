package org.navtools.cal.dsl.antlr;

/**
 * One {@code IF (condition) relation [ELSE relation]} branch. {@code elseRelation} is null
 * when the chain continues with another {@code IF} or ends without {@code ELSE}.
 */
public record ConditionalTableRelation(WhereCondition condition, TableRelation thenRelation,
        TableRelation elseRelation) {
}
