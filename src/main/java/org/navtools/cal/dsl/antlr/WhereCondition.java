package org.navtools.cal.dsl.antlr;

/**
 * {@code "Customer No."=FIELD("No.")}
 *
 * @param fieldName      Field on the left, quotes stripped
 * @param operator       Comparison operator as written
 * @param predicateType  FIELD, CONST or FILTER
 * @param predicateValue Text between the predicate parentheses, empty for {@code CONST()}
 */
public record WhereCondition(String fieldName, String operator, PredicateType predicateType,
        String predicateValue) {
}
