package org.navtools.cal.dsl.antlr;

import java.util.List;

public record WhereClause(List<WhereCondition> conditions) {

    public WhereClause {
        conditions = List.copyOf(conditions);
    }
}
