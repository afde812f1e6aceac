package org.navtools.cal.dsl.antlr;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts PropertyValue parse trees into {@link CalcFormula} and
 * {@link TableRelation} records.
 *
 * Names are returned without their quotes. Text spanning several tokens, such as an unquoted
 * field name {@code Document Type}, is joined with single spaces where the source had whitespace.
 */
public class PropertyValueAstBuilder extends PropertyValueBaseVisitor<Object> {

    public CalcFormula buildCalcFormula(PropertyValueParser.CalcFormulaContext ctx) {
        return (CalcFormula) visit(ctx);
    }

    public TableRelation buildTableRelation(PropertyValueParser.TableRelationContext ctx) {
        return (TableRelation) visit(ctx);
    }

    // ==================== CalcFormula ====================

    @Override
    public CalcFormula visitCalcFormula(PropertyValueParser.CalcFormulaContext ctx) {
        CalcFormula.Aggregate aggregate = CalcFormula.Aggregate.fromKeyword(ctx.aggregate().getText());
        String sourceTable = name(ctx.sourceTable);
        String sourceField = ctx.sourceField != null ? name(ctx.sourceField) : null;
        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;
        return new CalcFormula(aggregate, ctx.negated != null, sourceTable, sourceField, where);
    }

    // ==================== TableRelation ====================

    @Override
    public TableRelation visitTableRelation(PropertyValueParser.TableRelationContext ctx) {
        return visitRelationBody(ctx.relationBody());
    }

    @Override
    public TableRelation visitRelationBody(PropertyValueParser.RelationBodyContext ctx) {
        if (ctx.simpleRelation() != null) {
            return visitSimpleRelation(ctx.simpleRelation());
        }
        List<ConditionalTableRelation> branches = new ArrayList<>();
        for (PropertyValueParser.ConditionalRelationContext branch : ctx.conditionalRelation()) {
            addBranches(branch, branches);
        }
        return new TableRelation(null, null, null, branches);
    }

    /**
     * Flattens {@code IF a X ELSE IF b Y ELSE Z} into the branch list: a branch whose ELSE starts
     * another IF has no else relation of its own.
     */
    private void addBranches(PropertyValueParser.ConditionalRelationContext ctx,
            List<ConditionalTableRelation> branches) {
        WhereCondition condition = visitWhereCondition(ctx.whereCondition());
        TableRelation then = visitSimpleRelation(ctx.thenRelation);
        if (ctx.elseRelation == null) {
            branches.add(new ConditionalTableRelation(condition, then, null));
        } else if (ctx.elseRelation.simpleRelation() != null) {
            branches.add(new ConditionalTableRelation(condition, then,
                    visitSimpleRelation(ctx.elseRelation.simpleRelation())));
        } else {
            branches.add(new ConditionalTableRelation(condition, then, null));
            for (PropertyValueParser.ConditionalRelationContext next : ctx.elseRelation.conditionalRelation()) {
                addBranches(next, branches);
            }
        }
    }

    @Override
    public TableRelation visitSimpleRelation(PropertyValueParser.SimpleRelationContext ctx) {
        String table = name(ctx.tableName);
        String field = ctx.fieldName != null ? name(ctx.fieldName) : null;
        WhereClause where = ctx.whereClause() != null ? visitWhereClause(ctx.whereClause()) : null;
        return TableRelation.simple(table, field, where);
    }

    // ==================== WHERE ====================

    @Override
    public WhereClause visitWhereClause(PropertyValueParser.WhereClauseContext ctx) {
        List<WhereCondition> conditions = new ArrayList<>();
        for (PropertyValueParser.WhereConditionContext condition : ctx.whereCondition()) {
            conditions.add(visitWhereCondition(condition));
        }
        return new WhereClause(conditions);
    }

    @Override
    public WhereCondition visitWhereCondition(PropertyValueParser.WhereConditionContext ctx) {
        PropertyValueParser.PredicateContext predicate = ctx.predicate();
        String value = predicate.predicateValue() != null ? flatten(predicate.predicateValue()) : "";
        return new WhereCondition(flatten(ctx.fieldRef()), ctx.operator().getText(),
                PredicateType.fromKeyword(predicate.kind.getText()), value);
    }

    // ==================== Text ====================

    private static String name(PropertyValueParser.NameContext ctx) {
        return flatten(ctx);
    }

    private static String flatten(ParserRuleContext ctx) {
        List<TerminalNode> terminals = new ArrayList<>();
        collectTerminals(ctx, terminals);
        StringBuilder text = new StringBuilder();
        org.antlr.v4.runtime.Token last = null;
        for (TerminalNode terminal : terminals) {
            org.antlr.v4.runtime.Token token = terminal.getSymbol();
            if (last != null && token.getStartIndex() > last.getStopIndex() + 1) {
                text.append(' ');
            }
            text.append(unquote(token));
            last = token;
        }
        return text.toString();
    }

    private static void collectTerminals(ParseTree tree, List<TerminalNode> terminals) {
        if (tree instanceof TerminalNode terminal) {
            if (terminal.getSymbol().getType() != org.antlr.v4.runtime.Token.EOF) {
                terminals.add(terminal);
            }
            return;
        }
        for (int i = 0; i < tree.getChildCount(); i++) {
            collectTerminals(tree.getChild(i), terminals);
        }
    }

    private static String unquote(org.antlr.v4.runtime.Token token) {
        String text = token.getText();
        if (token.getType() == PropertyValueLexer.QUOTED_IDENT) {
            return text.substring(1, text.length() - 1);
        }
        if (token.getType() == PropertyValueLexer.STRING) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        return text;
    }
}
