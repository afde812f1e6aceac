package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;
import org.navtools.cal.dsl.antlr.CalcFormula;
import org.navtools.cal.dsl.antlr.TableRelation;

import java.util.List;

/**
 * A {@code Name=Value;} property.
 *
 * @param name              Property name, multi-word names joined by single spaces
 * @param value             Value text rebuilt from its tokens, or {@code BEGIN...END} for triggers
 * @param valueTokens       Raw value tokens; empty for trigger bodies and action lists
 * @param triggerVariables  Locals of a trigger property, empty otherwise
 * @param triggerBody       Body of a trigger property, null otherwise
 * @param actionSection     Parsed {@code ActionList=ACTIONS { ... }} value, null otherwise
 * @param calcFormula       Structured CalcFormula value when it parsed
 * @param tableRelation     Structured TableRelation value when it parsed
 */
public record Property(
        String name,
        String value,
        List<Token> valueTokens,
        List<VariableDeclaration> triggerVariables,
        BlockStatement triggerBody,
        ActionSection actionSection,
        CalcFormula calcFormula,
        TableRelation tableRelation,
        Token startToken,
        Token endToken) implements Node {

    public static Property simple(String name, String value, List<Token> valueTokens, Token startToken,
            Token endToken) {
        return new Property(name, value, valueTokens, List.of(), null, null, null, null, startToken, endToken);
    }

    public boolean isTrigger() {
        return triggerBody != null;
    }

    public Property withCalcFormula(CalcFormula formula) {
        return new Property(name, value, valueTokens, triggerVariables, triggerBody, actionSection, formula,
                tableRelation, startToken, endToken);
    }

    public Property withTableRelation(TableRelation relation) {
        return new Property(name, value, valueTokens, triggerVariables, triggerBody, actionSection, calcFormula,
                relation, startToken, endToken);
    }

    @Override
    public List<Node> children() {
        return Node.collect(triggerVariables, triggerBody, actionSection);
    }
}
