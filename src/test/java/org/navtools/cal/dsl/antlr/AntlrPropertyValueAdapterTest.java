package org.navtools.cal.dsl.antlr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.navtools.cal.dsl.CalLexer;
import org.navtools.cal.dsl.ParseError;
import org.navtools.cal.dsl.ParseErrorCode;
import org.navtools.cal.dsl.Token;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CalcFormula and TableRelation value parsing from C/AL tokens.
 */
class AntlrPropertyValueAdapterTest {

    private static List<Token> valueTokens(String value) {
        return CalLexer.tokenize(value).stream()
                .filter(t -> t.type() != Token.TokenType.EOF)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("CalcFormula")
    class CalcFormulaTests {

        @Test
        void sumWithFieldFilter() {
            var formula = AntlrPropertyValueAdapter.parseCalcFormula(valueTokens(
                    "Sum(\"Cust. Ledger Entry\".Amount WHERE (Customer No.=FIELD(No.)))"));
            assertEquals(CalcFormula.Aggregate.SUM, formula.aggregate());
            assertEquals("Cust. Ledger Entry", formula.sourceTable());
            assertEquals("Amount", formula.sourceField());
            var condition = formula.whereClause().conditions().get(0);
            assertEquals("Customer No.", condition.fieldName());
            assertEquals(PredicateType.FIELD, condition.predicateType());
            assertEquals("No.", condition.predicateValue());
        }

        @Test
        void countHasNoSourceField() {
            var formula = AntlrPropertyValueAdapter.parseCalcFormula(valueTokens(
                    "Count(\"Sales Line\" WHERE (Document Type=CONST(Order)))"));
            assertEquals(CalcFormula.Aggregate.COUNT, formula.aggregate());
            assertEquals("Sales Line", formula.sourceTable());
            assertNull(formula.sourceField());
            var condition = formula.whereClause().conditions().get(0);
            assertEquals("Document Type", condition.fieldName());
            assertEquals(PredicateType.CONST, condition.predicateType());
            assertEquals("Order", condition.predicateValue());
        }

        @Test
        void nestedParenthesesStayInPredicateValue() {
            var formula = AntlrPropertyValueAdapter.parseCalcFormula(valueTokens(
                    "Sum(\"G/L Entry\".Amount WHERE (G/L Account No.=FIELD(No.),"
                            + "Posting Date=FIELD(UPPERLIMIT(Date Filter))))"));
            var conditions = formula.whereClause().conditions();
            assertEquals(2, conditions.size());
            assertEquals("G/L Account No.", conditions.get(0).fieldName());
            assertEquals("Posting Date", conditions.get(1).fieldName());
            assertEquals("UPPERLIMIT(Date Filter)", conditions.get(1).predicateValue());
        }

        @Test
        void lookupWithoutWhere() {
            var formula = AntlrPropertyValueAdapter.parseCalcFormula(valueTokens("Lookup(Customer.Name)"));
            assertEquals(CalcFormula.Aggregate.LOOKUP, formula.aggregate());
            assertFalse(formula.negated());
            assertEquals("Customer", formula.sourceTable());
            assertEquals("Name", formula.sourceField());
            assertNull(formula.whereClause());
        }

        @Test
        void negatedAggregate() {
            var formula = AntlrPropertyValueAdapter.parseCalcFormula(valueTokens(
                    "-Sum(\"Detailed Vendor Ledg. Entry\".\"Amount (LCY)\" WHERE (Vendor No.=FIELD(No.)))"));
            assertTrue(formula.negated());
            assertEquals(CalcFormula.Aggregate.SUM, formula.aggregate());
            assertEquals("Detailed Vendor Ledg. Entry", formula.sourceTable());
            assertEquals("Amount (LCY)", formula.sourceField());
            assertEquals("Vendor No.", formula.whereClause().conditions().get(0).fieldName());
        }

        @Test
        void unknownAggregateIsPropertyValueError() {
            List<Token> tokens = valueTokens("Bogus(Table)");
            ParseError error = assertThrows(ParseError.class,
                    () -> AntlrPropertyValueAdapter.parseCalcFormula(tokens));
            assertEquals(ParseErrorCode.PROPERTY_VALUE, error.getCode());
            assertTrue(error.getRawMessage().startsWith("Invalid CalcFormula value: "));
            assertSame(tokens.get(0), error.getToken());
        }
    }

    @Nested
    @DisplayName("TableRelation")
    class TableRelationTests {

        @Test
        void plainTable() {
            var relation = AntlrPropertyValueAdapter.parseTableRelation(valueTokens("Customer"));
            assertEquals("Customer", relation.tableName());
            assertNull(relation.fieldName());
            assertFalse(relation.isConditional());
        }

        @Test
        void tableFieldAndFilter() {
            var relation = AntlrPropertyValueAdapter.parseTableRelation(valueTokens(
                    "\"Cust. Ledger Entry\".\"Entry No.\" WHERE (Open=CONST(Yes))"));
            assertEquals("Cust. Ledger Entry", relation.tableName());
            assertEquals("Entry No.", relation.fieldName());
            assertEquals("Open", relation.whereClause().conditions().get(0).fieldName());
        }

        @Test
        void unquotedFieldEndingInDot() {
            var relation = AntlrPropertyValueAdapter.parseTableRelation(valueTokens(
                    "\"Sales Header\".No. WHERE (Document Type=FIELD(Document Type))"));
            assertEquals("Sales Header", relation.tableName());
            assertEquals("No.", relation.fieldName());
            var condition = relation.whereClause().conditions().get(0);
            assertEquals("Document Type", condition.fieldName());
            assertEquals("Document Type", condition.predicateValue());
        }

        @Test
        void conditionalChainIsFlattened() {
            var relation = AntlrPropertyValueAdapter.parseTableRelation(valueTokens(
                    "IF (Type=CONST(Item)) Item ELSE IF (Type=CONST(Resource)) Resource ELSE \"Standard Text\""));
            assertTrue(relation.isConditional());
            List<ConditionalTableRelation> branches = relation.conditionalRelations();
            assertEquals(2, branches.size());

            assertEquals("Item", branches.get(0).condition().predicateValue());
            assertEquals("Item", branches.get(0).thenRelation().tableName());
            assertNull(branches.get(0).elseRelation());

            assertEquals("Resource", branches.get(1).thenRelation().tableName());
            assertEquals("Standard Text", branches.get(1).elseRelation().tableName());
        }

        @Test
        void errorPointsAtOffendingToken() {
            List<Token> tokens = valueTokens("IF (Type=CONST(Item) Item");
            ParseError error = assertThrows(ParseError.class,
                    () -> AntlrPropertyValueAdapter.parseTableRelation(tokens));
            assertEquals(ParseErrorCode.PROPERTY_VALUE, error.getCode());
            assertTrue(error.getRawMessage().startsWith("Invalid TableRelation value: "));
            assertSame(tokens.get(tokens.size() - 1), error.getToken());
        }
    }

    @Nested
    @DisplayName("Source text")
    class SourceTextTests {

        @Test
        void quotesAreRestored() {
            assertEquals("\"No.\"='It''s'", AntlrPropertyValueAdapter.rebuild(valueTokens("\"No.\"='It''s'")));
        }

        @Test
        void gapsBecomeSingleSpaces() {
            assertEquals("Document Type = x", AntlrPropertyValueAdapter.rebuild(valueTokens("Document   Type =  x")));
        }
    }
}
