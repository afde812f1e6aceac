package org.navtools.cal.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.navtools.cal.dsl.ast.AssignmentStatement;
import org.navtools.cal.dsl.ast.BinaryExpression;
import org.navtools.cal.dsl.ast.CallStatement;
import org.navtools.cal.dsl.ast.CaseStatement;
import org.navtools.cal.dsl.ast.CodeSection;
import org.navtools.cal.dsl.ast.EventDeclaration;
import org.navtools.cal.dsl.ast.ForStatement;
import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.dsl.ast.ProcedureAttribute;
import org.navtools.cal.dsl.ast.ProcedureDeclaration;
import org.navtools.cal.dsl.ast.RangeExpression;
import org.navtools.cal.dsl.ast.Statement;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the CODE section: declarations, statements and statement-level recovery.
 */
class CalParserCodeTest {

    private static final String SALES_HELPER = """
            OBJECT Codeunit 50000 Sales Helper
            {
              PROPERTIES
              {
                OnRun=BEGIN
                        Initialize;
                      END;

              }
              CODE
              {
                VAR
                  Counter@1000 : Integer;
                  Cust@1001 : TEMPORARY Record 18;

                [External]
                PROCEDURE Initialize@1();
                BEGIN
                  Counter := 0;
                END;

                LOCAL PROCEDURE Calc@2(VAR Amount@1000 : Decimal;Qty@1001 : Integer) : Decimal;
                VAR
                  i@1002 : Integer;
                BEGIN
                  FOR i := 1 TO Qty DO
                    Amount += 1;
                  CASE Qty OF
                    1: EXIT(Amount);
                    2, 3: EXIT(0);
                  ELSE
                    EXIT(-1);
                  END;
                END;

                EVENT Cust@1001::OnAfterInsert@2(VAR Rec@1000 : Record 18);
                BEGIN
                END;

                BEGIN
                {
                  Documentation
                }
                END.
              }
            }
            """;

    private static String codeunit(String code) {
        return "OBJECT Codeunit 1 Test\n{\n  CODE\n  {\n" + code + "\n    BEGIN\n    END.\n  }\n}\n";
    }

    private static List<String> messages(CalParser parser) {
        return parser.getErrors().stream().map(ParseError::getRawMessage).toList();
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        void globalVariables() {
            CodeSection code = CalParserTest.parseClean(SALES_HELPER).code();
            assertEquals(2, code.variables().size());
            assertEquals("Counter", code.variables().get(0).name());
            var cust = code.variables().get(1);
            assertTrue(cust.temporary());
            assertEquals(18, cust.dataType().tableId());
        }

        @Test
        void procedures() {
            CodeSection code = CalParserTest.parseClean(SALES_HELPER).code();
            assertEquals(2, code.procedures().size());

            ProcedureDeclaration initialize = code.procedures().get(0);
            assertEquals("Initialize", initialize.name());
            assertFalse(initialize.local());
            assertEquals(1, initialize.attributes().size());
            assertEquals("External", initialize.attributes().get(0).name());

            ProcedureDeclaration calc = code.procedures().get(1);
            assertTrue(calc.local());
            assertEquals(2, calc.parameters().size());
            assertTrue(calc.parameters().get(0).isVar());
            assertFalse(calc.parameters().get(1).isVar());
            assertEquals("Decimal", calc.returnType().typeName());
            assertEquals(1, calc.variables().size());
        }

        @Test
        void events() {
            List<EventDeclaration> events = CalParserTest.parseClean(SALES_HELPER).code().events();
            assertEquals(1, events.size());
            assertEquals("Cust@1001", events.get(0).subscriberName());
            assertEquals("OnAfterInsert@2", events.get(0).eventName());
            assertEquals(1, events.get(0).parameters().size());
        }

        @Test
        void objectTriggerProperty() {
            var onRun = CalParserTest.parseClean(SALES_HELPER).properties().properties().get(0);
            assertEquals("OnRun", onRun.name());
            assertInstanceOf(CallStatement.class, onRun.triggerBody().statements().get(0));
        }

        @Test
        void attributeArgumentsAreCaptured() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        [EventSubscriber(Codeunit,Codeunit::"Sales-Post",OnAfterPostSalesDoc,'',Skip::No)]
                        PROCEDURE OnAfterPost@1();
                        BEGIN
                        END;
                    """)));
            ProcedureDeclaration procedure = parser.parse().object().code().procedures().get(0);
            assertTrue(parser.getErrors().isEmpty(), () -> messages(parser).toString());

            ProcedureAttribute attribute = procedure.attributes().get(0);
            assertEquals("EventSubscriber", attribute.name());
            assertTrue(attribute.hasArguments());
            assertEquals(List.of("(", "Codeunit", ",", "Codeunit", "::", "Sales-Post", ",", "OnAfterPostSalesDoc",
                    ",", "", ",", "Skip", "::", "No", ")"),
                    attribute.rawTokens().stream().map(Token::value).toList());
            assertEquals(TokenType.QUOTED_IDENTIFIER, attribute.rawTokens().get(5).type());
            assertEquals(TokenType.STRING, attribute.rawTokens().get(9).type());
        }

        @Test
        void attributeOnEventIsReported() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        [External]
                        EVENT Cust@1001::OnAfterInsert@2();
                        BEGIN
                        END;
                    """)));
            CodeSection code = parser.parse().object().code();
            assertEquals(1, code.events().size());
            assertTrue(messages(parser).contains(
                    "1 attribute ignored - attributes are only supported on PROCEDURE declarations in C/AL"));
        }
    }

    @Nested
    @DisplayName("Statements")
    class StatementTests {

        private List<Statement> calcBody() {
            return CalParserTest.parseClean(SALES_HELPER).code().procedures().get(1).body().statements();
        }

        @Test
        void forWithCompoundAssignment() {
            var loop = assertInstanceOf(ForStatement.class, calcBody().get(0));
            assertFalse(loop.downto());
            var assignment = assertInstanceOf(AssignmentStatement.class, loop.body());
            var value = assertInstanceOf(BinaryExpression.class, assignment.value());
            assertEquals("+", value.operator());
        }

        @Test
        void caseWithElse() {
            var statement = assertInstanceOf(CaseStatement.class, calcBody().get(1));
            assertEquals(2, statement.branches().size());
            assertEquals(2, statement.branches().get(1).values().size());
            assertEquals(1, statement.elseBranch().size());
        }
    }

    @Nested
    @DisplayName("Recovery")
    class RecoveryTests {

        @Test
        void caseBranchMissingColonKeepsValues() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1(x@1000 : Integer);
                        BEGIN
                          CASE x OF
                            1 2: y := 1;
                          END;
                          z := 2;
                        END;
                    """)));
            ProcedureDeclaration procedure = parser.parse().object().code().procedures().get(0);
            assertTrue(parser.getErrors().stream().anyMatch(e -> e instanceof CaseBranchParseError));

            List<Statement> statements = procedure.body().statements();
            var caseStatement = assertInstanceOf(CaseStatement.class, statements.get(0));
            assertEquals(2, caseStatement.branches().size());
            assertEquals(1, caseStatement.branches().get(0).values().size());
            assertTrue(caseStatement.branches().get(0).statements().isEmpty());
            assertInstanceOf(AssignmentStatement.class, statements.get(1));
        }

        @Test
        void missingEndStopsAtNextProcedure() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE First@1();
                        BEGIN
                          x := 1;

                        PROCEDURE Second@2();
                        BEGIN
                        END;
                    """)));
            CodeSection code = parser.parse().object().code();
            assertEquals(List.of("First", "Second"),
                    code.procedures().stream().map(ProcedureDeclaration::name).toList());
            assertTrue(messages(parser).contains("Expected END to close BEGIN block"));
        }

        @Test
        void badStatementIsSkipped() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1();
                        BEGIN
                          x := ;
                          y := 2;
                        END;
                    """)));
            ProcedureDeclaration procedure = parser.parse().object().code().procedures().get(0);
            assertFalse(parser.getErrors().isEmpty());
            assertTrue(procedure.body().statements().stream()
                    .anyMatch(s -> s instanceof AssignmentStatement a && a.target().startToken().value().equals("y")));
        }

        @Test
        void recoverySkipsNestedBlocksOfFailedStatement() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1();
                        BEGIN
                          FOR i 1 TO 2 DO BEGIN a := 1 END;
                          FOR j 1 TO 2 DO CASE a OF 1: b := 1 END;
                          y := 2;
                        END;

                        PROCEDURE Q@2();
                        BEGIN
                        END;
                    """)));
            CodeSection code = parser.parse().object().code();
            assertEquals(List.of("P", "Q"), code.procedures().stream().map(ProcedureDeclaration::name).toList());
            assertEquals(2, parser.getErrors().size());
            assertTrue(parser.getErrors().stream().noneMatch(e -> e.getCode() == ParseErrorCode.UNCLOSED_BLOCK));

            List<Statement> statements = code.procedures().get(0).body().statements();
            assertEquals(1, statements.size());
            var assignment = assertInstanceOf(AssignmentStatement.class, statements.get(0));
            assertEquals("y", assignment.target().startToken().value());
        }

        @Test
        void caseMissingEndLeavesEndForProcedure() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1(x@1000 : Integer);
                        BEGIN
                          CASE x OF
                            1: y := 1;
                        END;

                        PROCEDURE Q@2();
                        BEGIN
                        END;
                    """)));
            CodeSection code = parser.parse().object().code();
            assertTrue(messages(parser).contains("Expected END to close CASE statement"));
            assertFalse(messages(parser).contains("Expected END to close BEGIN block"));
            assertEquals(List.of("P", "Q"), code.procedures().stream().map(ProcedureDeclaration::name).toList());

            var statement = assertInstanceOf(CaseStatement.class,
                    code.procedures().get(0).body().statements().get(0));
            assertEquals(1, statement.branches().size());
        }

        @Test
        void caseRangeWithoutUpperBound() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1(x@1000 : Integer);
                        BEGIN
                          CASE x OF
                            1..: y := 1;
                            5: y := 2;
                          END;
                        END;
                    """)));
            ProcedureDeclaration procedure = parser.parse().object().code().procedures().get(0);
            assertEquals(List.of("Expected expression after '..' in range"), messages(parser));

            var statement = assertInstanceOf(CaseStatement.class, procedure.body().statements().get(0));
            assertEquals(2, statement.branches().size());
            var range = assertInstanceOf(RangeExpression.class, statement.branches().get(0).values().get(0));
            assertNull(range.end());
        }

        @Test
        void caseRangeBeforeBracketTerminates() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1(x@1000 : Integer);
                        BEGIN
                          CASE x OF
                            1..]: y := 1;
                          END;
                          z := 2;
                        END;
                    """)));
            ProcedureDeclaration procedure = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> parser.parse().object().code().procedures().get(0));
            assertFalse(parser.getErrors().isEmpty());
            assertInstanceOf(AssignmentStatement.class, procedure.body().statements().get(1));
        }

        @Test
        void incompleteMemberAccessKeepsEnd() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1();
                        BEGIN
                          Rec.
                        END;

                        PROCEDURE Q@2();
                        BEGIN
                        END;
                    """)));
            CodeSection code = parser.parse().object().code();
            assertEquals(List.of("Expected member name after '.'"), messages(parser));
            assertEquals(List.of("P", "Q"), code.procedures().stream().map(ProcedureDeclaration::name).toList());
            assertInstanceOf(CallStatement.class, code.procedures().get(0).body().statements().get(0));
        }

        @Test
        void preprocessorDirectiveIsAlOnly() {
            CalParser parser = new CalParser(CalLexer.tokenize(codeunit("""
                        PROCEDURE P@1();
                        BEGIN
                          #if
                          x := 1;
                        END;
                    """)));
            ProcedureDeclaration procedure = parser.parse().object().code().procedures().get(0);
            ParseError error = parser.getErrors().get(0);
            assertEquals(ParseErrorCode.AL_ONLY_SYNTAX, error.getCode());
            assertEquals("AL-only preprocessor directive '#if' is not supported in C/AL", error.getRawMessage());
            assertEquals(1, procedure.body().statements().size());
        }

        @Test
        void objectLevelVariablesMergeIntoCode() {
            String source = """
                    OBJECT Codeunit 1 Test
                    {
                      VAR
                        Early@1000 : Integer;

                      CODE
                      {
                        VAR
                          Late@1001 : Integer;

                        BEGIN
                        END.
                      }
                    }
                    """;
            CalParser parser = new CalParser(CalLexer.tokenize(source));
            CodeSection code = parser.parse().object().code();
            assertEquals(List.of("Early", "Late"), code.variables().stream().map(v -> v.name()).toList());
        }
    }
}
