package org.navtools.cal.dsl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.navtools.cal.dsl.LexerStateMachine.Event;
import org.navtools.cal.dsl.LexerStateMachine.State;
import org.navtools.cal.dsl.LexerStateMachine.Transition;
import org.navtools.cal.dsl.Token.TokenType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives LexerStateMachine with events directly, without the character scanner.
 */
class LexerStateMachineTest {

    private LexerStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new LexerStateMachine();
    }

    private void enterObjectBody() {
        machine.onObjectKeyword();
        machine.onLeftBrace();
    }

    private void enterSection(TokenType keyword) {
        machine.onSectionKeyword(keyword);
        machine.onLeftBrace();
    }

    @Nested
    @DisplayName("Transition table")
    class TransitionTableTests {

        @Test
        void objectKeywordPushesObjectLevel() {
            Transition t = LexerStateMachine.transition(State.NORMAL, Event.OBJECT_KEYWORD);
            assertEquals(Transition.Kind.PUSH, t.kind());
            assertEquals(State.OBJECT_LEVEL, t.target());
        }

        @Test
        void endPopsCodeBlock() {
            assertEquals(Transition.Kind.POP, LexerStateMachine.transition(State.CODE_BLOCK, Event.END).kind());
            assertEquals(Transition.Kind.POP, LexerStateMachine.transition(State.CASE_BLOCK, Event.END).kind());
        }

        @Test
        void undefinedPairsStay() {
            assertEquals(Transition.Kind.STAY,
                    LexerStateMachine.transition(State.OBJECT_LEVEL, Event.END).kind());
            assertEquals(Transition.Kind.STAY,
                    LexerStateMachine.transition(State.CODE_BLOCK, Event.SECTION_BRACE_OPEN).kind());
        }
    }

    @Nested
    @DisplayName("Context tracking")
    class ContextTests {

        @Test
        void objectBodyOpensSection() {
            enterObjectBody();
            assertEquals(State.SECTION_LEVEL, machine.state());
            assertEquals(1, machine.braceDepth());
        }

        @Test
        void sectionClosesOnMatchingBrace() {
            enterObjectBody();
            enterSection(TokenType.PROPERTIES);
            assertEquals(4, machine.depth());
            assertTrue(machine.onRightBrace());
            assertEquals(3, machine.depth());
            assertTrue(machine.onRightBrace());
            assertEquals(2, machine.depth());
            assertEquals(State.OBJECT_LEVEL, machine.state());
            assertTrue(machine.isCleanExit());
        }

        @Test
        void beginAndEndNestInsideCode() {
            enterObjectBody();
            enterSection(TokenType.CODE);
            machine.onBegin();
            machine.onCase();
            assertEquals(State.CASE_BLOCK, machine.state());
            assertTrue(machine.isInCode());
            machine.onEnd();
            assertEquals(State.CODE_BLOCK, machine.state());
            machine.onEnd();
            assertEquals(State.SECTION_LEVEL, machine.state());
        }

        @Test
        void unmatchedEndRaisesUnderflowWithoutPopping() {
            machine.onEnd();
            assertEquals(State.NORMAL, machine.state());
            assertTrue(machine.hadUnderflow());
            assertFalse(machine.isCleanExit());
        }

        @Test
        void rightBraceAtDepthZeroIsRejected() {
            assertFalse(machine.onRightBrace());
            assertEquals(0, machine.braceDepth());
        }

        @Test
        void resetClearsEverything() {
            enterObjectBody();
            machine.onBegin();
            machine.reset();
            assertEquals(State.NORMAL, machine.state());
            assertEquals(1, machine.depth());
            assertTrue(machine.isCleanExit());
        }
    }

    @Nested
    @DisplayName("Property values")
    class PropertyValueTests {

        @Test
        void triggerPropertyOpensCode() {
            enterObjectBody();
            enterSection(TokenType.PROPERTIES);
            machine.onIdentifier("OnRun");
            machine.onEquals();
            assertTrue(machine.inPropertyValue());
            machine.onBegin();
            assertEquals(State.CODE_BLOCK, machine.state());
        }

        @Test
        void beginInPlainPropertyValueIsAWord() {
            enterObjectBody();
            enterSection(TokenType.PROPERTIES);
            machine.onIdentifier("CaptionML");
            machine.onEquals();
            assertTrue(machine.treatsBeginEndAsWord());
            machine.onBegin();
            assertEquals(State.SECTION_LEVEL, machine.state());
        }

        @Test
        void semicolonInsideBracketsKeepsValueOpen() {
            enterObjectBody();
            enterSection(TokenType.PROPERTIES);
            machine.onIdentifier("OptionOrdinalValues");
            machine.onEquals();
            machine.onLeftBracket();
            machine.onSemicolon();
            assertTrue(machine.inPropertyValue());
            machine.onRightBracket();
            machine.onSemicolon();
            assertFalse(machine.inPropertyValue());
        }

        @Test
        void triggerPropertyNamesAreCaseInsensitive() {
            assertTrue(LexerStateMachine.isTriggerProperty("ONVALIDATE"));
            assertTrue(LexerStateMachine.isTriggerProperty("OnAfterGetRecord"));
            assertFalse(LexerStateMachine.isTriggerProperty("CaptionML"));
        }
    }

    @Nested
    @DisplayName("Columnar items")
    class ColumnTests {

        @Test
        void structuralColumnsAreProtected() {
            enterObjectBody();
            enterSection(TokenType.FIELDS);
            machine.onLeftBrace();
            assertTrue(machine.isProtectedColumn());
            assertTrue(machine.downgradesSectionKeyword());
            for (int i = 0; i < 4; i++) {
                machine.onSemicolon();
            }
            assertFalse(machine.isProtectedColumn());
        }

        @Test
        void sectionKeywordInsideColumnDoesNotOpenSection() {
            enterObjectBody();
            enterSection(TokenType.FIELDS);
            machine.onLeftBrace();
            int depth = machine.depth();
            machine.onSectionKeyword(TokenType.CODE);
            machine.onLeftBrace();
            assertEquals(depth, machine.depth());
        }
    }
}
