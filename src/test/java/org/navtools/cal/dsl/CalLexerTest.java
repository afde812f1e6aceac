package org.navtools.cal.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.navtools.cal.dsl.Token.TokenType;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CalLexer - tokenization of C/AL object text.
 */
class CalLexerTest {

    private static List<TokenType> types(String source) {
        return CalLexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Keywords and identifiers")
    class KeywordTests {

        @Test
        void objectHeader() {
            assertEquals(List.of(TokenType.OBJECT, TokenType.TABLE, TokenType.INTEGER, TokenType.IDENTIFIER,
                    TokenType.EOF), types("OBJECT Table 18 Customer"));
        }

        @Test
        void keywordsAreCaseInsensitive() {
            assertEquals(List.of(TokenType.OBJECT, TokenType.CODEUNIT, TokenType.EOF), types("object CodeUnit"));
        }

        @Test
        void objectPropertiesIsOneToken() {
            List<Token> tokens = CalLexer.tokenize("OBJECT-PROPERTIES");
            assertEquals(TokenType.OBJECT_PROPERTIES, tokens.get(0).type());
            assertEquals("OBJECT-PROPERTIES", tokens.get(0).value());
            assertEquals(2, tokens.size());
        }

        @Test
        void formatEvaluateIsOneIdentifier() {
            List<Token> tokens = CalLexer.tokenize("FORMAT/EVALUATE");
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals("FORMAT/EVALUATE", tokens.get(0).value());
        }

        @Test
        void dataTypeBeforeBracketWithoutColonIsIdentifier() {
            assertEquals(TokenType.IDENTIFIER, CalLexer.tokenize("Text[1]").get(0).type());
        }

        @Test
        void dataTypeAfterColonKeepsKeyword() {
            List<Token> tokens = CalLexer.tokenize("Name : Text[30]");
            assertEquals(TokenType.TEXT, tokens.get(2).type());
            assertEquals(TokenType.LBRACKET, tokens.get(3).type());
        }

        @Test
        void autoNumberSuffixDowngradesKeyword() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.UNKNOWN, TokenType.INTEGER, TokenType.EOF),
                    types("Date@1000"));
        }

        @Test
        void extendedLatinLetters() {
            List<Token> tokens = CalLexer.tokenize("Bemærkning");
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals("Bemærkning", tokens.get(0).value());
        }

        @Test
        void multiplicationSignIsNotALetter() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.UNKNOWN, TokenType.IDENTIFIER, TokenType.EOF),
                    types("a×b"));
        }

        @Test
        void alOnlyTokens() {
            assertEquals(List.of(TokenType.AL_ONLY_KEYWORD, TokenType.AL_ONLY_ACCESS_MODIFIER,
                    TokenType.TERNARY_OPERATOR, TokenType.PREPROCESSOR_DIRECTIVE, TokenType.EOF),
                    types("enum internal ? #if"));
        }

        @Test
        void apostropheContinuesIdentifierInsideSection() {
            String source = """
                    OBJECT Table 1 Test
                    {
                      PROPERTIES
                      {
                        CaptionML=ENU=Customer's;
                      }
                    }
                    """;
            assertTrue(CalLexer.tokenize(source).stream()
                    .anyMatch(t -> t.type() == TokenType.IDENTIFIER && t.value().equals("Customer's")));
        }

        @Test
        void sectionKeywordsInCodeAreIdentifiers() {
            String source = """
                    OBJECT Codeunit 1 Test
                    {
                      CODE
                      {
                        PROCEDURE P@1();
                        BEGIN
                          n := WordDocument.MailMerge.Fields.Count;
                          Keys := Controls;
                        END;

                        BEGIN
                        END.
                      }
                    }
                    """;
            List<Token> tokens = CalLexer.tokenize(source);
            for (String word : List.of("Fields", "Keys", "Controls")) {
                assertTrue(tokens.stream().anyMatch(t -> t.value().equals(word)), word);
                assertTrue(tokens.stream().filter(t -> t.value().equals(word))
                        .allMatch(t -> t.type() == TokenType.IDENTIFIER), word);
            }
            assertEquals(TokenType.CODE, tokens.stream().filter(t -> t.value().equals("CODE"))
                    .findFirst().orElseThrow().type());
        }
    }

    @Nested
    @DisplayName("Literals")
    class LiteralTests {

        @ParameterizedTest
        @CsvSource({
                "010125D, DATE",
                "20250101D, DATE",
                "120000T, TIME",
                "0DT, DATETIME",
                "010125D120000T, DATETIME",
                "42, INTEGER",
                "3.14, DECIMAL"
        })
        void numericLiterals(String source, TokenType expected) {
            List<Token> tokens = CalLexer.tokenize(source);
            assertEquals(expected, tokens.get(0).type());
            assertEquals(source, tokens.get(0).value());
        }

        @Test
        void rangeIsNotADecimal() {
            assertEquals(List.of(TokenType.INTEGER, TokenType.DOT_DOT, TokenType.INTEGER, TokenType.EOF),
                    types("1..5"));
        }

        @Test
        void doubledQuoteInString() {
            Token token = CalLexer.tokenize("'It''s'").get(0);
            assertEquals(TokenType.STRING, token.type());
            assertEquals("It's", token.value());
            assertEquals(7, token.length());
        }

        @Test
        void stringSpansLines() {
            List<Token> tokens = CalLexer.tokenize("'a\nb' x");
            assertEquals("a\nb", tokens.get(0).value());
            assertEquals(2, tokens.get(1).line());
        }

        @Test
        void unterminatedStringIsUnknown() {
            assertEquals(TokenType.UNKNOWN, CalLexer.tokenize("'abc").get(0).type());
        }

        @Test
        void quotedIdentifierHasNoEscape() {
            List<Token> tokens = CalLexer.tokenize("\"A\"\"B\"");
            assertEquals(TokenType.QUOTED_IDENTIFIER, tokens.get(0).type());
            assertEquals("A", tokens.get(0).value());
            assertEquals(TokenType.QUOTED_IDENTIFIER, tokens.get(1).type());
            assertEquals("B", tokens.get(1).value());
        }

        @Test
        void unterminatedQuotedIdentifierStopsAtNewline() {
            List<Token> tokens = CalLexer.tokenize("\"abc\nx");
            assertEquals(TokenType.UNKNOWN, tokens.get(0).type());
            assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
            assertEquals(2, tokens.get(1).line());
        }
    }

    @Nested
    @DisplayName("Comments and braces")
    class CommentTests {

        @Test
        void braceIsCommentInsideCode() {
            assertEquals(List.of(TokenType.BEGIN, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER,
                    TokenType.SEMICOLON, TokenType.END, TokenType.EOF),
                    types("BEGIN { comment } x := 1; END"));
        }

        @Test
        void braceIsStructuralOutsideCode() {
            assertEquals(List.of(TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF), types("{ }"));
        }

        @Test
        void unmatchedClosingBraceIsUnknown() {
            List<Token> tokens = CalLexer.tokenize("}");
            assertEquals(TokenType.UNKNOWN, tokens.get(0).type());
            assertEquals("}", tokens.get(0).value());
        }

        @Test
        void lineAndBlockCommentsAreSkipped() {
            List<Token> tokens = CalLexer.tokenize("x // one\ny /* two\nthree */ w");
            assertEquals(List.of("x", "y", "w", ""), tokens.stream().map(Token::value).collect(Collectors.toList()));
            assertEquals(3, tokens.get(2).line());
        }

        @Test
        void unterminatedBlockCommentIsUnknown() {
            Token token = CalLexer.tokenize("/* never closed").get(0);
            assertEquals(TokenType.UNKNOWN, token.type());
            assertEquals("/*", token.value());
        }
    }

    @Nested
    @DisplayName("Positions")
    class PositionTests {

        @Test
        void offsetsAndColumns() {
            List<Token> tokens = CalLexer.tokenize("ab cd\n  ef");
            Token cd = tokens.get(1);
            assertEquals(1, cd.line());
            assertEquals(4, cd.column());
            assertEquals(3, cd.startOffset());
            assertEquals(5, cd.endOffset());
            Token ef = tokens.get(2);
            assertEquals(2, ef.line());
            assertEquals(3, ef.column());
        }

        @Test
        void alwaysEndsWithEof() {
            assertEquals(List.of(TokenType.EOF), types(""));
            assertEquals(TokenType.EOF, CalLexer.tokenize("x").get(1).type());
        }

        @Test
        void cleanExitAfterBalancedObject() {
            CalLexer lexer = new CalLexer("OBJECT Codeunit 1 Test\n{\n  CODE\n  {\n    BEGIN\n    END.\n  }\n}\n");
            lexer.tokenize();
            assertTrue(lexer.context().isCleanExit());
        }

        @Test
        void unclosedCodeBlockIsNotClean() {
            CalLexer lexer = new CalLexer("BEGIN x := 1;");
            lexer.tokenize();
            assertFalse(lexer.context().isCleanExit());
        }
    }
}
