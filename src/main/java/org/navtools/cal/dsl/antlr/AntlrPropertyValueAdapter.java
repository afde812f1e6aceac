package org.navtools.cal.dsl.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.navtools.cal.dsl.ParseError;
import org.navtools.cal.dsl.ParseErrorCode;
import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * Parses the raw tokens of {@code CalcFormula} and {@code TableRelation} property values with the
 * ANTLR-generated PropertyValueLexer/PropertyValueParser.
 *
 * The C/AL lexer has already consumed the quotes of identifiers and strings, so the value text is
 * rebuilt from the tokens before handing it to ANTLR. Errors point back at the C/AL token that
 * produced the offending text.
 */
public final class AntlrPropertyValueAdapter {

    private AntlrPropertyValueAdapter() {
        // Static utility class
    }

    /**
     * @param valueTokens tokens between {@code =} and the terminating semicolon
     * @throws ParseError with code {@link ParseErrorCode#PROPERTY_VALUE} if the value is malformed
     */
    public static CalcFormula parseCalcFormula(List<Token> valueTokens) {
        SourceText source = SourceText.of(valueTokens);
        PropertyValueParser parser = newParser(source, "CalcFormula");
        return new PropertyValueAstBuilder().buildCalcFormula(parser.calcFormula());
    }

    /**
     * @param valueTokens tokens between {@code =} and the terminating semicolon
     * @throws ParseError with code {@link ParseErrorCode#PROPERTY_VALUE} if the value is malformed
     */
    public static TableRelation parseTableRelation(List<Token> valueTokens) {
        SourceText source = SourceText.of(valueTokens);
        PropertyValueParser parser = newParser(source, "TableRelation");
        return new PropertyValueAstBuilder().buildTableRelation(parser.tableRelation());
    }

    private static PropertyValueParser newParser(SourceText source, String propertyName) {
        ErrorListener listener = new ErrorListener(source, propertyName);

        PropertyValueLexer lexer = new PropertyValueLexer(CharStreams.fromString(source.text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PropertyValueParser parser = new PropertyValueParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        return parser;
    }

    /**
     * Value text with the start offset of every C/AL token inside it.
     */
    static final class SourceText {
        final String text;
        final List<Token> tokens;
        final int[] offsets;

        private SourceText(String text, List<Token> tokens, int[] offsets) {
            this.text = text;
            this.tokens = tokens;
            this.offsets = offsets;
        }

        static SourceText of(List<Token> valueTokens) {
            StringBuilder text = new StringBuilder();
            int[] offsets = new int[valueTokens.size()];
            Token last = null;
            for (int i = 0; i < valueTokens.size(); i++) {
                Token token = valueTokens.get(i);
                if (last != null && token.startOffset() > last.endOffset()) {
                    text.append(' ');
                }
                offsets[i] = text.length();
                text.append(render(token));
                last = token;
            }
            return new SourceText(text.toString(), List.copyOf(valueTokens), offsets);
        }

        private static String render(Token token) {
            if (token.type() == Token.TokenType.QUOTED_IDENTIFIER) {
                return '"' + token.value() + '"';
            }
            if (token.type() == Token.TokenType.STRING) {
                return '\'' + token.value().replace("'", "''") + '\'';
            }
            return token.value();
        }

        /**
         * The C/AL token covering the given character offset of the rebuilt text.
         */
        Token tokenAt(int charOffset) {
            if (tokens.isEmpty()) {
                return null;
            }
            int index = 0;
            for (int i = 0; i < offsets.length; i++) {
                if (offsets[i] <= charOffset) {
                    index = i;
                } else {
                    break;
                }
            }
            return tokens.get(index);
        }
    }

    /**
     * Error listener that converts ANTLR errors to ParseError.
     */
    private static class ErrorListener extends BaseErrorListener {
        private final SourceText source;
        private final String propertyName;

        ErrorListener(SourceText source, String propertyName) {
            this.source = source;
            this.propertyName = propertyName;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            int offset = charPositionInLine;
            if (offendingSymbol instanceof org.antlr.v4.runtime.Token symbol && symbol.getStartIndex() >= 0) {
                offset = symbol.getStartIndex();
            }
            throw new ParseError("Invalid " + propertyName + " value: " + msg, source.tokenAt(offset),
                    ParseErrorCode.PROPERTY_VALUE);
        }
    }

    // Visible for testing
    static String rebuild(List<Token> valueTokens) {
        return SourceText.of(valueTokens).text;
    }
}
