package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexer for C/AL object text.
 * Converts an exported object into a list of tokens terminated by {@code EOF}.
 *
 * Tokenizing never fails: characters that cannot start a token become {@code UNKNOWN}
 * tokens. Whitespace, newlines and comments are skipped. Keyword classification depends
 * on the {@link LexerStateMachine}, which this lexer feeds with brace and keyword events.
 */
public final class CalLexer {

    private static final Logger logger = LoggerFactory.getLogger(CalLexer.class);

    private static final Set<TokenType> TYPE_LIKE_KEYWORDS = EnumSet.of(TokenType.CODE);

    static {
        TYPE_LIKE_KEYWORDS.addAll(Keywords.DATA_TYPES);
    }

    private static final Set<TokenType> DOWNGRADED_IN_CODE = EnumSet.of(
            TokenType.TABLE, TokenType.PAGE, TokenType.REPORT, TokenType.CODEUNIT,
            TokenType.QUERY, TokenType.XMLPORT, TokenType.MENUSUITE);

    private final String input;
    private final LexerStateMachine context = new LexerStateMachine();
    private List<Token> tokens;
    private int position;
    private int line;
    private int column;

    public CalLexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the entire input.
     *
     * @return tokens in source order, ending with EOF
     */
    public List<Token> tokenize() {
        tokens = new ArrayList<>();
        position = 0;
        line = 1;
        column = 1;
        context.reset();

        while (position < input.length()) {
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", line, column, position, position));
        if (!context.isCleanExit()) {
            logger.debug("Lexer finished with unbalanced context: state={}, braceDepth={}, underflow={}",
                    context.state(), context.braceDepth(), context.hadUnderflow());
        }
        return tokens;
    }

    /**
     * Context of the last {@link #tokenize()} run, for diagnostics.
     */
    public LexerStateMachine context() {
        return context;
    }

    public static List<Token> tokenize(String input) {
        return new CalLexer(input).tokenize();
    }

    private void scanToken() {
        char c = current();
        int start = position;
        int startLine = line;
        int startColumn = column;

        if (c == ' ' || c == '\t') {
            advance();
            return;
        }
        if (c == '\n' || c == '\r') {
            newLine();
            return;
        }
        if (c == '/' && peek(1) == '/') {
            skipLineComment();
            return;
        }
        if (c == '/' && peek(1) == '*') {
            scanCStyleComment();
            return;
        }
        if (c == '{') {
            if (context.isInCode()) {
                scanBraceComment();
            } else {
                advance();
                emit(TokenType.LBRACE, "{", start, startLine, startColumn);
                context.onLeftBrace();
            }
            return;
        }
        if (c == '}' && !context.isInCode()) {
            advance();
            if (context.onRightBrace()) {
                emit(TokenType.RBRACE, "}", start, startLine, startColumn);
            } else {
                emit(TokenType.UNKNOWN, "}", start, startLine, startColumn);
            }
            return;
        }
        if (c == '"') {
            scanQuotedIdentifier(start, startLine, startColumn);
            return;
        }
        if (c == '\'') {
            scanString(start, startLine, startColumn);
            return;
        }
        if (isDigit(c)) {
            scanNumber(start, startLine, startColumn);
            return;
        }
        if (isIdentifierStart(c)) {
            scanIdentifier(start, startLine, startColumn);
            return;
        }
        if (c == '#') {
            advance();
            while (isIdentifierPart(current())) {
                advance();
            }
            emit(TokenType.PREPROCESSOR_DIRECTIVE, input.substring(start, position), start, startLine, startColumn);
            return;
        }
        scanOperator(start, startLine, startColumn);
    }

    /**
     * Quoted identifiers have no escape: {@code "A""B"} yields the two tokens {@code A} and {@code B}.
     */
    private void scanQuotedIdentifier(int start, int startLine, int startColumn) {
        advance();
        StringBuilder value = new StringBuilder();
        while (position < input.length() && current() != '"' && current() != '\n' && current() != '\r') {
            value.append(current());
            advance();
        }
        boolean closed = position < input.length() && current() == '"';
        if (closed) {
            advance();
        }
        emit(closed ? TokenType.QUOTED_IDENTIFIER : TokenType.UNKNOWN, value.toString(), start, startLine, startColumn);
    }

    private void scanString(int start, int startLine, int startColumn) {
        advance();
        StringBuilder value = new StringBuilder();
        boolean closed = false;
        while (position < input.length()) {
            char c = current();
            if (c == '\'') {
                if (peek(1) == '\'') {
                    value.append('\'');
                    advance();
                    advance();
                } else {
                    advance();
                    closed = true;
                    break;
                }
            } else if (c == '\r' || c == '\n') {
                // strings may span lines; the line break is kept in the value
                if (c == '\r' && peek(1) == '\n') {
                    value.append("\r\n");
                    position += 2;
                } else {
                    value.append(c);
                    position++;
                }
                line++;
                column = 1;
            } else {
                value.append(c);
                advance();
            }
        }
        emit(closed ? TokenType.STRING : TokenType.UNKNOWN, value.toString(), start, startLine, startColumn);
    }

    private void scanNumber(int start, int startLine, int startColumn) {
        while (isDigit(current())) {
            advance();
        }
        boolean decimal = false;
        if (current() == '.' && isDigit(peek(1))) {
            decimal = true;
            advance();
            while (isDigit(current())) {
                advance();
            }
        }
        int digits = position - start;

        if (!decimal && upper(current()) == 'D' && (digits == 6 || digits == 8 || digits == 1)
                && !isIdentifierPartAt(position + 1, 'T')) {
            advance();
            boolean undefinedDateTime = digits == 1 && upper(current()) == 'T';
            if (isDigit(current()) || undefinedDateTime) {
                int timeStart = position;
                while (isDigit(current())) {
                    advance();
                }
                if (upper(current()) == 'T') {
                    advance();
                    emit(TokenType.DATETIME, input.substring(start, position), start, startLine, startColumn);
                    return;
                }
                // not a date-time after all; give the digits back
                position = timeStart;
                column = startColumn + (timeStart - start);
            }
            emit(TokenType.DATE, input.substring(start, position), start, startLine, startColumn);
            return;
        }
        if (!decimal && upper(current()) == 'T' && (digits >= 6 || digits == 1) && !isIdentifierPartAt(position + 1, '\0')) {
            advance();
            emit(TokenType.TIME, input.substring(start, position), start, startLine, startColumn);
            return;
        }
        emit(decimal ? TokenType.DECIMAL : TokenType.INTEGER, input.substring(start, position), start, startLine,
                startColumn);
    }

    /**
     * True when the character at {@code index} continues a word, other than the allowed letter.
     */
    private boolean isIdentifierPartAt(int index, char allowed) {
        if (index >= input.length()) {
            return false;
        }
        char c = input.charAt(index);
        if (allowed != '\0' && upper(c) == allowed) {
            return false;
        }
        return Character.isLetter(c) || c == '_';
    }

    private void scanIdentifier(int start, int startLine, int startColumn) {
        while (isIdentifierPart(current())) {
            advance();
        }
        String value = input.substring(start, position);

        if (value.equalsIgnoreCase("OBJECT") && current() == '-' && matchesWordAt(position + 1, "PROPERTIES")) {
            advanceBy(1 + "PROPERTIES".length());
            emit(TokenType.OBJECT_PROPERTIES, input.substring(start, position), start, startLine, startColumn);
            context.onOtherWord();
            return;
        }
        if (value.equalsIgnoreCase("FORMAT") && current() == '/' && matchesWordAt(position + 1, "EVALUATE")) {
            advanceBy(1 + "EVALUATE".length());
            value = input.substring(start, position);
            emit(TokenType.IDENTIFIER, value, start, startLine, startColumn);
            context.onIdentifier(value);
            context.onOtherWord();
            return;
        }

        TokenType type = Keywords.lookup(value);
        type = classify(type);
        emit(type, value, start, startLine, startColumn);

        if (type == TokenType.IDENTIFIER) {
            context.onIdentifier(value);
        }
        if (Keywords.SECTION_KEYWORDS.contains(type)) {
            context.onSectionKeyword(type);
        } else {
            context.onOtherWord();
        }
        switch (type) {
            case OBJECT -> {
                if (context.state() == LexerStateMachine.State.NORMAL) {
                    context.onObjectKeyword();
                }
            }
            case BEGIN -> context.onBegin();
            case CASE -> context.onCase();
            case END -> context.onEnd();
            default -> {
            }
        }
    }

    /**
     * Applies the context-dependent downgrades of keywords to identifiers.
     */
    private TokenType classify(TokenType type) {
        if (type == TokenType.IDENTIFIER || type == TokenType.AL_ONLY_KEYWORD
                || type == TokenType.AL_ONLY_ACCESS_MODIFIER) {
            return type;
        }
        // an auto-numbering suffix always marks a name
        if (current() == '@' && (isDigit(peek(1)) || (peek(1) == '-' && isDigit(peek(2))))) {
            return TokenType.IDENTIFIER;
        }
        if (TYPE_LIKE_KEYWORDS.contains(type) && current() == '[') {
            Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            if (previous == null || previous.type() != TokenType.COLON) {
                return TokenType.IDENTIFIER;
            }
        }
        if (Keywords.SECTION_KEYWORDS.contains(type) && context.downgradesSectionKeyword()) {
            return TokenType.IDENTIFIER;
        }
        if (DOWNGRADED_IN_CODE.contains(type) && context.isInCode()) {
            return TokenType.IDENTIFIER;
        }
        if ((type == TokenType.BEGIN || type == TokenType.END) && context.treatsBeginEndAsWord()) {
            return TokenType.IDENTIFIER;
        }
        return type;
    }

    private void scanOperator(int start, int startLine, int startColumn) {
        char c = current();
        char next = peek(1);
        String twoChar = String.valueOf(new char[] { c, next });
        TokenType twoCharType = switch (twoChar) {
            case "+=" -> TokenType.PLUS_ASSIGN;
            case "-=" -> TokenType.MINUS_ASSIGN;
            case "*=" -> TokenType.MULTIPLY_ASSIGN;
            case "/=" -> TokenType.DIVIDE_ASSIGN;
            case "<=" -> TokenType.LESS_EQUAL;
            case "<>" -> TokenType.NOT_EQUAL;
            case ">=" -> TokenType.GREATER_EQUAL;
            case ".." -> TokenType.DOT_DOT;
            case ":=" -> TokenType.ASSIGN;
            case "::" -> TokenType.DOUBLE_COLON;
            default -> null;
        };
        if (twoCharType != null) {
            advanceBy(2);
            emit(twoCharType, twoChar, start, startLine, startColumn);
            return;
        }

        TokenType singleCharType = switch (c) {
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.MULTIPLY;
            case '/' -> TokenType.DIVIDE;
            case '=' -> TokenType.EQUAL;
            case '<' -> TokenType.LESS;
            case '>' -> TokenType.GREATER;
            case '.' -> TokenType.DOT;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMICOLON;
            case ':' -> TokenType.COLON;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '?' -> TokenType.TERNARY_OPERATOR;
            default -> TokenType.UNKNOWN; // '@', stray '}' in code, anything else
        };
        advance();
        emit(singleCharType, String.valueOf(c), start, startLine, startColumn);

        switch (singleCharType) {
            case EQUAL -> context.onEquals();
            case SEMICOLON -> context.onSemicolon();
            case LBRACKET -> context.onLeftBracket();
            case RBRACKET -> context.onRightBracket();
            default -> {
            }
        }
    }

    private void skipLineComment() {
        while (position < input.length() && current() != '\n' && current() != '\r') {
            advance();
        }
    }

    private void scanBraceComment() {
        int start = position;
        int startLine = line;
        int startColumn = column;
        advance();
        while (position < input.length()) {
            char c = current();
            if (c == '}') {
                advance();
                return;
            }
            if (c == '\n' || c == '\r') {
                newLine();
            } else {
                advance();
            }
        }
        emit(TokenType.UNKNOWN, "{", start, startLine, startColumn);
    }

    private void scanCStyleComment() {
        int start = position;
        int startLine = line;
        int startColumn = column;
        advanceBy(2);
        while (position < input.length()) {
            if (current() == '*' && peek(1) == '/') {
                advanceBy(2);
                return;
            }
            if (current() == '\n' || current() == '\r') {
                newLine();
            } else {
                advance();
            }
        }
        emit(TokenType.UNKNOWN, "/*", start, startLine, startColumn);
    }

    private void emit(TokenType type, String value, int start, int startLine, int startColumn) {
        tokens.add(new Token(type, value, startLine, startColumn, start, position));
    }

    private boolean matchesWordAt(int index, String word) {
        int end = index + word.length();
        if (end > input.length() || !input.regionMatches(true, index, word, 0, word.length())) {
            return false;
        }
        return end == input.length() || !isIdentifierPart(input.charAt(end));
    }

    private void newLine() {
        if (current() == '\r' && peek(1) == '\n') {
            position += 2;
        } else {
            position++;
        }
        line++;
        column = 1;
    }

    private char current() {
        return position < input.length() ? input.charAt(position) : '\0';
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void advance() {
        if (position < input.length()) {
            position++;
            column++;
        }
    }

    private void advanceBy(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    private static char upper(char c) {
        return Character.toUpperCase(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isExtendedLatinLetter(c);
    }

    private boolean isIdentifierPart(char c) {
        if (c == '\'' && context.state() == LexerStateMachine.State.SECTION_LEVEL) {
            return true;
        }
        return isIdentifierStart(c) || isDigit(c);
    }

    /**
     * Latin-1 Supplement and Latin Extended-A letters, without the multiplication and division signs.
     */
    private static boolean isExtendedLatinLetter(char c) {
        if (c >= 'À' && c <= 'ÿ') {
            return c != '×' && c != '÷';
        }
        return c >= 'Ā' && c <= 'ſ';
    }

    @Override
    public String toString() {
        return "CalLexer[" + input.length() + " chars, state=" + context.state().name().toLowerCase(Locale.ROOT) + "]";
    }
}
