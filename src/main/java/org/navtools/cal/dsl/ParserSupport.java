package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Token cursor, diagnostics sink and recovery primitives shared by the parser layers.
 *
 * The cursor never moves past the trailing EOF token, and every recovery loop
 * either consumes a token or stops, which is what keeps parsing total on any input.
 */
abstract class ParserSupport {

    private static final Logger logger = LoggerFactory.getLogger(ParserSupport.class);

    /** Keywords that may double as identifiers in names and expressions. */
    static final Set<TokenType> IDENTIFIER_KEYWORDS = EnumSet.of(
            TokenType.OBJECT, TokenType.TABLE, TokenType.PAGE, TokenType.REPORT, TokenType.CODEUNIT,
            TokenType.QUERY, TokenType.XMLPORT, TokenType.MENUSUITE, TokenType.RECORD, TokenType.CHAR,
            TokenType.OPTION, TokenType.TEXT, TokenType.BOOLEAN, TokenType.CODE, TokenType.CONTROLS,
            TokenType.FIELDREF, TokenType.RECORDREF, TokenType.RECORDID, TokenType.DURATION,
            TokenType.BIGINTEGER, TokenType.FIELDS, TokenType.KEYS, TokenType.BYTE, TokenType.BREAK,
            TokenType.PROPERTIES, TokenType.FIELDGROUPS, TokenType.ACTIONS, TokenType.ELEMENTS,
            TokenType.LABELS, TokenType.DATASET, TokenType.BIGTEXT, TokenType.BLOB, TokenType.GUID,
            TokenType.TEXTCONST, TokenType.REQUESTFORM, TokenType.REQUESTPAGE, TokenType.MENUNODES,
            TokenType.DATAITEMS, TokenType.SECTIONS, TokenType.EVENT,
            TokenType.AL_ONLY_KEYWORD, TokenType.AL_ONLY_ACCESS_MODIFIER);

    protected final List<Token> tokens;
    protected int position;
    protected int braceDepth;

    private final List<ParseError> errors = new ArrayList<>();
    private final List<SkippedRegion> skippedRegions = new ArrayList<>();

    protected ParserSupport(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            int offset = copy.isEmpty() ? 0 : copy.get(copy.size() - 1).endOffset();
            int line = copy.isEmpty() ? 1 : copy.get(copy.size() - 1).line();
            copy.add(new Token(TokenType.EOF, "", line, 1, offset, offset));
        }
        this.tokens = copy;
    }

    /**
     * Diagnostics collected so far, in the order they were raised.
     */
    public List<ParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<SkippedRegion> getSkippedRegions() {
        return Collections.unmodifiableList(skippedRegions);
    }

    // ==================== Cursor ====================

    protected Token peek() {
        return tokens.get(position);
    }

    protected Token peekAhead(int distance) {
        int index = position + distance;
        if (index < 0) {
            return tokens.get(0);
        }
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    protected Token previous() {
        return position > 0 ? tokens.get(position - 1) : peek();
    }

    protected boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    protected boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    protected boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                return true;
            }
        }
        return false;
    }

    protected boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    protected Token advance() {
        Token current = peek();
        if (!isAtEnd()) {
            if (current.type() == TokenType.LBRACE) {
                braceDepth++;
            } else if (current.type() == TokenType.RBRACE) {
                braceDepth--;
            }
            position++;
        }
        return current;
    }

    /**
     * Steps back over the token returned by the last {@link #advance()}.
     */
    protected void retreat() {
        if (position == 0) {
            return;
        }
        position--;
        TokenType type = tokens.get(position).type();
        if (type == TokenType.LBRACE) {
            braceDepth--;
        } else if (type == TokenType.RBRACE) {
            braceDepth++;
        }
    }

    protected Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message + ", but found " + describe(peek()), peek(), ParseErrorCode.EXPECTED_TOKEN);
    }

    /**
     * Like {@link #consume}, but the diagnostic points at the last good token, so a
     * missing terminator is reported at the end of the construct it belongs to.
     */
    protected Token consumeExpected(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message + ", but found " + describe(peek()), previous(), ParseErrorCode.EXPECTED_TOKEN);
    }

    protected static String describe(Token token) {
        return "'" + token.value() + "' (" + token.type() + ")";
    }

    // ==================== Diagnostics ====================

    protected ParseError error(String message, Token token, ParseErrorCode code) {
        return new ParseError(message, token, code);
    }

    protected void recordError(String message) {
        recordError(message, peek(), ParseErrorCode.GENERIC);
    }

    protected void recordError(String message, Token token) {
        recordError(message, token, ParseErrorCode.GENERIC);
    }

    protected void recordError(String message, Token token, ParseErrorCode code) {
        addError(error(message, token, code));
    }

    protected void addError(ParseError parseError) {
        logger.trace("Parse error: {}", parseError.getMessage());
        errors.add(parseError);
    }

    protected void recordSkippedRegion(Token start, Token end, int count, String reason) {
        if (count <= 0) {
            return;
        }
        skippedRegions.add(new SkippedRegion(start, end, count, reason));
        logger.trace("Skipped {} token(s) from {} to {}: {}", count, start, end, reason);
        recordError("Skipped " + count + " token(s) during error recovery", start, ParseErrorCode.ERROR_RECOVERY);
    }

    // ==================== Recovery ====================

    /**
     * Skips to the first of the given token types, then swallows one trailing semicolon.
     */
    protected void recoverToTokens(TokenType... stops) {
        Token start = peek();
        int skipped = 0;
        while (!isAtEnd() && !checkAny(stops)) {
            advance();
            skipped++;
        }
        if (skipped > 0) {
            recordSkippedRegion(start, previous(), skipped, "recovery to " + List.of(stops));
        }
        match(TokenType.SEMICOLON);
    }

    /**
     * Skips the rest of a failed statement, stopping at a semicolon or at the END that closes
     * the enclosing block. Nested BEGIN/END and CASE/END pairs are counted so their END is skipped.
     */
    protected void recoverToTokensDepthAware(boolean stopAtBoundary) {
        Token start = peek();
        int skipped = 0;
        int beginEnd = 1;
        int caseDepth = 0;
        while (!isAtEnd()) {
            if (stopAtBoundary && isProcedureBoundary()) {
                break;
            }
            TokenType type = peek().type();
            if (type == TokenType.BEGIN) {
                beginEnd++;
            } else if (type == TokenType.CASE) {
                caseDepth++;
            } else if (type == TokenType.END) {
                if (caseDepth > 0) {
                    caseDepth--;
                } else if (beginEnd > 1) {
                    beginEnd--;
                } else {
                    break;
                }
            }
            if (type == TokenType.SEMICOLON) {
                break;
            }
            advance();
            skipped++;
        }
        if (skipped > 0) {
            recordSkippedRegion(start, previous(), skipped, "statement recovery");
        }
        match(TokenType.SEMICOLON);
    }

    /**
     * Panic-mode recovery used after a failure at object level. Always consumes at least one token.
     */
    protected void synchronize() {
        int errorDepth = braceDepth;
        Token start = peek();
        int skipped = 0;
        if (!isAtEnd()) {
            advance();
            skipped++;
        }
        while (!isAtEnd()) {
            if (previous().type() == TokenType.SEMICOLON) {
                break;
            }
            TokenType type = peek().type();
            if (Keywords.SECTION_KEYWORDS.contains(type)) {
                break;
            }
            if (type == TokenType.PROCEDURE || type == TokenType.FUNCTION || type == TokenType.TRIGGER
                    || type == TokenType.BEGIN || type == TokenType.END || type == TokenType.VAR) {
                break;
            }
            if (type == TokenType.RBRACE && braceDepth < errorDepth) {
                break;
            }
            advance();
            skipped++;
        }
        recordSkippedRegion(start, previous(), skipped, "synchronize");
    }

    // ==================== Sections ====================

    protected void skipUnsupportedSection() {
        int sectionDepth = braceDepth;
        Token start = peek();
        int skipped = 0;
        advance();
        skipped++;
        while (!isAtEnd()) {
            if (braceDepth == sectionDepth && isSectionKeyword(peek().type())) {
                break;
            }
            if (braceDepth < sectionDepth) {
                break;
            }
            advance();
            skipped++;
        }
        logger.debug("Skipped unsupported section {} ({} tokens)", start.value(), skipped);
    }

    protected boolean isSectionKeyword(TokenType type) {
        if (type == TokenType.CODE || type == TokenType.CONTROLS) {
            return peekAhead(1).type() == TokenType.LBRACE;
        }
        return Keywords.SECTION_KEYWORDS.contains(type);
    }

    protected boolean isFollowedByLeftBrace() {
        return peekAhead(1).type() == TokenType.LBRACE;
    }

    // ==================== Identifiers and boundaries ====================

    protected boolean canBeUsedAsIdentifier() {
        return canBeUsedAsIdentifier(peek());
    }

    protected static boolean canBeUsedAsIdentifier(Token token) {
        TokenType type = token.type();
        return type == TokenType.IDENTIFIER
                || type == TokenType.QUOTED_IDENTIFIER
                || type.name().endsWith("_TYPE")
                || IDENTIFIER_KEYWORDS.contains(type);
    }

    /**
     * Whether the current token starts a new procedure-level declaration.
     */
    protected boolean isProcedureBoundary() {
        TokenType type = peek().type();
        if (type == TokenType.PROCEDURE || type == TokenType.FUNCTION || type == TokenType.TRIGGER) {
            return true;
        }
        if (type == TokenType.EVENT) {
            Token next = peekAhead(1);
            Token after = peekAhead(2);
            return canBeUsedAsIdentifier(next)
                    && ((after.type() == TokenType.UNKNOWN && "@".equals(after.value()))
                            || after.type() == TokenType.DOUBLE_COLON);
        }
        return false;
    }

    /**
     * Whether an END at the cursor closes an enclosing structure instead of the one being parsed.
     */
    protected boolean isEndForOuterStructure() {
        if (!check(TokenType.END)) {
            return false;
        }
        int offset = 1;
        while (offset <= 10 && peekAhead(offset).type() == TokenType.SEMICOLON) {
            offset++;
        }
        Token next = peekAhead(offset);
        if (next.type() == TokenType.EOF) {
            return false;
        }
        if (next.type() == TokenType.RBRACE || (next.type() == TokenType.UNKNOWN && "}".equals(next.value()))) {
            return true;
        }
        TokenType type = next.type();
        return type == TokenType.PROCEDURE || type == TokenType.FUNCTION || type == TokenType.TRIGGER
                || type == TokenType.LOCAL;
    }

    /**
     * Skips an {@code @123} auto-number suffix after a declared name.
     */
    protected void skipAutoNumberSuffix() {
        if (check(TokenType.UNKNOWN) && "@".equals(peek().value())) {
            advance();
            match(TokenType.MINUS);
            match(TokenType.INTEGER);
        }
    }

    protected int parseInteger(Token token, String context) {
        try {
            return Integer.parseInt(token.value());
        } catch (NumberFormatException e) {
            recordError("Invalid integer value: " + token.value() + " (expected " + context + ")", token,
                    ParseErrorCode.EXPECTED_TOKEN);
            return 0;
        }
    }

    /**
     * Appends a token value, separated by a space when the source had whitespace between them.
     */
    protected static void appendWithGap(StringBuilder builder, Token previousToken, Token token) {
        if (builder.length() > 0 && previousToken != null && token.startOffset() > previousToken.endOffset()) {
            builder.append(' ');
        }
        builder.append(token.value());
    }

    // ==================== AL dialect ====================

    protected boolean isAlOnlyToken(TokenType type) {
        return type == TokenType.AL_ONLY_KEYWORD || type == TokenType.AL_ONLY_ACCESS_MODIFIER
                || type == TokenType.TERNARY_OPERATOR || type == TokenType.PREPROCESSOR_DIRECTIVE;
    }

    /**
     * Records a diagnostic when the current token is AL-only syntax. Does not consume.
     */
    protected boolean checkAndReportAlOnlyToken() {
        Token token = peek();
        String message = alOnlyMessage(token);
        if (message == null) {
            return false;
        }
        recordError(message, token, ParseErrorCode.AL_ONLY_SYNTAX);
        return true;
    }

    protected static String alOnlyMessage(Token token) {
        switch (token.type()) {
            case AL_ONLY_KEYWORD:
                return "AL-only keyword '" + token.value() + "' is not supported in C/AL";
            case AL_ONLY_ACCESS_MODIFIER:
                return "AL-only access modifier '" + token.value()
                        + "' is not supported in C/AL. Use LOCAL instead.";
            case TERNARY_OPERATOR:
                return "AL-only ternary operator (? :) is not supported in C/AL. Use IF-THEN-ELSE instead.";
            case PREPROCESSOR_DIRECTIVE:
                return "AL-only preprocessor directive '" + token.value() + "' is not supported in C/AL";
            default:
                return null;
        }
    }

    protected void skipAlOnlyTokens() {
        while (!isAtEnd() && isAlOnlyToken(peek().type())) {
            checkAndReportAlOnlyToken();
            advance();
        }
    }
}
