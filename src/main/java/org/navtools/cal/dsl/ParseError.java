package org.navtools.cal.dsl;

/**
 * A parse diagnostic anchored to a token.
 *
 * Thrown between a failing sub-parser and its nearest recovery point inside
 * {@link CalParser}; callers only ever see instances through {@link CalParser#getErrors()}.
 */
public class ParseError extends RuntimeException {

    private final String rawMessage;
    private final Token token;
    private final ParseErrorCode code;

    public ParseError(String message, Token token, ParseErrorCode code) {
        super(format(message, token), null, false, false);
        this.rawMessage = MessageSanitizer.stripPaths(message);
        this.token = token;
        this.code = code;
    }

    public ParseError(String message, Token token) {
        this(message, token, ParseErrorCode.GENERIC);
    }

    private static String format(String message, Token token) {
        String clean = MessageSanitizer.stripPaths(message);
        if (token == null) {
            return clean;
        }
        return clean + " at line " + token.line() + ", column " + token.column();
    }

    /**
     * The message without the location suffix.
     */
    public String getRawMessage() {
        return rawMessage;
    }

    public Token getToken() {
        return token;
    }

    public ParseErrorCode getCode() {
        return code;
    }

    public int getLine() {
        return token != null ? token.line() : -1;
    }

    public int getColumn() {
        return token != null ? token.column() : -1;
    }

    public boolean hasLocation() {
        return token != null;
    }
}
