package org.navtools.cal.dsl;

/**
 * A token produced by {@link CalLexer}.
 *
 * @param type        The token type
 * @param value       The token text; quotes are stripped from strings and quoted identifiers
 * @param line        1-based line of the first character
 * @param column      1-based column of the first character
 * @param startOffset 0-based offset of the first character, delimiters included
 * @param endOffset   0-based offset one past the last character, delimiters included
 */
public record Token(TokenType type, String value, int line, int column, int startOffset, int endOffset) {

    public enum TokenType {
        // Identifiers and literals
        IDENTIFIER, // Customer, SETRANGE
        QUOTED_IDENTIFIER, // "No."
        INTEGER, // 42
        DECIMAL, // 3.14
        STRING, // 'Smith'
        DATE, // 010125D
        TIME, // 120000T
        DATETIME, // 010125D120000T

        // Object kinds
        OBJECT,
        TABLE,
        PAGE,
        REPORT,
        CODEUNIT,
        QUERY,
        XMLPORT,
        MENUSUITE,

        // Sections
        OBJECT_PROPERTIES, // OBJECT-PROPERTIES
        PROPERTIES,
        FIELDS,
        KEYS,
        FIELDGROUPS,
        CODE,
        CONTROLS,
        ACTIONS,
        DATAITEMS,
        DATASET,
        REQUESTPAGE,
        LABELS,
        MENUNODES,
        ELEMENTS,
        REQUESTFORM,
        SECTIONS,

        // Data types
        BOOLEAN,
        INTEGER_TYPE,
        DECIMAL_TYPE,
        TEXT,
        CODE_TYPE,
        DATE_TYPE,
        TIME_TYPE,
        DATETIME_TYPE,
        RECORD,
        RECORDID,
        RECORDREF,
        FIELDREF,
        BIGINTEGER,
        BIGTEXT,
        BLOB,
        GUID,
        DURATION,
        OPTION,
        CHAR,
        BYTE,
        TEXTCONST,

        // Control flow
        IF,
        THEN,
        ELSE,
        CASE,
        OF,
        WHILE,
        DO,
        REPEAT,
        UNTIL,
        FOR,
        TO,
        DOWNTO,
        EXIT,
        BREAK,
        WITH,

        // Declarations
        PROCEDURE,
        FUNCTION,
        LOCAL,
        VAR,
        TRIGGER,
        EVENT,
        BEGIN,
        END,

        // Word operators and modifiers
        TRUE,
        FALSE,
        DIV,
        MOD,
        AND,
        OR,
        NOT,
        XOR,
        IN,
        ARRAY,
        TEMPORARY,
        INDATASET,
        RUNONCLIENT,
        WITHEVENTS,
        SECURITYFILTERING,

        // Operators
        PLUS, // +
        MINUS, // -
        MULTIPLY, // *
        DIVIDE, // /
        ASSIGN, // :=
        PLUS_ASSIGN, // +=
        MINUS_ASSIGN, // -=
        MULTIPLY_ASSIGN, // *=
        DIVIDE_ASSIGN, // /=
        EQUAL, // =
        NOT_EQUAL, // <>
        LESS, // <
        LESS_EQUAL, // <=
        GREATER, // >
        GREATER_EQUAL, // >=
        DOT, // .
        DOT_DOT, // ..
        COMMA, // ,
        SEMICOLON, // ;
        COLON, // :
        DOUBLE_COLON, // ::

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        LBRACKET, // [
        RBRACKET, // ]
        LBRACE, // {
        RBRACE, // }

        // AL dialect, rejected by the parser
        AL_ONLY_KEYWORD, // enum, interface, extends, implements
        AL_ONLY_ACCESS_MODIFIER, // internal, protected, public
        TERNARY_OPERATOR, // ?
        PREPROCESSOR_DIRECTIVE, // #if, #endif

        // Special
        UNKNOWN,
        EOF, // End of input
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Number of source characters covered by this token.
     */
    public int length() {
        return endOffset - startOffset;
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + line + ":" + column;
    }
}
