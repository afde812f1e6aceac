package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Case-insensitive keyword tables shared by the lexer and the parser.
 */
public final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
    private static final Map<String, TokenType> AL_ONLY = new HashMap<>();

    static {
        // Object kinds
        KEYWORDS.put("object", TokenType.OBJECT);
        KEYWORDS.put("table", TokenType.TABLE);
        KEYWORDS.put("page", TokenType.PAGE);
        KEYWORDS.put("report", TokenType.REPORT);
        KEYWORDS.put("codeunit", TokenType.CODEUNIT);
        KEYWORDS.put("query", TokenType.QUERY);
        KEYWORDS.put("xmlport", TokenType.XMLPORT);
        KEYWORDS.put("menusuite", TokenType.MENUSUITE);

        // Sections
        KEYWORDS.put("properties", TokenType.PROPERTIES);
        KEYWORDS.put("fields", TokenType.FIELDS);
        KEYWORDS.put("keys", TokenType.KEYS);
        KEYWORDS.put("fieldgroups", TokenType.FIELDGROUPS);
        KEYWORDS.put("code", TokenType.CODE);
        KEYWORDS.put("controls", TokenType.CONTROLS);
        KEYWORDS.put("actions", TokenType.ACTIONS);
        KEYWORDS.put("dataitems", TokenType.DATAITEMS);
        KEYWORDS.put("dataset", TokenType.DATASET);
        KEYWORDS.put("requestpage", TokenType.REQUESTPAGE);
        KEYWORDS.put("labels", TokenType.LABELS);
        KEYWORDS.put("menunodes", TokenType.MENUNODES);
        KEYWORDS.put("elements", TokenType.ELEMENTS);
        KEYWORDS.put("requestform", TokenType.REQUESTFORM);
        KEYWORDS.put("sections", TokenType.SECTIONS);

        // Data types
        KEYWORDS.put("boolean", TokenType.BOOLEAN);
        KEYWORDS.put("integer", TokenType.INTEGER_TYPE);
        KEYWORDS.put("decimal", TokenType.DECIMAL_TYPE);
        KEYWORDS.put("text", TokenType.TEXT);
        KEYWORDS.put("date", TokenType.DATE_TYPE);
        KEYWORDS.put("time", TokenType.TIME_TYPE);
        KEYWORDS.put("datetime", TokenType.DATETIME_TYPE);
        KEYWORDS.put("record", TokenType.RECORD);
        KEYWORDS.put("recordid", TokenType.RECORDID);
        KEYWORDS.put("recordref", TokenType.RECORDREF);
        KEYWORDS.put("fieldref", TokenType.FIELDREF);
        KEYWORDS.put("biginteger", TokenType.BIGINTEGER);
        KEYWORDS.put("bigtext", TokenType.BIGTEXT);
        KEYWORDS.put("blob", TokenType.BLOB);
        KEYWORDS.put("guid", TokenType.GUID);
        KEYWORDS.put("duration", TokenType.DURATION);
        KEYWORDS.put("option", TokenType.OPTION);
        KEYWORDS.put("char", TokenType.CHAR);
        KEYWORDS.put("byte", TokenType.BYTE);
        KEYWORDS.put("textconst", TokenType.TEXTCONST);

        // Control flow
        KEYWORDS.put("if", TokenType.IF);
        KEYWORDS.put("then", TokenType.THEN);
        KEYWORDS.put("else", TokenType.ELSE);
        KEYWORDS.put("case", TokenType.CASE);
        KEYWORDS.put("of", TokenType.OF);
        KEYWORDS.put("while", TokenType.WHILE);
        KEYWORDS.put("do", TokenType.DO);
        KEYWORDS.put("repeat", TokenType.REPEAT);
        KEYWORDS.put("until", TokenType.UNTIL);
        KEYWORDS.put("for", TokenType.FOR);
        KEYWORDS.put("to", TokenType.TO);
        KEYWORDS.put("downto", TokenType.DOWNTO);
        KEYWORDS.put("exit", TokenType.EXIT);
        KEYWORDS.put("break", TokenType.BREAK);
        KEYWORDS.put("with", TokenType.WITH);

        // Declarations
        KEYWORDS.put("procedure", TokenType.PROCEDURE);
        KEYWORDS.put("function", TokenType.FUNCTION);
        KEYWORDS.put("local", TokenType.LOCAL);
        KEYWORDS.put("var", TokenType.VAR);
        KEYWORDS.put("trigger", TokenType.TRIGGER);
        KEYWORDS.put("event", TokenType.EVENT);
        KEYWORDS.put("begin", TokenType.BEGIN);
        KEYWORDS.put("end", TokenType.END);

        // Word operators and modifiers
        KEYWORDS.put("true", TokenType.TRUE);
        KEYWORDS.put("false", TokenType.FALSE);
        KEYWORDS.put("div", TokenType.DIV);
        KEYWORDS.put("mod", TokenType.MOD);
        KEYWORDS.put("and", TokenType.AND);
        KEYWORDS.put("or", TokenType.OR);
        KEYWORDS.put("not", TokenType.NOT);
        KEYWORDS.put("xor", TokenType.XOR);
        KEYWORDS.put("in", TokenType.IN);
        KEYWORDS.put("array", TokenType.ARRAY);
        KEYWORDS.put("temporary", TokenType.TEMPORARY);
        KEYWORDS.put("indataset", TokenType.INDATASET);
        KEYWORDS.put("runonclient", TokenType.RUNONCLIENT);
        KEYWORDS.put("withevents", TokenType.WITHEVENTS);
        KEYWORDS.put("securityfiltering", TokenType.SECURITYFILTERING);

        AL_ONLY.put("enum", TokenType.AL_ONLY_KEYWORD);
        AL_ONLY.put("interface", TokenType.AL_ONLY_KEYWORD);
        AL_ONLY.put("extends", TokenType.AL_ONLY_KEYWORD);
        AL_ONLY.put("implements", TokenType.AL_ONLY_KEYWORD);
        AL_ONLY.put("internal", TokenType.AL_ONLY_ACCESS_MODIFIER);
        AL_ONLY.put("protected", TokenType.AL_ONLY_ACCESS_MODIFIER);
        AL_ONLY.put("public", TokenType.AL_ONLY_ACCESS_MODIFIER);
    }

    public static final Set<TokenType> OBJECT_KINDS = EnumSet.of(
            TokenType.TABLE, TokenType.PAGE, TokenType.REPORT, TokenType.CODEUNIT,
            TokenType.QUERY, TokenType.XMLPORT, TokenType.MENUSUITE);

    public static final Set<TokenType> SECTION_KEYWORDS = EnumSet.of(
            TokenType.PROPERTIES, TokenType.FIELDS, TokenType.KEYS, TokenType.FIELDGROUPS,
            TokenType.CODE, TokenType.CONTROLS, TokenType.ACTIONS, TokenType.DATAITEMS,
            TokenType.DATASET, TokenType.REQUESTPAGE, TokenType.LABELS, TokenType.MENUNODES,
            TokenType.ELEMENTS, TokenType.REQUESTFORM, TokenType.SECTIONS);

    public static final Set<TokenType> DATA_TYPES = EnumSet.of(
            TokenType.BOOLEAN, TokenType.INTEGER_TYPE, TokenType.DECIMAL_TYPE, TokenType.TEXT,
            TokenType.CODE_TYPE, TokenType.DATE_TYPE, TokenType.TIME_TYPE, TokenType.DATETIME_TYPE,
            TokenType.RECORD, TokenType.RECORDID, TokenType.RECORDREF, TokenType.FIELDREF,
            TokenType.BIGINTEGER, TokenType.BIGTEXT, TokenType.BLOB, TokenType.GUID,
            TokenType.DURATION, TokenType.OPTION, TokenType.CHAR, TokenType.BYTE, TokenType.TEXTCONST);

    private Keywords() {
    }

    /**
     * Looks up a word, returning {@code IDENTIFIER} when it is not a keyword.
     */
    public static TokenType lookup(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        TokenType alOnly = AL_ONLY.get(lower);
        if (alOnly != null) {
            return alOnly;
        }
        return KEYWORDS.getOrDefault(lower, TokenType.IDENTIFIER);
    }

    public static boolean isKeyword(TokenType type) {
        return KEYWORDS.containsValue(type);
    }
}
