package org.navtools.cal.dsl;

/**
 * Stable diagnostic codes attached to every {@link ParseError}.
 */
public enum ParseErrorCode {
    EXPECTED_TOKEN("parse-expected-token"), // a required token was missing or wrong
    UNCLOSED_BLOCK("parse-unclosed-block"), // a closing delimiter or END was never found
    ERROR_RECOVERY("parse-error-recovery"), // informational, tokens were skipped
    AL_ONLY_SYNTAX("parse-al-only-syntax"), // AL dialect feature in C/AL source
    PROPERTY_VALUE("parse-property-value"), // CalcFormula or TableRelation value did not parse
    GENERIC("parse-error");

    private final String tag;

    ParseErrorCode(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ParseErrorCode fromTag(String tag) {
        for (ParseErrorCode code : values()) {
            if (code.tag.equals(tag)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown parse error code: " + tag);
    }
}
