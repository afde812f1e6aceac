package org.navtools.cal.dsl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class MessageSanitizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Cannot open /home/user/objects/cust.txt|Cannot open <path>",
            "Cannot open C:\\NAV\\objects\\cust.txt now|Cannot open <path> now",
            "See file:///tmp/objects/cust.txt|See <path>",
            "Expected ; after a/b|Expected ; after a/b",
            "Ratio 1/2 is fine|Ratio 1/2 is fine",
            "Lone / stays|Lone / stays"
    })
    void stripsAbsolutePaths(String input, String expected) {
        assertEquals(expected, MessageSanitizer.stripPaths(input));
    }

    @Test
    void nullAndEmptyPassThrough() {
        assertNull(MessageSanitizer.stripPaths(null));
        assertEquals("", MessageSanitizer.stripPaths(""));
    }

    @Test
    void parseErrorsAreSanitized() {
        ParseError error = new ParseError("Bad include /etc/nav/objects.txt", null);
        assertEquals("Bad include <path>", error.getRawMessage());
        assertEquals("Bad include <path>", error.getMessage());
    }
}
