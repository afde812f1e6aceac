package org.navtools.cal.lsp;

import org.junit.jupiter.api.Test;
import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.symbols.SymbolKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalFrontEndTest {

    static final String CODEUNIT = """
            OBJECT Codeunit 50100 Greeter
            {
              CODE
              {
                VAR
                  Greeting@1000 : Text[30];

                PROCEDURE Greet@1(Name@1000 : Text[30]);
                BEGIN
                  Greeting := 'Hello ' + Name;
                  MESSAGE(Greeting);
                END;

                BEGIN
                END.
              }
            }
            """;

    static final String FLOW_FIELD_TABLE = """
            OBJECT Table 50100 Totals
            {
              FIELDS
              {
                { 1   ;   ;Total               ;Decimal       ;CalcFormula=Sum(Entry.Amount) }
              }
            }
            """;

    private final CalFrontEnd frontEnd = new CalFrontEnd(CalSettings.defaults());

    @Test
    void parsesCleanDocument() {
        ParsedDocument parsed = frontEnd.parse(CODEUNIT);
        assertFalse(parsed.hasErrors());
        assertEquals(TokenType.EOF, parsed.tokens().get(parsed.tokens().size() - 1).type());
        assertEquals("Greeter", parsed.document().object().objectName());
        assertEquals(SymbolKind.PROCEDURE, parsed.symbols().getSymbol("greet").kind());
        assertTrue(frontEnd.diagnostics(parsed).isEmpty());
    }

    @Test
    void reportsDiagnosticsForBrokenDocument() {
        ParsedDocument parsed = frontEnd.parse(CODEUNIT.replace("'Hello ' + Name", ""));
        assertTrue(parsed.hasErrors());
        List<Diagnostic> diagnostics = frontEnd.diagnostics(parsed);
        assertFalse(diagnostics.isEmpty());
        assertTrue(diagnostics.stream().allMatch(d -> d.source().equals("cal")));
        assertTrue(diagnostics.stream().allMatch(d -> d.range().startLine() >= 0));
        assertEquals(SymbolKind.PROCEDURE, parsed.symbols().getSymbol("Greet").kind());
    }

    @Test
    void propertyValueParsingFollowsSettings() {
        var property = frontEnd.parse(FLOW_FIELD_TABLE).document().object().fields().fields().get(0)
                .properties().get(0);
        assertEquals("Entry", property.calcFormula().sourceTable());

        var raw = new CalFrontEnd(new CalSettings(false, true, 1000, "cal"));
        var rawProperty = raw.parse(FLOW_FIELD_TABLE).document().object().fields().fields().get(0)
                .properties().get(0);
        assertNull(rawProperty.calcFormula());
        assertEquals("Sum(Entry.Amount)", rawProperty.value());
    }

    @Test
    void parsedDocumentIsImmutable() {
        ParsedDocument parsed = frontEnd.parse(CODEUNIT);
        assertThrows(UnsupportedOperationException.class, () -> parsed.tokens().clear());
        assertThrows(UnsupportedOperationException.class, () -> parsed.errors().clear());
    }

    @Test
    void nullTextIsRejected() {
        assertThrows(NullPointerException.class, () -> frontEnd.parse(null));
    }
}
