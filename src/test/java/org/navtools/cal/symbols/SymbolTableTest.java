package org.navtools.cal.symbols;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.navtools.cal.dsl.CalParser;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    private static final String LEDGER = """
            OBJECT Table 50000 Ledger
            {
              PROPERTIES
              {
                OnInsert=VAR
                           Counter@1000 : Integer;
                         BEGIN
                           Counter := 1;
                         END;

              }
              FIELDS
              {
                { 1   ;   ;Entry No.           ;Integer        }
                { 2   ;   ;Amount              ;Decimal        }
              }
              CODE
              {
                VAR
                  Total@1000 : Decimal;
                  TOTAL@1001 : Integer;

                PROCEDURE Post@1(Amount@1000 : Decimal) : Boolean;
                VAR
                  Buffer@1001 : Decimal;
                BEGIN
                  Total := Amount + Buffer;
                END;

                PROCEDURE Reset@2();
                BEGIN
                  Total := 0;
                END;

                BEGIN
                END.
              }
            }
            """;

    private SymbolTable table;

    @BeforeEach
    void setUp() {
        table = SymbolTable.buildFromAst(CalParser.parseSource(LEDGER));
    }

    private static int offsetOf(String text) {
        int offset = LEDGER.indexOf(text);
        assertTrue(offset >= 0, text);
        return offset;
    }

    private static List<String> names(List<Symbol> symbols) {
        return symbols.stream().map(Symbol::name).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Scopes")
    class ScopeTests {

        @Test
        void rootHoldsFieldsGlobalsAndProcedures() {
            assertEquals(List.of("Entry No.", "Amount", "Total", "Post", "Reset"),
                    names(List.copyOf(table.getRootScope().symbols())));
        }

        @Test
        void procedureAndTriggerScopes() {
            // OnInsert (has VAR), Post, Reset
            assertEquals(4, table.getScopes().size());
            for (Scope scope : table.getScopes()) {
                if (!scope.isRoot()) {
                    assertSame(table.getRootScope(), table.getParent(scope));
                }
            }
            assertNull(table.getParent(table.getRootScope()));
        }

        @Test
        void scopeAtOffsetIsInnermost() {
            Scope trigger = table.getScopeAtOffset(offsetOf("Counter := 1"));
            assertFalse(trigger.isRoot());
            assertNotNull(trigger.lookupLocal("Counter"));

            Scope post = table.getScopeAtOffset(offsetOf("Amount + Buffer"));
            assertNotNull(post.lookupLocal("buffer"));

            assertTrue(table.getScopeAtOffset(0).isRoot());
        }
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        void firstDeclarationWins() {
            Symbol total = table.getSymbol("TOTAL");
            assertEquals("Total", total.name());
            assertEquals(SymbolKind.VARIABLE, total.kind());
            assertEquals("Decimal", total.type());
        }

        @Test
        void rootIsSearchedFirst() {
            assertEquals(SymbolKind.FIELD, table.getSymbol("amount").kind());
        }

        @Test
        void offsetLookupPrefersInnerScope() {
            assertEquals(SymbolKind.PARAMETER, table.getSymbolAtOffset("Amount", offsetOf("Amount + Buffer")).kind());
            assertEquals(SymbolKind.FIELD, table.getSymbolAtOffset("Amount", offsetOf("Total := 0")).kind());
            assertNull(table.getSymbolAtOffset("Buffer", offsetOf("Total := 0")));
        }

        @Test
        void procedureSymbolCarriesReturnType() {
            Symbol post = table.findSymbol("post").orElseThrow();
            assertEquals(SymbolKind.PROCEDURE, post.kind());
            assertEquals("Boolean", post.type());
            assertEquals("Post".length(), post.length());
        }

        @Test
        void hasSymbolSearchesEveryScope() {
            assertTrue(table.hasSymbol("BUFFER"));
            assertTrue(table.hasSymbol("counter"));
            assertFalse(table.hasSymbol("Missing"));
            assertTrue(table.findSymbol("Missing").isEmpty());
        }

        @Test
        void visibleSymbolsNearestFirst() {
            Scope post = table.getScopeAtOffset(offsetOf("Amount + Buffer"));
            List<Symbol> visible = table.getVisibleSymbols(post);
            assertEquals(List.of("Amount", "Buffer", "Entry No.", "Total", "Post", "Reset"), names(visible));
            assertEquals(SymbolKind.PARAMETER, visible.get(0).kind());
        }

        @Test
        void allSymbolsSkipDuplicates() {
            assertEquals(8, table.getAllSymbols().size());
        }
    }

    @Test
    void emptyDocumentHasOnlyRoot() {
        SymbolTable empty = SymbolTable.buildFromAst(CalParser.parseSource(""));
        assertEquals(1, empty.getScopes().size());
        assertTrue(empty.getAllSymbols().isEmpty());
        assertNull(empty.getSymbol("x"));
    }

    @Test
    void nullDocumentIsRejected() {
        assertThrows(NullPointerException.class, () -> SymbolTable.buildFromAst(null));
    }
}
