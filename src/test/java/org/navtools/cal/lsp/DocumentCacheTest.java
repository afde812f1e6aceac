package org.navtools.cal.lsp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCacheTest {

    private static final String URI = "file:///objects/COD50100.TXT";

    private DocumentCache cache;

    @BeforeEach
    void setUp() {
        cache = new DocumentCache(new CalFrontEnd(CalSettings.defaults()));
    }

    @Test
    void updateStoresResult() {
        ParsedDocument parsed = cache.update(URI, CalFrontEndTest.CODEUNIT);
        assertSame(parsed, cache.get(URI).orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void updateReplacesPreviousResult() {
        cache.update(URI, CalFrontEndTest.CODEUNIT);
        ParsedDocument second = cache.update(URI, CalFrontEndTest.FLOW_FIELD_TABLE);
        assertSame(second, cache.get(URI).orElseThrow());
        assertEquals("Totals", second.document().object().objectName());
        assertEquals(1, cache.size());
    }

    @Test
    void removeEvicts() {
        cache.update(URI, CalFrontEndTest.CODEUNIT);
        assertTrue(cache.remove(URI));
        assertFalse(cache.remove(URI));
        assertTrue(cache.get(URI).isEmpty());
    }

    @Test
    void concurrentUpdatesOfDistinctDocuments() {
        IntStream.range(0, 32).parallel()
                .forEach(i -> cache.update("file:///objects/" + i + ".TXT", CalFrontEndTest.CODEUNIT));
        assertEquals(32, cache.size());
        assertFalse(cache.get("file:///objects/7.TXT").orElseThrow().hasErrors());
    }
}
