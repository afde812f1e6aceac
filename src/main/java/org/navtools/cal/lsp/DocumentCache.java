package org.navtools.cal.lsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One parse result per open document URI.
 *
 * Every update reparses the full text; there is no incremental reparse. The parse completes before
 * the new result is published, so readers never see a partially built document.
 */
public final class DocumentCache {

    private static final Logger logger = LoggerFactory.getLogger(DocumentCache.class);

    private final CalFrontEnd frontEnd;
    private final Map<String, ParsedDocument> documents = new ConcurrentHashMap<>();

    public DocumentCache(CalFrontEnd frontEnd) {
        this.frontEnd = Objects.requireNonNull(frontEnd, "frontEnd");
    }

    /**
     * Parses the text and replaces whatever was cached for the URI.
     */
    public ParsedDocument update(String uri, String text) {
        Objects.requireNonNull(uri, "uri");
        ParsedDocument parsed = frontEnd.parse(text);
        documents.put(uri, parsed);
        logger.debug("Cached {} ({} error(s))", uri, parsed.errors().size());
        return parsed;
    }

    public Optional<ParsedDocument> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public boolean remove(String uri) {
        boolean removed = documents.remove(uri) != null;
        if (removed) {
            logger.debug("Evicted {}", uri);
        }
        return removed;
    }

    public int size() {
        return documents.size();
    }
}
