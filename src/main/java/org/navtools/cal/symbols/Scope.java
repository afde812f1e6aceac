package org.navtools.cal.symbols;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A lexical scope in the {@link SymbolTable} arena. Scopes refer to their parent by id, so the
 * arena owns every scope and no scope owns another.
 */
public final class Scope {

    public static final int NO_PARENT = -1;

    private final int id;
    private final int parentId;
    private final int startOffset;
    private final int endOffset;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(int id, int parentId, int startOffset, int endOffset) {
        this.id = id;
        this.parentId = parentId;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public int id() {
        return id;
    }

    public int parentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    public int startOffset() {
        return startOffset;
    }

    public int endOffset() {
        return endOffset;
    }

    public boolean contains(int offset) {
        return offset >= startOffset && offset <= endOffset;
    }

    /**
     * Adds a symbol unless the scope already declares the name.
     *
     * @return false if an earlier declaration was kept
     */
    boolean declare(Symbol symbol) {
        return symbols.putIfAbsent(key(symbol.name()), symbol) == null;
    }

    /**
     * Case-insensitive lookup in this scope only.
     */
    public Symbol lookupLocal(String name) {
        return symbols.get(key(name));
    }

    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Scope#" + id + "[" + startOffset + ".." + endOffset + ", " + symbols.size() + " symbols]";
    }
}
