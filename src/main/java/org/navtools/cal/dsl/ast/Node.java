package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Common shape of every AST node: the first and last token of its source span.
 *
 * For every node {@code startToken().startOffset() <= endToken().endOffset()}, and the span
 * of a node contains the spans of all of its {@link #children()}.
 */
public interface Node {

    Token startToken();

    Token endToken();

    /**
     * Direct child nodes in source order.
     */
    default List<Node> children() {
        return List.of();
    }

    default int startOffset() {
        return startToken().startOffset();
    }

    default int endOffset() {
        return endToken().endOffset();
    }

    default boolean contains(int offset) {
        return offset >= startOffset() && offset <= endOffset();
    }

    /**
     * Collects nodes and node collections into a child list, skipping nulls.
     */
    static List<Node> collect(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object item : collection) {
                    if (item instanceof Node node) {
                        result.add(node);
                    }
                }
            }
        }
        return result;
    }
}
