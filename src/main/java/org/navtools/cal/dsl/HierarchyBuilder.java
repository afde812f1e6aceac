package org.navtools.cal.dsl;

import org.navtools.cal.dsl.ast.IndentedItem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds the tree of an indent-encoded section (actions, controls, XMLport elements).
 *
 * Each item becomes a child of the closest preceding item with a smaller indent level;
 * items with no such predecessor are roots. Negative levels count as 0. Order is preserved at
 * every level.
 */
public final class HierarchyBuilder {

    private HierarchyBuilder() {
        // Static utility class
    }

    /**
     * Attaches each item to its parent's {@code nested()} list and returns the roots.
     *
     * @param flat items in source order; their {@code nested()} lists must be mutable and empty
     */
    public static <T extends IndentedItem<T>> List<T> build(List<T> flat) {
        List<T> roots = new ArrayList<>();
        Deque<T> stack = new ArrayDeque<>();
        for (T item : flat) {
            while (!stack.isEmpty() && level(stack.peek()) >= level(item)) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                roots.add(item);
            } else {
                stack.peek().nested().add(item);
            }
            stack.push(item);
        }
        return roots;
    }

    private static int level(IndentedItem<?> item) {
        return Math.max(0, item.indentLevel());
    }
}
