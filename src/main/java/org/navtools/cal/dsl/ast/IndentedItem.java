package org.navtools.cal.dsl.ast;

import java.util.List;

/**
 * A flat section item whose nesting is given by an indent level.
 * {@link #nested()} starts empty and is filled by {@link org.navtools.cal.dsl.HierarchyBuilder}.
 */
public interface IndentedItem<T extends IndentedItem<T>> extends Node {

    int indentLevel();

    /**
     * Mutable list of nested items.
     */
    List<T> nested();
}
