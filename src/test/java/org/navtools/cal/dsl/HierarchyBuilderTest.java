package org.navtools.cal.dsl;

import org.junit.jupiter.api.Test;
import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.dsl.ast.ActionDeclaration;
import org.navtools.cal.dsl.ast.ActionType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyBuilderTest {

    private static final Token TOKEN = new Token(TokenType.LBRACE, "{", 1, 1, 0, 1);

    private static List<ActionDeclaration> flat(int... indents) {
        List<ActionDeclaration> items = new ArrayList<>();
        for (int i = 0; i < indents.length; i++) {
            items.add(new ActionDeclaration(i + 1, indents[i], ActionType.ACTION, null, List.of(), List.of(),
                    new ArrayList<>(), TOKEN, TOKEN));
        }
        return items;
    }

    private static List<Integer> ids(List<ActionDeclaration> items) {
        return items.stream().map(ActionDeclaration::id).collect(Collectors.toList());
    }

    @Test
    void emptyInput() {
        assertTrue(HierarchyBuilder.build(List.<ActionDeclaration>of()).isEmpty());
    }

    @Test
    void nestsUnderClosestShallowerItem() {
        List<ActionDeclaration> roots = HierarchyBuilder.build(flat(0, 1, 2, 1, 0));
        assertEquals(List.of(1, 5), ids(roots));
        ActionDeclaration first = roots.get(0);
        assertEquals(List.of(2, 4), ids(first.nested()));
        assertEquals(List.of(3), ids(first.nested().get(0).nested()));
        assertTrue(roots.get(1).nested().isEmpty());
    }

    @Test
    void skippedLevelsAttachToNearestAncestor() {
        List<ActionDeclaration> roots = HierarchyBuilder.build(flat(0, 3, 1));
        assertEquals(List.of(1), ids(roots));
        assertEquals(List.of(2, 3), ids(roots.get(0).nested()));
    }

    @Test
    void leadingIndentedItemIsRoot() {
        List<ActionDeclaration> roots = HierarchyBuilder.build(flat(2, 2, 0));
        assertEquals(List.of(1, 2, 3), ids(roots));
    }

    @Test
    void siblingsKeepSourceOrder() {
        List<ActionDeclaration> roots = HierarchyBuilder.build(flat(0, 1, 1, 1));
        assertEquals(List.of(2, 3, 4), ids(roots.get(0).nested()));
    }

    @Test
    void negativeIndentCountsAsZero() {
        List<ActionDeclaration> roots = HierarchyBuilder.build(flat(-1, 0, 1));
        assertEquals(List.of(1, 2), ids(roots));
        assertTrue(roots.get(0).nested().isEmpty());
        assertEquals(List.of(3), ids(roots.get(1).nested()));
    }
}
