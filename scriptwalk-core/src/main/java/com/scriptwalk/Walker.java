package com.scriptwalk;

import com.scriptwalk.ast.Node;

import java.util.Objects;

/**
 * Recursive {@link TreeWalker}.
 *
 * <p>For each present node the walker calls {@code visitor.enter(node)}. If that returns a
 * visitor {@code w}, every child slot is walked with {@code w} in walk-table order, then
 * {@code w.exit(node)} is called unless the node is of a leaf kind. Absent nodes produce no
 * calls.</p>
 *
 * <p>Recursion depth follows tree depth. Very deeply nested input can exhaust the call
 * stack; use {@link IterativeWalker} for such trees.</p>
 */
public final class Walker implements TreeWalker {

    private static final Walker STANDARD = new Walker(WalkTable.standard());

    private final WalkTable table;

    public Walker(WalkTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Returns a walker over {@link WalkTable#standard()}.
     */
    public static Walker standard() {
        return STANDARD;
    }

    /**
     * Walks {@code node} with the standard walker.
     */
    public static void walkTree(Visitor visitor, Node node) {
        STANDARD.walk(visitor, node);
    }

    @Override
    public void walk(Visitor visitor, Node node) {
        Objects.requireNonNull(visitor, "visitor");
        if (node == null) {
            return;
        }
        Visitor inner = visitor.enter(node);
        if (inner == null) {
            return;
        }
        ChildEnumerator<Node> enumerator = table.enumeratorFor(node);
        if (WalkTable.isLeaf(enumerator)) {
            return;
        }
        enumerator.forEachChild(node, child -> walk(inner, child));
        inner.exit(node);
    }

    public WalkTable getTable() {
        return table;
    }
}
