package com.scriptwalk;

import com.scriptwalk.ast.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * {@link TreeWalker} that keeps its pending work on a heap-allocated stack instead of the
 * call stack.
 *
 * <p>Produces exactly the same sequence of enter and exit calls as {@link Walker} for the
 * same table, tree and visitor.</p>
 */
public final class IterativeWalker implements TreeWalker {

    private static final IterativeWalker STANDARD = new IterativeWalker(WalkTable.standard());

    private final WalkTable table;

    public IterativeWalker(WalkTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public static IterativeWalker standard() {
        return STANDARD;
    }

    @Override
    public void walk(Visitor visitor, Node node) {
        Objects.requireNonNull(visitor, "visitor");
        if (node == null) {
            return;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node, visitor, false));
        List<Node> children = new ArrayList<>();

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.exit()) {
                frame.visitor().exit(frame.node());
                continue;
            }

            Visitor inner = frame.visitor().enter(frame.node());
            if (inner == null) {
                continue;
            }
            ChildEnumerator<Node> enumerator = table.enumeratorFor(frame.node());
            if (WalkTable.isLeaf(enumerator)) {
                continue;
            }
            stack.push(new Frame(frame.node(), inner, true));

            children.clear();
            enumerator.forEachChild(frame.node(), child -> {
                if (child != null) {
                    children.add(child);
                }
            });
            // Pushed last-to-first so the first child is popped first
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), inner, false));
            }
        }
    }

    public WalkTable getTable() {
        return table;
    }

    private record Frame(Node node, Visitor visitor, boolean exit) {}
}
