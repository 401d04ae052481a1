package com.scriptwalk;

import com.scriptwalk.ast.Node;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Callback driven by a {@link TreeWalker}.
 *
 * <p>{@link #enter(Node)} is invoked for every present node reached. If it returns a visitor,
 * the node's children are walked with that visitor, followed by a call to {@link #exit(Node)}
 * on it. Leaf kinds, which have no child slots, get no exit call. Returning {@code null} prunes
 * the subtree: no children are walked and no exit call is made for the node.</p>
 *
 * <p>Example, counting the depth of the deepest node:</p>
 * <pre>{@code
 * class Depth implements Visitor {
 *     int depth, max;
 *     public Visitor enter(Node node) {
 *         max = Math.max(max, depth + 1);
 *         if (!WalkTable.standard().isLeaf(node.getClass())) {
 *             depth++;
 *         }
 *         return this;
 *     }
 *     public void exit(Node node) {
 *         depth--;
 *     }
 * }
 * }</pre>
 */
@FunctionalInterface
public interface Visitor {

    /**
     * Invoked before the children of {@code node} are walked. Never called with {@code null}.
     *
     * @param node the node being entered
     * @return the visitor for the node's children, or {@code null} to skip them
     */
    Visitor enter(Node node);

    /**
     * Invoked on the visitor returned by {@link #enter(Node)} once all children of
     * {@code node} have been walked. Not called for leaf kinds (see {@link WalkTable#isLeaf(Class)}).
     *
     * @param node the node being left
     */
    default void exit(Node node) {
    }

    /**
     * Returns a stateless visitor that descends into a node only while {@code inspector}
     * returns true for it.
     */
    static Visitor of(Predicate<? super Node> inspector) {
        return new InspectingVisitor(Objects.requireNonNull(inspector, "inspector"));
    }

    final class InspectingVisitor implements Visitor {
        private final Predicate<? super Node> inspector;

        private InspectingVisitor(Predicate<? super Node> inspector) {
            this.inspector = inspector;
        }

        @Override
        public Visitor enter(Node node) {
            return inspector.test(node) ? this : null;
        }
    }
}
