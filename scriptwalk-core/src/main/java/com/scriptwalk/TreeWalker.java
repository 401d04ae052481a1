package com.scriptwalk;

import com.scriptwalk.ast.Node;

/**
 * Depth-first traversal of a script AST.
 *
 * <p>Implementations visit children in the order fixed by their {@link WalkTable} and must
 * produce the same sequence of {@link Visitor#enter(Node)} and {@link Visitor#exit(Node)}
 * calls for the same tree and visitor.</p>
 */
public interface TreeWalker {

    /**
     * Walks {@code node} and its descendants with {@code visitor}. A {@code null} node is a no-op.
     *
     * @throws UnknownNodeError if a node reached has no entry in the walk table
     */
    void walk(Visitor visitor, Node node);
}
