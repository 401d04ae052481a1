package com.scriptwalk;

import com.scriptwalk.ast.Node;

/**
 * Thrown when a walk reaches a node whose class is not registered in the {@link WalkTable}.
 *
 * <p>This is an {@link Error}: it means the node model and the walk table are out of step,
 * never that the input program is wrong, so callers are not expected to recover from it.</p>
 */
public class UnknownNodeError extends Error {

    private final Class<? extends Node> nodeClass;

    public UnknownNodeError(Class<? extends Node> nodeClass) {
        super("Walk: unexpected node type " + nodeClass.getName());
        this.nodeClass = nodeClass;
    }

    public Class<? extends Node> getNodeClass() {
        return nodeClass;
    }
}
