package com.scriptwalk;

import com.scriptwalk.ast.Node;

import java.util.function.Consumer;

/**
 * Feeds the child slots of one node variant to a consumer, in walk order.
 *
 * <p>Absent slots may be passed through as {@code null}; walkers skip them.</p>
 *
 * @param <T> the node variant
 */
@FunctionalInterface
public interface ChildEnumerator<T extends Node> {

    void forEachChild(T node, Consumer<? super Node> action);
}
