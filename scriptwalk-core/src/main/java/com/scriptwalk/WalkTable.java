package com.scriptwalk;

import com.scriptwalk.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Maps every node variant to its child slots, in the order a walk visits them.
 *
 * <p>The order of each entry follows source evaluation order and is part of the public
 * contract: scope and ordering-sensitive visitors depend on it. A walk that reaches a node
 * class with no entry fails with {@link UnknownNodeError}.</p>
 *
 * <p>Kinds registered without child slots (identifiers, literals and the like) are leaf kinds.
 * A walk gives them no exit call.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class WalkTable {

    private static final Logger logger = LoggerFactory.getLogger(WalkTable.class);

    private static final ChildEnumerator<Node> LEAF = (node, action) -> {
    };

    private static final WalkTable STANDARD = new WalkTable(standardEntries());

    private final Map<Class<? extends Node>, ChildEnumerator<?>> entries;

    private WalkTable(Map<Class<? extends Node>, ChildEnumerator<?>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Returns the table covering every production of the node model.
     */
    public static WalkTable standard() {
        return STANDARD;
    }

    /**
     * Returns a copy of this table with {@code type} unregistered.
     */
    public WalkTable without(Class<? extends Node> type) {
        Map<Class<? extends Node>, ChildEnumerator<?>> copy = new LinkedHashMap<>(entries);
        copy.remove(type);
        return new WalkTable(copy);
    }

    /**
     * Returns a copy of this table with {@code type} mapped to {@code enumerator},
     * replacing any existing entry.
     */
    public <T extends Node> WalkTable with(Class<T> type, ChildEnumerator<T> enumerator) {
        Map<Class<? extends Node>, ChildEnumerator<?>> copy = new LinkedHashMap<>(entries);
        register(copy, type, enumerator);
        return new WalkTable(copy);
    }

    public Set<Class<? extends Node>> registeredTypes() {
        return entries.keySet();
    }

    public boolean isRegistered(Class<? extends Node> type) {
        return entries.containsKey(type);
    }

    /**
     * Returns true if {@code type} is registered as a kind with no child slots. Entries added
     * through {@link #with(Class, ChildEnumerator)} are never leaf kinds.
     */
    public boolean isLeaf(Class<? extends Node> type) {
        return isLeaf(entries.get(type));
    }

    static boolean isLeaf(ChildEnumerator<?> enumerator) {
        return enumerator == LEAF;
    }

    /**
     * Looks up the enumerator for {@code node}'s concrete class.
     *
     * @throws UnknownNodeError if the class is not registered
     */
    @SuppressWarnings("unchecked")
    ChildEnumerator<Node> enumeratorFor(Node node) {
        ChildEnumerator<?> enumerator = entries.get(node.getClass());
        if (enumerator == null) {
            logger.error("No walk table entry for node type {} ({})", node.type(), node.getClass().getName());
            throw new UnknownNodeError(node.getClass());
        }
        return (ChildEnumerator<Node>) enumerator;
    }

    /**
     * Passes each child slot of {@code node} to {@code action} in walk order, absent slots
     * included as {@code null}.
     *
     * @throws UnknownNodeError if the node's class is not registered
     */
    public void forEachChild(Node node, Consumer<? super Node> action) {
        enumeratorFor(node).forEachChild(node, action);
    }

    /**
     * Returns the present children of {@code node} in walk order.
     *
     * @throws UnknownNodeError if the node's class is not registered
     */
    public List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        forEachChild(node, child -> {
            if (child != null) {
                children.add(child);
            }
        });
        return Collections.unmodifiableList(children);
    }

    private static <T extends Node> void register(Map<Class<? extends Node>, ChildEnumerator<?>> entries,
                                                  Class<T> type,
                                                  ChildEnumerator<T> enumerator) {
        entries.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(enumerator, "enumerator"));
    }

    // A null list is treated like an empty one
    private static void each(List<? extends Node> nodes, Consumer<? super Node> action) {
        if (nodes != null) {
            nodes.forEach(action);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Node> ChildEnumerator<T> leaf() {
        return (ChildEnumerator<T>) (ChildEnumerator<?>) LEAF;
    }

    // ========================================================================
    // Standard table: one entry per production, children in evaluation order
    // ========================================================================

    private static Map<Class<? extends Node>, ChildEnumerator<?>> standardEntries() {
        Map<Class<? extends Node>, ChildEnumerator<?>> t = new LinkedHashMap<>();

        register(t, Program.class, (n, a) -> each(n.body(), a));

        // Expressions
        register(t, ArrayLiteral.class, (n, a) -> each(n.value(), a));
        register(t, AssignExpression.class, (n, a) -> {
            a.accept(n.left());
            a.accept(n.right());
        });
        register(t, BadExpression.class, leaf());
        register(t, BinaryExpression.class, (n, a) -> {
            a.accept(n.left());
            a.accept(n.right());
        });
        register(t, BooleanLiteral.class, leaf());
        register(t, BracketExpression.class, (n, a) -> {
            a.accept(n.left());
            a.accept(n.member());
        });
        register(t, CallExpression.class, (n, a) -> {
            a.accept(n.callee());
            each(n.argumentList(), a);
        });
        register(t, ConditionalExpression.class, (n, a) -> {
            a.accept(n.test());
            a.accept(n.consequent());
            a.accept(n.alternate());
        });
        // identifier is a plain name
        register(t, DotExpression.class, (n, a) -> a.accept(n.left()));
        register(t, EmptyExpression.class, leaf());
        register(t, FunctionLiteral.class, (n, a) -> {
            a.accept(n.name());
            each(n.parameterList(), a);
            a.accept(n.body());
        });
        register(t, Identifier.class, leaf());
        register(t, NewExpression.class, (n, a) -> {
            a.accept(n.callee());
            each(n.argumentList(), a);
        });
        register(t, NullLiteral.class, leaf());
        register(t, NumberLiteral.class, leaf());
        register(t, ObjectLiteral.class, (n, a) -> {
            if (n.value() != null) {
                for (Property property : n.value()) {
                    a.accept(property == null ? null : property.value());
                }
            }
        });
        register(t, RegExpLiteral.class, leaf());
        register(t, SequenceExpression.class, (n, a) -> each(n.sequence(), a));
        register(t, StringLiteral.class, leaf());
        register(t, ThisExpression.class, leaf());
        register(t, UnaryExpression.class, (n, a) -> a.accept(n.operand()));
        register(t, VariableExpression.class, (n, a) -> a.accept(n.initializer()));

        // Statements
        register(t, BlockStatement.class, (n, a) -> each(n.list(), a));
        register(t, BranchStatement.class, (n, a) -> a.accept(n.label()));
        register(t, CaseStatement.class, (n, a) -> {
            a.accept(n.test());
            each(n.consequent(), a);
        });
        register(t, CatchStatement.class, (n, a) -> {
            a.accept(n.parameter());
            a.accept(n.body());
        });
        register(t, DebuggerStatement.class, leaf());
        register(t, DoWhileStatement.class, (n, a) -> {
            a.accept(n.test());
            a.accept(n.body());
        });
        register(t, EmptyStatement.class, leaf());
        register(t, ExpressionStatement.class, (n, a) -> a.accept(n.expression()));
        register(t, ForInStatement.class, (n, a) -> {
            a.accept(n.into());
            a.accept(n.source());
            a.accept(n.body());
        });
        register(t, ForStatement.class, (n, a) -> {
            a.accept(n.initializer());
            a.accept(n.update());
            a.accept(n.test());
            a.accept(n.body());
        });
        register(t, FunctionStatement.class, (n, a) -> a.accept(n.function()));
        register(t, IfStatement.class, (n, a) -> {
            a.accept(n.test());
            a.accept(n.consequent());
            a.accept(n.alternate());
        });
        // label is a jump target, not a reference
        register(t, LabelledStatement.class, (n, a) -> a.accept(n.statement()));
        register(t, ReturnStatement.class, (n, a) -> a.accept(n.argument()));
        register(t, SwitchStatement.class, (n, a) -> {
            a.accept(n.discriminant());
            each(n.body(), a);
        });
        register(t, ThrowStatement.class, (n, a) -> a.accept(n.argument()));
        register(t, TryStatement.class, (n, a) -> {
            a.accept(n.body());
            a.accept(n.catchClause());
            a.accept(n.finallyBlock());
        });
        register(t, VariableStatement.class, (n, a) -> each(n.list(), a));
        register(t, WhileStatement.class, (n, a) -> {
            a.accept(n.test());
            a.accept(n.body());
        });
        register(t, WithStatement.class, (n, a) -> {
            a.accept(n.object());
            a.accept(n.body());
        });

        return t;
    }
}
