package com.scriptwalk;

import com.scriptwalk.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static com.scriptwalk.SampleTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class WalkerTest {

    @Test
    @DisplayName("Binary expression statement is entered outer to inner, left to right")
    void testBinaryExpressionOrder() {
        RecordingVisitor visitor = new RecordingVisitor();
        Walker.walkTree(visitor, onePlusTwo());

        assertEquals(List.of(
            "Program", "ExpressionStatement", "BinaryExpression", "NumberLiteral(1)", "NumberLiteral(2)"
        ), visitor.entered());

        assertEquals(List.of(
            "enter Program",
            "enter ExpressionStatement",
            "enter BinaryExpression",
            "enter NumberLiteral(1)",
            "enter NumberLiteral(2)",
            "exit BinaryExpression",
            "exit ExpressionStatement",
            "exit Program"
        ), visitor.trace());
    }

    @Test
    @DisplayName("Absent alternate of an if statement produces no calls")
    void testIfWithoutAlternate() {
        IfStatement ifStatement = new IfStatement(new BooleanLiteral("true", true), block(), null);
        RecordingVisitor visitor = new RecordingVisitor();
        Walker.walkTree(visitor, ifStatement);

        assertEquals(List.of(
            "enter IfStatement",
            "enter BooleanLiteral",
            "enter BlockStatement",
            "exit BlockStatement",
            "exit IfStatement"
        ), visitor.trace());
    }

    @Test
    void testNullRootIsNoOp() {
        RecordingVisitor visitor = new RecordingVisitor();
        Walker.walkTree(visitor, null);
        assertTrue(visitor.trace().isEmpty());
    }

    @Test
    void testNullSlotsAndElementsAreSkipped() {
        List<Expression> withHole = new ArrayList<>();
        withHole.add(num(1));
        withHole.add(null);
        withHole.add(num(3));
        Program program = new Program(List.of(
            new ReturnStatement(null),
            new BranchStatement("break", null),
            stmt(new ArrayLiteral(withHole)),
            new ForStatement(null, null, null, new EmptyStatement())
        ));

        RecordingVisitor visitor = new RecordingVisitor();
        Walker.walkTree(visitor, program);

        assertEquals(List.of(
            "Program", "ReturnStatement", "BranchStatement", "ExpressionStatement", "ArrayLiteral",
            "NumberLiteral(1)", "NumberLiteral(3)", "ForStatement", "EmptyStatement"
        ), visitor.entered());
        // leaves and the empty statement have no exit
        assertEquals(List.of(
            "exit ReturnStatement", "exit BranchStatement", "exit ArrayLiteral", "exit ExpressionStatement",
            "exit ForStatement", "exit Program"
        ), visitor.trace().stream().filter(call -> call.startsWith("exit ")).toList());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("sequencesWithHoles")
    @DisplayName("A null element in a sequence slot is skipped and its neighbours are walked")
    void testNullElementInSequence(String slot, Node node) {
        for (TreeWalker walker : List.of(Walker.standard(), IterativeWalker.standard())) {
            List<String> names = new ArrayList<>();
            walker.walk(Visitor.of(n -> {
                if (n instanceof Identifier id) {
                    names.add(id.name());
                }
                return true;
            }), node);

            assertEquals(List.of("a", "b"), names, slot);
        }
    }

    static Stream<Arguments> sequencesWithHoles() {
        return Stream.of(
            Arguments.of("Program.body", new Program(withHole(stmt(id("a")), stmt(id("b"))))),
            Arguments.of("BlockStatement.list", new BlockStatement(withHole(stmt(id("a")), stmt(id("b"))))),
            Arguments.of("VariableStatement.list", new VariableStatement(withHole(
                new VariableExpression("v", id("a")), new VariableExpression("w", id("b"))))),
            Arguments.of("ArrayLiteral.value", new ArrayLiteral(withHole(id("a"), id("b")))),
            Arguments.of("SequenceExpression.sequence", new SequenceExpression(withHole(id("a"), id("b")))),
            Arguments.of("CallExpression.argumentList",
                new CallExpression(new ThisExpression(), withHole(id("a"), id("b")))),
            Arguments.of("NewExpression.argumentList",
                new NewExpression(new ThisExpression(), withHole(id("a"), id("b")))),
            Arguments.of("FunctionLiteral.parameterList",
                new FunctionLiteral(null, withHole(id("a"), id("b")), block(), "")),
            Arguments.of("ObjectLiteral.value",
                new ObjectLiteral(withHole(new Property("p", id("a")), new Property("q", id("b"))))),
            Arguments.of("Property.value", new ObjectLiteral(List.of(
                new Property("p", id("a")), new Property("empty", null), new Property("q", id("b"))))),
            Arguments.of("SwitchStatement.body", new SwitchStatement(new ThisExpression(), -1, withHole(
                new CaseStatement(id("a"), List.of()), new CaseStatement(id("b"), List.of())))),
            Arguments.of("CaseStatement.consequent",
                new CaseStatement(null, withHole(stmt(id("a")), stmt(id("b")))))
        );
    }

    private static <T> List<T> withHole(T first, T second) {
        return Arrays.asList(first, null, second);
    }

    @Test
    @DisplayName("Pruning a function literal hides its parameters and body but not its siblings")
    void testPruneFunctionLiteral() {
        FunctionLiteral fn = new FunctionLiteral(id("f"), List.of(id("p")), block(stmt(id("inner"))), "");
        Program program = new Program(List.of(
            stmt(id("before")),
            new FunctionStatement(fn),
            stmt(id("after"))
        ));

        RecordingVisitor visitor = new RecordingVisitor(node -> node instanceof FunctionLiteral);
        Walker.walkTree(visitor, program);

        assertEquals(List.of(
            "enter Program",
            "enter ExpressionStatement",
            "enter Identifier(before)",
            "exit ExpressionStatement",
            "enter FunctionStatement",
            "enter FunctionLiteral",
            "exit FunctionStatement",
            "enter ExpressionStatement",
            "enter Identifier(after)",
            "exit ExpressionStatement",
            "exit Program"
        ), visitor.trace());
    }

    @Test
    void testEveryNodeEnteredOnce() {
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int[] calls = {0};
        Walker.walkTree(Visitor.of(node -> {
            calls[0]++;
            assertTrue(seen.add(node), "entered twice: " + node.type());
            return true;
        }), kitchenSink());

        assertEquals(92, calls[0]);
    }

    @Test
    @DisplayName("Exactly one exit per non-leaf node, nested like a stack")
    void testExitsNestLikeAStack() {
        WalkTable table = WalkTable.standard();
        List<Node> open = new ArrayList<>();
        int[] nonLeaves = {0};
        int[] exits = {0};

        Walker.walkTree(new Visitor() {
            @Override
            public Visitor enter(Node node) {
                if (!table.isLeaf(node.getClass())) {
                    nonLeaves[0]++;
                    open.add(node);
                }
                return this;
            }

            @Override
            public void exit(Node node) {
                exits[0]++;
                assertFalse(table.isLeaf(node.getClass()), "exit for leaf " + node.type());
                assertFalse(open.isEmpty(), "exit without enter: " + node.type());
                assertSame(open.remove(open.size() - 1), node);
            }
        }, kitchenSink());

        assertTrue(open.isEmpty());
        assertEquals(nonLeaves[0], exits[0]);
        assertEquals(51, exits[0]);
    }

    @Test
    @DisplayName("An empty block has no children but still gets its exit")
    void testEmptyBlockIsNotALeaf() {
        RecordingVisitor visitor = new RecordingVisitor();
        Walker.walkTree(visitor, new BlockStatement(List.of()));

        assertEquals(List.of("enter BlockStatement", "exit BlockStatement"), visitor.trace());
    }

    @Test
    void testKitchenSinkOrder() {
        RecordingVisitor visitor = new RecordingVisitor();
        Walker.walkTree(visitor, kitchenSink());

        assertEquals(List.of(
            "Program",
            // function add(a, b) { return a + b; }
            "FunctionStatement", "FunctionLiteral", "Identifier(add)", "Identifier(a)", "Identifier(b)",
            "BlockStatement", "ReturnStatement", "BinaryExpression", "Identifier(a)", "Identifier(b)",
            // var x = add(1, 2), y;
            "VariableStatement", "VariableExpression", "CallExpression", "Identifier(add)",
            "NumberLiteral(1)", "NumberLiteral(2)", "VariableExpression",
            // outer: for (var i = 0; i < 10; i++) ...
            "LabelledStatement", "ForStatement", "SequenceExpression", "VariableExpression", "NumberLiteral(0)",
            "UnaryExpression", "Identifier(i)", "BinaryExpression", "Identifier(i)", "NumberLiteral(10)",
            "BlockStatement", "IfStatement", "Identifier(i)", "BranchStatement", "Identifier(outer)",
            "BranchStatement",
            // for (k in obj) with (obj) { k; }
            "ForInStatement", "Identifier(k)", "Identifier(obj)", "WithStatement", "Identifier(obj)",
            "BlockStatement", "ExpressionStatement", "Identifier(k)",
            // switch
            "SwitchStatement", "Identifier(x)", "CaseStatement", "NumberLiteral(1)", "ExpressionStatement",
            "AssignExpression", "Identifier(x)", "ObjectLiteral", "NumberLiteral(1)", "ArrayLiteral",
            "NumberLiteral(2)", "RegExpLiteral", "CaseStatement", "EmptyStatement",
            // try
            "TryStatement", "BlockStatement", "ThrowStatement", "NewExpression", "Identifier(Error)",
            "StringLiteral(\"e\")", "CatchStatement", "Identifier(e)", "BlockStatement", "DebuggerStatement",
            "BlockStatement", "ExpressionStatement", "AssignExpression", "DotExpression", "ThisExpression",
            "NullLiteral",
            // do-while
            "DoWhileStatement", "ConditionalExpression", "BinaryExpression", "BooleanLiteral", "BooleanLiteral",
            "Identifier(x)", "Identifier(y)", "BlockStatement", "ExpressionStatement", "UnaryExpression",
            "Identifier(x)",
            // while (x) ;
            "WhileStatement", "Identifier(x)", "EmptyStatement",
            // (x, y)[0];
            "ExpressionStatement", "BracketExpression", "SequenceExpression", "Identifier(x)", "Identifier(y)",
            "NumberLiteral(0)"
        ), visitor.entered());
    }

    @Test
    @DisplayName("Children are walked with the visitor returned by enter, and exit goes to that visitor")
    void testVisitorSwap() {
        List<String> log = new ArrayList<>();

        class DepthVisitor implements Visitor {
            final int depth;

            DepthVisitor(int depth) {
                this.depth = depth;
            }

            @Override
            public Visitor enter(Node node) {
                log.add(depth + " " + RecordingVisitor.label(node));
                return new DepthVisitor(depth + 1);
            }

            @Override
            public void exit(Node node) {
                log.add("exit@" + depth + " " + RecordingVisitor.label(node));
            }
        }

        Walker.walkTree(new DepthVisitor(0), onePlusTwo());

        assertEquals(List.of(
            "0 Program",
            "1 ExpressionStatement",
            "2 BinaryExpression",
            "3 NumberLiteral(1)",
            "3 NumberLiteral(2)",
            "exit@3 BinaryExpression",
            "exit@2 ExpressionStatement",
            "exit@1 Program"
        ), log);
    }

    @Test
    void testInspectVisitor() {
        List<String> seen = new ArrayList<>();
        Walker.walkTree(Visitor.of(node -> {
            seen.add(RecordingVisitor.label(node));
            return !(node instanceof BinaryExpression);
        }), onePlusTwo());

        assertEquals(List.of("Program", "ExpressionStatement", "BinaryExpression"), seen);
    }

    @Test
    @DisplayName("Unregistered variant fails the walk instead of being skipped")
    void testUnregisteredVariantIsFatal() {
        Walker walker = new Walker(WalkTable.standard().without(DebuggerStatement.class));
        Program program = new Program(List.of(
            stmt(id("before")),
            new DebuggerStatement(),
            stmt(id("after"))
        ));

        RecordingVisitor visitor = new RecordingVisitor();
        UnknownNodeError error = assertThrows(UnknownNodeError.class, () -> walker.walk(visitor, program));

        assertEquals(DebuggerStatement.class, error.getNodeClass());
        assertTrue(error.getMessage().contains("DebuggerStatement"));
        assertEquals(List.of("Program", "ExpressionStatement", "Identifier(before)", "DebuggerStatement"),
            visitor.entered());
    }

    @Test
    @DisplayName("A pruned node is never looked up, so its kind need not be registered")
    void testPrunedUnregisteredVariantIsNotResolved() {
        Walker walker = new Walker(WalkTable.standard().without(Identifier.class));
        Visitor pruneAll = node -> null;

        assertDoesNotThrow(() -> walker.walk(pruneAll, id("x")));

        RecordingVisitor visitor = new RecordingVisitor(node -> node instanceof Identifier);
        walker.walk(visitor, stmt(new BinaryExpression("+", id("a"), num(1), false)));
        assertEquals(List.of(
            "enter ExpressionStatement",
            "enter BinaryExpression",
            "enter Identifier(a)",
            "enter NumberLiteral(1)",
            "exit BinaryExpression",
            "exit ExpressionStatement"
        ), visitor.trace());
    }

    @Test
    void testVisitorExceptionPropagates() {
        IllegalStateException failure = new IllegalStateException("stop");
        Visitor failing = new Visitor() {
            @Override
            public Visitor enter(Node node) {
                if (node instanceof NumberLiteral) {
                    throw failure;
                }
                return this;
            }
        };

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> Walker.walkTree(failing, onePlusTwo()));
        assertSame(failure, thrown);
    }

    @Test
    void testNullVisitorRejected() {
        assertThrows(NullPointerException.class, () -> Walker.walkTree(null, onePlusTwo()));
    }
}
