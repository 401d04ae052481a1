package com.scriptwalk.json;

import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.scriptwalk.IterativeWalker;
import com.scriptwalk.Visitor;
import com.scriptwalk.Walker;
import com.scriptwalk.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Walks trees read from JSON fixtures, the way a tool consuming parser output would.
 */
public class FixtureWalkTest {

    @Test
    void testOnePlusTwo() throws IOException {
        Program program = JsonTrees.fixture("one-plus-two.json");

        List<String> trace = new ArrayList<>();
        Walker.walkTree(new Visitor() {
            @Override
            public Visitor enter(Node node) {
                trace.add("enter " + node.type());
                return this;
            }

            @Override
            public void exit(Node node) {
                trace.add("exit " + node.type());
            }
        }, program);

        assertEquals(List.of(
            "enter Program",
            "enter ExpressionStatement",
            "enter BinaryExpression",
            "enter NumberLiteral",
            "enter NumberLiteral",
            "exit BinaryExpression",
            "exit ExpressionStatement",
            "exit Program"
        ), trace);
    }

    @Test
    void testLocationsSurviveDeserialization() throws IOException {
        Program program = JsonTrees.fixture("one-plus-two.json");

        assertEquals(6, program.end());
        assertEquals(1, program.startLine());
        assertEquals(6, program.endCol());

        ExpressionStatement statement = (ExpressionStatement) program.body().get(0);
        BinaryExpression binary = (BinaryExpression) statement.expression();
        assertEquals(5, binary.loc().end().column());

        NumberLiteral right = (NumberLiteral) binary.right();
        assertEquals(4, right.start());
        assertEquals(0, right.startLine(), "missing loc defaults to zero");
        assertEquals(2, ((Number) right.value()).intValue());
    }

    @Test
    @DisplayName("A scope tracking visitor sees function boundaries through enter and exit")
    void testScopeDepth() throws IOException {
        Program program = JsonTrees.fixture("scopes.json");

        ScopeVisitor scopes = new ScopeVisitor();
        Walker.walkTree(scopes, program);

        assertEquals(List.of("outer@1", "a@1", "a@2", "a@1", "f@1"), scopes.references);
        assertEquals(0, scopes.depth);

        ScopeVisitor iterative = new ScopeVisitor();
        IterativeWalker.standard().walk(iterative, program);
        assertEquals(scopes.references, iterative.references);
    }

    @Test
    void testAbsentSlotsAreNull() throws IOException {
        Program program = JsonTrees.fixture("scopes.json");

        FunctionStatement statement = (FunctionStatement) program.body().get(0);
        BlockStatement body = (BlockStatement) statement.function().body();
        VariableStatement vars = (VariableStatement) body.list().get(0);
        IfStatement ifStatement = (IfStatement) body.list().get(1);

        FunctionLiteral anonymous = (FunctionLiteral) ((VariableExpression) vars.list().get(0)).initializer();
        assertNull(anonymous.name());
        assertNull(((VariableExpression) vars.list().get(1)).initializer());
        assertNull(ifStatement.alternate());

        ObjectLiteral object = (ObjectLiteral) ((ExpressionStatement) program.body().get(1)).expression();
        assertEquals("n", object.value().get(0).key());
        assertEquals(1.5, ((NumberLiteral) object.value().get(0).value()).value());
    }

    @Test
    void testUnknownTypeIsRejected() {
        InvalidTypeIdException e = assertThrows(InvalidTypeIdException.class,
            () -> JsonTrees.fixture("unknown-type.json"));
        assertEquals("ClassDeclaration", e.getTypeId());
    }

    /**
     * Records identifiers with the function nesting depth they occur at.
     */
    private static class ScopeVisitor implements Visitor {
        final List<String> references = new ArrayList<>();
        int depth;

        @Override
        public Visitor enter(Node node) {
            if (node instanceof FunctionLiteral) {
                depth++;
            } else if (node instanceof Identifier id) {
                references.add(id.name() + "@" + depth);
            }
            return this;
        }

        @Override
        public void exit(Node node) {
            if (node instanceof FunctionLiteral) {
                depth--;
            }
        }
    }
}
