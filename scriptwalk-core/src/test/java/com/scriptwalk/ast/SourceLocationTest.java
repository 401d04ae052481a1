package com.scriptwalk.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceLocationTest {

    @Test
    void testLocationConstructorFillsLineAndColumn() {
        SourceLocation loc = new SourceLocation(
            new SourceLocation.Position(3, 4),
            new SourceLocation.Position(5, 12));
        Identifier test = new Identifier(40, 41, new SourceLocation(
            new SourceLocation.Position(3, 8), new SourceLocation.Position(3, 9)), "a");
        IfStatement ifStatement = new IfStatement(36, 70, loc, test, new EmptyStatement(), null);

        assertEquals(36, ifStatement.start());
        assertEquals(70, ifStatement.end());
        assertEquals(3, ifStatement.startLine());
        assertEquals(4, ifStatement.startCol());
        assertEquals(5, ifStatement.endLine());
        assertEquals(12, ifStatement.endCol());
        assertEquals(loc, ifStatement.loc());
        assertEquals(8, ifStatement.test().loc().start().column());
    }

    @Test
    void testMissingLocationIsZeroed() {
        Program program = new Program(0, 10, null, List.of());

        assertEquals(new SourceLocation(
            new SourceLocation.Position(0, 0),
            new SourceLocation.Position(0, 0)), program.loc());
        assertEquals(10, program.end());
    }

    @Test
    void testShortConstructorHasNoPosition() {
        BinaryExpression expression = new BinaryExpression("+", new Identifier("a"), new Identifier("b"), false);

        assertEquals(0, expression.start());
        assertEquals(0, expression.loc().end().line());
        assertEquals("BinaryExpression", expression.type());
    }
}
