package com.scriptwalk.ast;

public record VariableExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    Expression initializer  // Can be null
) implements Expression {
    public VariableExpression(String name, Expression initializer) {
        this(0, 0, 0, 0, 0, 0, name, initializer);
    }

    public VariableExpression(
        int start,
        int end,
        SourceLocation loc,
        String name,
        Expression initializer
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name,
             initializer);
    }

    @Override
    public SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine, startCol),
            new SourceLocation.Position(endLine, endCol)
        );
    }

    @Override
    public String type() {
        return "VariableExpression";
    }
}
