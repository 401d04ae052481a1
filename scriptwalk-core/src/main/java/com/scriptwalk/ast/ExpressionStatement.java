package com.scriptwalk.ast;

public record ExpressionStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(0, 0, 0, 0, 0, 0, expression);
    }

    public ExpressionStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression expression
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             expression);
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
        return "ExpressionStatement";
    }
}
