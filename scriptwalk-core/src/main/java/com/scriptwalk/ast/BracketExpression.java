package com.scriptwalk.ast;

public record BracketExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression left,
    Expression member
) implements Expression {
    public BracketExpression(Expression left, Expression member) {
        this(0, 0, 0, 0, 0, 0, left, member);
    }

    public BracketExpression(
        int start,
        int end,
        SourceLocation loc,
        Expression left,
        Expression member
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             left,
             member);
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
        return "BracketExpression";
    }
}
