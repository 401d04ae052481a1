package com.scriptwalk.ast;

public record ThrowStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument
) implements Statement {
    public ThrowStatement(Expression argument) {
        this(0, 0, 0, 0, 0, 0, argument);
    }

    public ThrowStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression argument
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             argument);
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
        return "ThrowStatement";
    }
}
