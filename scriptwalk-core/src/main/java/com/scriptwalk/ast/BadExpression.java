package com.scriptwalk.ast;

public record BadExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    int from,
    int to
) implements Expression {
    public BadExpression(int from, int to) {
        this(0, 0, 0, 0, 0, 0, from, to);
    }

    public BadExpression(
        int start,
        int end,
        SourceLocation loc,
        int from,
        int to
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             from,
             to);
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
        return "BadExpression";
    }
}
