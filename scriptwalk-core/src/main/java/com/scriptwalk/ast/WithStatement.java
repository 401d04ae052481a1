package com.scriptwalk.ast;

public record WithStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression object,
    Statement body
) implements Statement {
    public WithStatement(Expression object, Statement body) {
        this(0, 0, 0, 0, 0, 0, object, body);
    }

    public WithStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression object,
        Statement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             object,
             body);
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
        return "WithStatement";
    }
}
