package com.scriptwalk.ast;

public record WhileStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Statement body
) implements Statement {
    public WhileStatement(Expression test, Statement body) {
        this(0, 0, 0, 0, 0, 0, test, body);
    }

    public WhileStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression test,
        Statement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             test,
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
        return "WhileStatement";
    }
}
