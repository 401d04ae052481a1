package com.scriptwalk.ast;

public record ForStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression initializer,  // Can be null
    Expression update,  // Can be null
    Expression test,  // Can be null
    Statement body
) implements Statement {
    public ForStatement(Expression initializer, Expression update, Expression test, Statement body) {
        this(0, 0, 0, 0, 0, 0, initializer, update, test, body);
    }

    public ForStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression initializer,
        Expression update,
        Expression test,
        Statement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             initializer,
             update,
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
        return "ForStatement";
    }
}
