package com.scriptwalk.ast;

public record TryStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Statement body,
    CatchStatement catchClause,  // Can be null
    Statement finallyBlock  // Can be null
) implements Statement {
    public TryStatement(Statement body, CatchStatement catchClause, Statement finallyBlock) {
        this(0, 0, 0, 0, 0, 0, body, catchClause, finallyBlock);
    }

    public TryStatement(
        int start,
        int end,
        SourceLocation loc,
        Statement body,
        CatchStatement catchClause,
        Statement finallyBlock
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             body,
             catchClause,
             finallyBlock);
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
        return "TryStatement";
    }
}
