package com.scriptwalk.ast;

public record CatchStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier parameter,
    Statement body
) implements Statement {
    public CatchStatement(Identifier parameter, Statement body) {
        this(0, 0, 0, 0, 0, 0, parameter, body);
    }

    public CatchStatement(
        int start,
        int end,
        SourceLocation loc,
        Identifier parameter,
        Statement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             parameter,
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
        return "CatchStatement";
    }
}
