package com.scriptwalk.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> list
) implements Statement {
    public BlockStatement(List<Statement> list) {
        this(0, 0, 0, 0, 0, 0, list);
    }

    public BlockStatement(
        int start,
        int end,
        SourceLocation loc,
        List<Statement> list
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             list);
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
        return "BlockStatement";
    }
}
