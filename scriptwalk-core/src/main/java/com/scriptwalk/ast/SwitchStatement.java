package com.scriptwalk.ast;

import java.util.List;

public record SwitchStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression discriminant,
    int defaultIndex,  // -1 when there is no default case
    List<CaseStatement> body
) implements Statement {
    public SwitchStatement(Expression discriminant, int defaultIndex, List<CaseStatement> body) {
        this(0, 0, 0, 0, 0, 0, discriminant, defaultIndex, body);
    }

    public SwitchStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression discriminant,
        int defaultIndex,
        List<CaseStatement> body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             discriminant,
             defaultIndex,
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
        return "SwitchStatement";
    }
}
