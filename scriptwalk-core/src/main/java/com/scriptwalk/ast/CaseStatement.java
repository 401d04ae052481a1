package com.scriptwalk.ast;

import java.util.List;

public record CaseStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,  // null for default case
    List<Statement> consequent
) implements Statement {
    public CaseStatement(Expression test, List<Statement> consequent) {
        this(0, 0, 0, 0, 0, 0, test, consequent);
    }

    public CaseStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression test,
        List<Statement> consequent
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             test,
             consequent);
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
        return "CaseStatement";
    }
}
