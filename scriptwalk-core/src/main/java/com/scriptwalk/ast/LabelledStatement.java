package com.scriptwalk.ast;

public record LabelledStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier label,  // Not walked
    Statement statement
) implements Statement {
    public LabelledStatement(Identifier label, Statement statement) {
        this(0, 0, 0, 0, 0, 0, label, statement);
    }

    public LabelledStatement(
        int start,
        int end,
        SourceLocation loc,
        Identifier label,
        Statement statement
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             label,
             statement);
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
        return "LabelledStatement";
    }
}
