package com.scriptwalk.ast;

public record DotExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression left,
    String identifier  // Member name, not a node
) implements Expression {
    public DotExpression(Expression left, String identifier) {
        this(0, 0, 0, 0, 0, 0, left, identifier);
    }

    public DotExpression(
        int start,
        int end,
        SourceLocation loc,
        Expression left,
        String identifier
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             left,
             identifier);
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
        return "DotExpression";
    }
}
