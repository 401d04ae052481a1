package com.scriptwalk.ast;

public record NullLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String literal
) implements Expression {
    public NullLiteral(String literal) {
        this(0, 0, 0, 0, 0, 0, literal);
    }

    public NullLiteral(
        int start,
        int end,
        SourceLocation loc,
        String literal
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             literal);
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
        return "NullLiteral";
    }
}
