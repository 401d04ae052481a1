package com.scriptwalk.ast;

public record BooleanLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String literal,
    boolean value
) implements Expression {
    public BooleanLiteral(String literal, boolean value) {
        this(0, 0, 0, 0, 0, 0, literal, value);
    }

    public BooleanLiteral(
        int start,
        int end,
        SourceLocation loc,
        String literal,
        boolean value
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             literal,
             value);
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
        return "BooleanLiteral";
    }
}
