package com.scriptwalk.ast;

public record RegExpLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String literal,
    String pattern,
    String flags
) implements Expression {
    public RegExpLiteral(String literal, String pattern, String flags) {
        this(0, 0, 0, 0, 0, 0, literal, pattern, flags);
    }

    public RegExpLiteral(
        int start,
        int end,
        SourceLocation loc,
        String literal,
        String pattern,
        String flags
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             literal,
             pattern,
             flags);
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
        return "RegExpLiteral";
    }
}
