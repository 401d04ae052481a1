package com.scriptwalk.ast;

public record FunctionStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    FunctionLiteral function
) implements Statement {
    public FunctionStatement(FunctionLiteral function) {
        this(0, 0, 0, 0, 0, 0, function);
    }

    public FunctionStatement(
        int start,
        int end,
        SourceLocation loc,
        FunctionLiteral function
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             function);
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
        return "FunctionStatement";
    }
}
