package com.scriptwalk.ast;

import java.util.List;

public record FunctionLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier name,  // Can be null for anonymous functions
    List<Identifier> parameterList,
    Statement body,
    String source
) implements Expression {
    public FunctionLiteral(Identifier name, List<Identifier> parameterList, Statement body, String source) {
        this(0, 0, 0, 0, 0, 0, name, parameterList, body, source);
    }

    public FunctionLiteral(
        int start,
        int end,
        SourceLocation loc,
        Identifier name,
        List<Identifier> parameterList,
        Statement body,
        String source
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name,
             parameterList,
             body,
             source);
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
        return "FunctionLiteral";
    }
}
