package com.scriptwalk.ast;

public record ForInStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression into,  // Identifier, member expression or VariableExpression
    Expression source,
    Statement body
) implements Statement {
    public ForInStatement(Expression into, Expression source, Statement body) {
        this(0, 0, 0, 0, 0, 0, into, source, body);
    }

    public ForInStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression into,
        Expression source,
        Statement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             into,
             source,
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
        return "ForInStatement";
    }
}
