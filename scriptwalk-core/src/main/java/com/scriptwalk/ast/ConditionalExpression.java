package com.scriptwalk.ast;

public record ConditionalExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    public ConditionalExpression(Expression test, Expression consequent, Expression alternate) {
        this(0, 0, 0, 0, 0, 0, test, consequent, alternate);
    }

    public ConditionalExpression(
        int start,
        int end,
        SourceLocation loc,
        Expression test,
        Expression consequent,
        Expression alternate
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             test,
             consequent,
             alternate);
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
        return "ConditionalExpression";
    }
}
