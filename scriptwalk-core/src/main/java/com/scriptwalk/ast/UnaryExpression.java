package com.scriptwalk.ast;

public record UnaryExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Expression operand,
    boolean postfix
) implements Expression {
    public UnaryExpression(String operator, Expression operand, boolean postfix) {
        this(0, 0, 0, 0, 0, 0, operator, operand, postfix);
    }

    public UnaryExpression(
        int start,
        int end,
        SourceLocation loc,
        String operator,
        Expression operand,
        boolean postfix
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             operator,
             operand,
             postfix);
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
        return "UnaryExpression";
    }
}
