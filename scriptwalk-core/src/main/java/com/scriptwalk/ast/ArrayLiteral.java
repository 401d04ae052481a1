package com.scriptwalk.ast;

import java.util.List;

public record ArrayLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Expression> value  // Elements may be null for holes
) implements Expression {
    public ArrayLiteral(List<Expression> value) {
        this(0, 0, 0, 0, 0, 0, value);
    }

    public ArrayLiteral(
        int start,
        int end,
        SourceLocation loc,
        List<Expression> value
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
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
        return "ArrayLiteral";
    }
}
