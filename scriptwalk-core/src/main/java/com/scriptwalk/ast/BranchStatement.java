package com.scriptwalk.ast;

public record BranchStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String token,  // "break" or "continue"
    Identifier label  // Can be null for unlabeled break/continue
) implements Statement {
    public BranchStatement(String token, Identifier label) {
        this(0, 0, 0, 0, 0, 0, token, label);
    }

    public BranchStatement(
        int start,
        int end,
        SourceLocation loc,
        String token,
        Identifier label
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             token,
             label);
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
        return "BranchStatement";
    }
}
