package com.scriptwalk.ast;

/**
 * Base interface for all script AST nodes.
 *
 * <p>The set of variants is closed. Adding a production here means adding its entry to
 * {@link com.scriptwalk.WalkTable} as well.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression {

    String type();
    int start();
    int end();
    SourceLocation loc();
}
