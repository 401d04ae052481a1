package com.scriptwalk.ast;

/**
 * One entry of an {@link ObjectLiteral}. Only {@code value} is a node; the key is the
 * property name as written and {@code kind} is "value", "get" or "set".
 */
public record Property(
    String key,
    String kind,
    Expression value
) {
    public Property(String key, Expression value) {
        this(key, "value", value);
    }
}
