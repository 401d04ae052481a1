package com.scriptwalk.ast;

public sealed interface Expression extends Node permits
    ArrayLiteral,
    AssignExpression,
    BadExpression,
    BinaryExpression,
    BooleanLiteral,
    BracketExpression,
    CallExpression,
    ConditionalExpression,
    DotExpression,
    EmptyExpression,
    FunctionLiteral,
    Identifier,
    NewExpression,
    NullLiteral,
    NumberLiteral,
    ObjectLiteral,
    RegExpLiteral,
    SequenceExpression,
    StringLiteral,
    ThisExpression,
    UnaryExpression,
    VariableExpression {
}
