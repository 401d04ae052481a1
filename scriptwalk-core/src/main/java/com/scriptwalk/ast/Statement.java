package com.scriptwalk.ast;

public sealed interface Statement extends Node permits
    BlockStatement,
    BranchStatement,
    CaseStatement,
    CatchStatement,
    DebuggerStatement,
    DoWhileStatement,
    EmptyStatement,
    ExpressionStatement,
    ForInStatement,
    ForStatement,
    FunctionStatement,
    IfStatement,
    LabelledStatement,
    ReturnStatement,
    SwitchStatement,
    ThrowStatement,
    TryStatement,
    VariableStatement,
    WhileStatement,
    WithStatement {
}
