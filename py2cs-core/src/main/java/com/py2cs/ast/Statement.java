package com.py2cs.ast;

public sealed interface Statement extends Node permits
    FunctionDefinition,
    ClassDefinition,
    Return,
    Assignment,
    ForLoop,
    WhileLoop,
    Conditional,
    ExpressionStatement,
    Pass,
    Break,
    Continue,
    UnsupportedStatementNode {

    <R> R accept(StatementVisitor<R> visitor);
}
