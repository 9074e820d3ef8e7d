package com.py2cs.ast;

public sealed interface Expression extends Node permits
    BinaryOp,
    BooleanOp,
    Comparison,
    UnaryOp,
    Lambda,
    Call,
    Attribute,
    NumericLiteral,
    StringLiteral,
    Identifier,
    UnsupportedExpressionNode {

    <R> R accept(ExpressionVisitor<R> visitor);
}
