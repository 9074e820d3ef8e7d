package com.py2cs.ast;

public record BinaryOp(
    int line,
    int column,
    Expression left,
    Operator op,
    Expression right
) implements Expression {
    public BinaryOp(Expression left, Operator op, Expression right) {
        this(0, 0, left, op, right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String kind() {
        return "BinOp";
    }
}
