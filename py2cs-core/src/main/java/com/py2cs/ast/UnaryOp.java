package com.py2cs.ast;

public record UnaryOp(
    int line,
    int column,
    Operator op,
    Expression operand
) implements Expression {
    public UnaryOp(Operator op, Expression operand) {
        this(0, 0, op, operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String kind() {
        return "UnaryOp";
    }
}
