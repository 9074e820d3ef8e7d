package com.py2cs.ast;

import java.util.List;

/**
 * {@code a and b and c} arrives as one node with three values.
 */
public record BooleanOp(
    int line,
    int column,
    Operator op,
    List<Expression> values
) implements Expression {

    public BooleanOp {
        values = List.copyOf(values);
    }

    public BooleanOp(Operator op, List<Expression> values) {
        this(0, 0, op, values);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBooleanOp(this);
    }

    @Override
    public String kind() {
        return "BoolOp";
    }
}
