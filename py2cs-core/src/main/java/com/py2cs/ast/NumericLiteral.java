package com.py2cs.ast;

/**
 * An int or float constant. Integers arrive as {@link Long} or {@link java.math.BigInteger},
 * floats as {@link Double}.
 */
public record NumericLiteral(
    int line,
    int column,
    Number value
) implements Expression {
    public NumericLiteral(Number value) {
        this(0, 0, value);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumericLiteral(this);
    }

    @Override
    public String kind() {
        return "Num";
    }
}
