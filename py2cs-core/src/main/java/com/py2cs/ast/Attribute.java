package com.py2cs.ast;

public record Attribute(
    int line,
    int column,
    Expression value,
    String attribute
) implements Expression {
    public Attribute(Expression value, String attribute) {
        this(0, 0, value, attribute);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public String kind() {
        return "Attribute";
    }
}
