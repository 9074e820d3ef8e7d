package com.py2cs.ast;

public record Identifier(
    int line,
    int column,
    String name
) implements Expression {
    public Identifier(String name) {
        this(0, 0, name);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String kind() {
        return "Name";
    }
}
