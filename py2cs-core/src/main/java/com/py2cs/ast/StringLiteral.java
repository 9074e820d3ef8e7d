package com.py2cs.ast;

/**
 * A string constant, holding the decoded (unescaped) text.
 */
public record StringLiteral(
    int line,
    int column,
    String value
) implements Expression {
    public StringLiteral(String value) {
        this(0, 0, value);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public String kind() {
        return "Str";
    }
}
