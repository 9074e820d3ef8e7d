package com.py2cs.ast;

/**
 * Placeholder for an expression kind the translator has no rendering for
 * ({@code Subscript}, {@code List}, {@code Constant} holding {@code None}, ...).
 */
public record UnsupportedExpressionNode(
    int line,
    int column,
    String kind
) implements Expression {
    public UnsupportedExpressionNode(String kind) {
        this(0, 0, kind);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
