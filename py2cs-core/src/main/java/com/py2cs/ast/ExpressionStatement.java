package com.py2cs.ast;

public record ExpressionStatement(
    int line,
    int column,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(0, 0, expression);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public String kind() {
        return "Expr";
    }
}
