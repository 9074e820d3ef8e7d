package com.py2cs.ast;

public record Return(
    int line,
    int column,
    Expression value  // Can be null for a bare return
) implements Statement {
    public Return(Expression value) {
        this(0, 0, value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public String kind() {
        return "Return";
    }
}
