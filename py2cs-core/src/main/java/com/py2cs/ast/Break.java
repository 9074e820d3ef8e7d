package com.py2cs.ast;

public record Break(
    int line,
    int column
) implements Statement {
    public Break() {
        this(0, 0);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public String kind() {
        return "Break";
    }
}
