package com.py2cs.ast;

public record Pass(
    int line,
    int column
) implements Statement {
    public Pass() {
        this(0, 0);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPass(this);
    }

    @Override
    public String kind() {
        return "Pass";
    }
}
