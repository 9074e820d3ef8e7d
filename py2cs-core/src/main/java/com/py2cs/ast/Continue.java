package com.py2cs.ast;

public record Continue(
    int line,
    int column
) implements Statement {
    public Continue() {
        this(0, 0);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }

    @Override
    public String kind() {
        return "Continue";
    }
}
