package com.py2cs.ast;

import java.util.List;

public record ForLoop(
    int line,
    int column,
    Expression target,
    Expression iterable,
    List<Statement> body
) implements Statement {

    public ForLoop {
        body = List.copyOf(body);
    }

    public ForLoop(Expression target, Expression iterable, List<Statement> body) {
        this(0, 0, target, iterable, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForLoop(this);
    }

    @Override
    public String kind() {
        return "For";
    }
}
