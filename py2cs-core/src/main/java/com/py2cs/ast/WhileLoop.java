package com.py2cs.ast;

import java.util.List;

public record WhileLoop(
    int line,
    int column,
    Expression test,
    List<Statement> body
) implements Statement {

    public WhileLoop {
        body = List.copyOf(body);
    }

    public WhileLoop(Expression test, List<Statement> body) {
        this(0, 0, test, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhileLoop(this);
    }

    @Override
    public String kind() {
        return "While";
    }
}
