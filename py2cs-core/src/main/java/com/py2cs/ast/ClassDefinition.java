package com.py2cs.ast;

import java.util.List;

public record ClassDefinition(
    int line,
    int column,
    String name,
    List<Expression> bases,
    List<Statement> body
) implements Statement {

    public ClassDefinition {
        bases = List.copyOf(bases);
        body = List.copyOf(body);
    }

    public ClassDefinition(String name, List<Expression> bases, List<Statement> body) {
        this(0, 0, name, bases, body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClassDefinition(this);
    }

    @Override
    public String kind() {
        return "ClassDef";
    }
}
