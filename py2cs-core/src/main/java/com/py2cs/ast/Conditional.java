package com.py2cs.ast;

import java.util.List;

/**
 * {@code if}/{@code elif}/{@code else}. An {@code elif} arrives as a single nested
 * Conditional inside {@link #orElse()}.
 */
public record Conditional(
    int line,
    int column,
    Expression test,
    List<Statement> body,
    List<Statement> orElse  // Empty when there is no else branch
) implements Statement {

    public Conditional {
        body = List.copyOf(body);
        orElse = orElse == null ? List.of() : List.copyOf(orElse);
    }

    public Conditional(Expression test, List<Statement> body, List<Statement> orElse) {
        this(0, 0, test, body, orElse);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public String kind() {
        return "If";
    }
}
