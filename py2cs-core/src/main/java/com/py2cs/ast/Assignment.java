package com.py2cs.ast;

import java.util.List;

/**
 * {@code a = b = value}: one or more targets sharing a single value.
 */
public record Assignment(
    int line,
    int column,
    List<Expression> targets,
    Expression value
) implements Statement {

    public Assignment {
        targets = List.copyOf(targets);
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("Assignment needs at least one target");
        }
    }

    public Assignment(List<Expression> targets, Expression value) {
        this(0, 0, targets, value);
    }

    public Assignment(Expression target, Expression value) {
        this(0, 0, List.of(target), value);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String kind() {
        return "Assign";
    }
}
