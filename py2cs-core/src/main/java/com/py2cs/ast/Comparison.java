package com.py2cs.ast;

import java.util.List;

/**
 * {@code left op[0] comparators[0] op[1] comparators[1] ...}, so {@code a < b <= c}
 * has two operators and two comparators.
 */
public record Comparison(
    int line,
    int column,
    Expression left,
    List<Operator> operators,
    List<Expression> comparators
) implements Expression {

    public Comparison {
        operators = List.copyOf(operators);
        comparators = List.copyOf(comparators);
        if (operators.size() != comparators.size() || operators.isEmpty()) {
            throw new IllegalArgumentException(
                "Comparison needs matching operators and comparators, got "
                    + operators.size() + " and " + comparators.size());
        }
    }

    public Comparison(Expression left, List<Operator> operators, List<Expression> comparators) {
        this(0, 0, left, operators, comparators);
    }

    public Comparison(Expression left, Operator op, Expression right) {
        this(0, 0, left, List.of(op), List.of(right));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String kind() {
        return "Compare";
    }
}
