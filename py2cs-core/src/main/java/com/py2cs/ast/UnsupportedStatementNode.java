package com.py2cs.ast;

/**
 * Placeholder for a statement the parser produced but the translator has no rendering for
 * ({@code Try}, {@code With}, {@code Import}, ...). Loading never fails on these; emitting does.
 */
public record UnsupportedStatementNode(
    int line,
    int column,
    String kind
) implements Statement {
    public UnsupportedStatementNode(String kind) {
        this(0, 0, kind);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
