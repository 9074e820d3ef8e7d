package com.py2cs.translate;

import com.py2cs.ast.Operator;

public class UnsupportedOperatorException extends TranslationException {

    private final Operator operator;

    public UnsupportedOperatorException(Operator operator) {
        super("Unsupported operator: " + operator.name(), operator.name(), 0);
        this.operator = operator;
    }

    public Operator getOperator() {
        return operator;
    }
}
