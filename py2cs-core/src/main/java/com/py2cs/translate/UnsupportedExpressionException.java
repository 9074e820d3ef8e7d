package com.py2cs.translate;

import com.py2cs.ast.Expression;

public class UnsupportedExpressionException extends TranslationException {

    public UnsupportedExpressionException(Expression expression) {
        super("Unsupported expression type: " + expression.kind(), expression.kind(), expression.line());
    }
}
