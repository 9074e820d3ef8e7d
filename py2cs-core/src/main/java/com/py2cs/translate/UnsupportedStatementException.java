package com.py2cs.translate;

import com.py2cs.ast.Statement;

public class UnsupportedStatementException extends TranslationException {

    public UnsupportedStatementException(Statement statement) {
        super("Unsupported statement type: " + statement.kind(), statement.kind(), statement.line());
    }
}
