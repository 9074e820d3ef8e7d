package com.py2cs.translate;

/**
 * Declared C# type guessed from the shape of an expression.
 */
public enum TypeLabel {
    INT("int"),
    STRING("string"),
    BOOL("bool"),
    DYNAMIC("dynamic");

    private final String keyword;

    TypeLabel(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The C# keyword for this type.
     */
    public String keyword() {
        return keyword;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
