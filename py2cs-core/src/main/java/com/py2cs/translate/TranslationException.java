package com.py2cs.translate;

/**
 * Thrown when a tree contains a construct the translator cannot render.
 * Translation of the whole tree is abandoned; there is no partial result.
 */
public class TranslationException extends RuntimeException {

    private final String kind;
    private final int line;

    public TranslationException(String message, String kind, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.kind = kind;
        this.line = line;
    }

    /**
     * The node or operator kind that could not be translated, e.g. {@code "Try"} or {@code "MatMult"}.
     */
    public String getKind() {
        return kind;
    }

    /**
     * Source line of the offending node, 0 when unknown.
     */
    public int getLine() {
        return line;
    }
}
