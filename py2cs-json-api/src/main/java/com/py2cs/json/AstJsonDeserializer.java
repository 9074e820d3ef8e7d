package com.py2cs.json;

import com.py2cs.ast.Program;

import java.io.InputStream;

/**
 * Interface for reading Python syntax trees from JSON.
 *
 * <p>The expected document is a dump of Python's {@code ast} module: every node is an
 * object whose {@code _type} property names the node class, with Python's own field
 * names ({@code body}, {@code targets}, {@code func}, ...).</p>
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a Program (the {@code Module} root node).
     *
     * @param json the JSON string to deserialize
     * @return the deserialized Program
     * @throws AstJsonException if the document is not a well-formed tree
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Deserializes a Program from a UTF-8 JSON stream. The stream is not closed.
     *
     * @param json the JSON stream to deserialize
     * @return the deserialized Program
     * @throws AstJsonException if the stream cannot be read or is not a well-formed tree
     */
    Program deserializeProgram(InputStream json) throws AstJsonException;
}
