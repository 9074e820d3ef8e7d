package com.py2cs.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for reading syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = Py2CsJackson.createObjectMapper();
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class Py2CsJackson {

    private Py2CsJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree deserialization.
     *
     * The returned mapper:
     * - Reads Python {@code ast} dumps through {@link PythonAstModule}
     * - Keeps integer literals beyond the long range as BigInteger
     * - Rejects trailing content after the root node
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // Python dumps carry fields we do not model (ctx, type_comment, end_lineno, ...)
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

        mapper.registerModule(new PythonAstModule());

        return mapper;
    }
}
