package com.py2cs.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.py2cs.ast.Operator;

import java.io.IOException;

/**
 * Reads operator tags such as {@code {"_type": "Add"}}.
 */
class OperatorDeserializer extends PythonNodeDeserializer<Operator> {

    OperatorDeserializer() {
        super(Operator.class);
    }

    @Override
    protected Operator fromTree(JsonNode node, String type, DeserializationContext ctxt) throws IOException {
        try {
            return Operator.valueOf(type);
        } catch (IllegalArgumentException e) {
            return ctxt.reportInputMismatch(this, "Unknown operator tag '%s'", type);
        }
    }
}
