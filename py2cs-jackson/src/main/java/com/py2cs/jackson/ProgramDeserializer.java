package com.py2cs.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.py2cs.ast.Program;
import com.py2cs.ast.Statement;

import java.io.IOException;

class ProgramDeserializer extends PythonNodeDeserializer<Program> {

    ProgramDeserializer() {
        super(Program.class);
    }

    @Override
    protected Program fromTree(JsonNode node, String type, DeserializationContext ctxt) throws IOException {
        if (!"Module".equals(type)) {
            return ctxt.reportInputMismatch(this, "Expected a Module at the root, got '%s'", type);
        }
        return new Program(children(node, "body", Statement.class, ctxt));
    }
}
