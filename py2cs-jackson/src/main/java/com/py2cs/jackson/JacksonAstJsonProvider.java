package com.py2cs.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.py2cs.ast.Program;
import com.py2cs.json.AstJsonDeserializer;
import com.py2cs.json.AstJsonException;
import com.py2cs.json.AstJsonProvider;

import java.io.IOException;
import java.io.InputStream;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.deserializer = new JacksonDeserializer(Py2CsJackson.createObjectMapper());
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Program.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize Program: " + e.getOriginalMessage(), e);
            }
        }

        @Override
        public Program deserializeProgram(InputStream json) throws AstJsonException {
            try {
                return mapper.readValue(json, Program.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize Program: " + e.getOriginalMessage(), e);
            } catch (IOException e) {
                throw new AstJsonException("Failed to read Program JSON", e);
            }
        }
    }
}
