package com.py2cs.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.py2cs.ast.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class Py2CsJacksonTest {

    @Test
    void testOnlyThePythonModuleIsRegistered() {
        ObjectMapper mapper = Py2CsJackson.createObjectMapper();
        assertEquals(1, mapper.getRegisteredModuleIds().size());
    }

    @Test
    void testUnmodelledFieldsAreIgnored() throws Exception {
        Program program = Py2CsJackson.createObjectMapper().readValue(
            "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Pass\", \"lineno\": 1, \"end_lineno\": 1}], \"type_ignores\": []}",
            Program.class);
        assertInstanceOf(Pass.class, program.body().get(0));
    }

    @Test
    void testTrailingContentIsRejected() {
        assertThrows(MismatchedInputException.class, () -> Py2CsJackson.createObjectMapper()
            .readValue("{\"_type\": \"Module\", \"body\": []} {}", Program.class));
    }
}
