package com.py2cs.jackson;

import com.py2cs.ast.*;
import com.py2cs.json.AstJsonException;
import com.py2cs.json.AstJsonProvider;
import com.py2cs.translate.Translator;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testProviderIsDiscovered() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertSame(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson").getClass());
    }

    @Test
    void testUnknownProviderName() {
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("Gson"));
    }

    @Test
    void testEmptyModule() {
        Program program = new JacksonAstJsonProvider().getDeserializer()
            .deserializeProgram("{\"_type\": \"Module\", \"body\": [], \"type_ignores\": []}");
        assertTrue(program.body().isEmpty());
    }

    @Test
    void testMalformedJsonIsWrapped() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserializeProgram("{\"_type\": \"Module\", \"body\": ["));
        assertNotNull(e.getCause());
        assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserializeProgram("{\"body\": []}"));
    }

    @Test
    void testFixtureTranslatesEndToEnd() throws Exception {
        Program program;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/add.json")) {
            assertNotNull(in);
            program = new JacksonAstJsonProvider().getDeserializer().deserializeProgram(in);
        }

        assertEquals(3, program.body().size());
        assertEquals(1, program.body().get(0).line());
        assertEquals(5, program.body().get(2).line());

        String expected = "using System;\n"
            + "public class Program {\n"
            + "\tpublic static void Main(string[] args) {\n"
            + "dynamic add(dynamic a, dynamic b) {\n"
            + "return a + b;\n"
            + "}\n"
            + "dynamic x = add(1, 2);\n"
            + "if (x > 2) {\n"
            + "\tConsole.WriteLine(\"big\");}\n"
            + "else {\n"
            + "\tConsole.WriteLine(x);}\n"
            + "\n"
            + "}\n"
            + "}\n";
        assertEquals(expected, new Translator().translate(program));
    }

    private static String functionReturning(String annotation) {
        return """
            {"_type": "Module", "type_ignores": [], "body": [
              {"_type": "FunctionDef", "name": "f", "lineno": 1, "col_offset": 0,
               "args": {"_type": "arguments", "posonlyargs": [], "args": [], "vararg": null,
                        "kwonlyargs": [], "kw_defaults": [], "kwarg": null, "defaults": []},
               "body": [{"_type": "Return", "lineno": 2, "col_offset": 4,
                         "value": {"_type": "Constant", "value": 1, "kind": null, "lineno": 2, "col_offset": 11}}],
               "decorator_list": [],
               "returns": %s}
            ]}
            """.formatted(annotation);
    }

    @Test
    void testNoneAndGenericReturnAnnotationsTranslate() {
        String none = "{\"_type\": \"Constant\", \"value\": null, \"kind\": null, \"lineno\": 1, \"col_offset\": 11}";
        String listOfInt = """
            {"_type": "Subscript", "lineno": 1, "col_offset": 11,
             "value": {"_type": "Name", "id": "list", "ctx": {"_type": "Load"}},
             "slice": {"_type": "Name", "id": "int", "ctx": {"_type": "Load"}},
             "ctx": {"_type": "Load"}}""";

        for (String annotation : new String[] {none, listOfInt}) {
            Program program = new JacksonAstJsonProvider().getDeserializer().deserializeProgram(functionReturning(annotation));
            assertEquals("dynamic f() {\nreturn 1;\n}\n", new Translator().translateBody(program), annotation);
        }
    }
}
