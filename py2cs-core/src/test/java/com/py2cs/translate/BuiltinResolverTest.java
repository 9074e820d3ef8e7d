package com.py2cs.translate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinResolverTest {

    @Test
    void testKnownBuiltins() {
        assertEquals("Console.WriteLine", BuiltinResolver.resolve("print"));
        assertEquals("Console.ReadLine", BuiltinResolver.resolve("input"));
    }

    @Test
    void testOtherNamesUnchanged() {
        assertEquals("len", BuiltinResolver.resolve("len"));
        assertEquals("Print", BuiltinResolver.resolve("Print"));
        assertEquals("", BuiltinResolver.resolve(""));
    }

    @Test
    void testResolveIsIdempotent() {
        for (String name : new String[] {"print", "input", "foo", "Console.WriteLine", "obj.method"}) {
            String once = BuiltinResolver.resolve(name);
            assertEquals(once, BuiltinResolver.resolve(once), name);
        }
    }
}
