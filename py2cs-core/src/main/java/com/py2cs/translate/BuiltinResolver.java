package com.py2cs.translate;

import java.util.Map;

/**
 * Renames well-known Python builtins to their C# counterparts. Arity and argument
 * types are not checked.
 */
public final class BuiltinResolver {

    private static final Map<String, String> BUILTINS = Map.of(
        "print", "Console.WriteLine",
        "input", "Console.ReadLine"
    );

    private BuiltinResolver() {
    }

    /**
     * Returns the C# name for {@code name}, or {@code name} itself when it is not a known builtin.
     */
    public static String resolve(String name) {
        return BUILTINS.getOrDefault(name, name);
    }
}
