package com.py2cs.translate;

import com.py2cs.ast.Operator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps Python operator tags to C# operator symbols.
 *
 * <p>{@code Pow} and {@code FloorDiv} map to {@code **} and {@code //}. C# has neither
 * operator; the tokens are kept so the intent stays visible in the output.</p>
 */
public final class OperatorTable {

    private static final Map<Operator, String> BINARY;
    private static final Map<Operator, String> UNARY;

    static {
        Map<Operator, String> binary = new EnumMap<>(Operator.class);
        // Arithmetic
        binary.put(Operator.Add, "+");
        binary.put(Operator.Sub, "-");
        binary.put(Operator.Mult, "*");
        binary.put(Operator.Div, "/");
        binary.put(Operator.Mod, "%");
        binary.put(Operator.Pow, "**");
        binary.put(Operator.FloorDiv, "//");
        // Bitwise
        binary.put(Operator.LShift, "<<");
        binary.put(Operator.RShift, ">>");
        binary.put(Operator.BitOr, "|");
        binary.put(Operator.BitXor, "^");
        binary.put(Operator.BitAnd, "&");
        // Comparison
        binary.put(Operator.Eq, "==");
        binary.put(Operator.NotEq, "!=");
        binary.put(Operator.Lt, "<");
        binary.put(Operator.LtE, "<=");
        binary.put(Operator.Gt, ">");
        binary.put(Operator.GtE, ">=");
        // Boolean
        binary.put(Operator.And, "&&");
        binary.put(Operator.Or, "||");
        BINARY = Collections.unmodifiableMap(binary);

        Map<Operator, String> unary = new EnumMap<>(Operator.class);
        unary.put(Operator.USub, "-");
        unary.put(Operator.UAdd, "+");
        unary.put(Operator.Not, "!");
        unary.put(Operator.Invert, "~");
        UNARY = Collections.unmodifiableMap(unary);
    }

    private OperatorTable() {
    }

    /**
     * Symbol for a binary, boolean or comparison operator.
     *
     * @throws UnsupportedOperatorException for {@code MatMult}, {@code Is}, {@code In}, the unary tags, ...
     */
    public static String symbolFor(Operator op) {
        String symbol = BINARY.get(op);
        if (symbol == null) {
            throw new UnsupportedOperatorException(op);
        }
        return symbol;
    }

    /**
     * Prefix symbol for a unary operator.
     *
     * @throws UnsupportedOperatorException for any tag that is not a unary operator
     */
    public static String unarySymbolFor(Operator op) {
        String symbol = UNARY.get(op);
        if (symbol == null) {
            throw new UnsupportedOperatorException(op);
        }
        return symbol;
    }
}
