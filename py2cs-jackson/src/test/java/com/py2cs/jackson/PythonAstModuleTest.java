package com.py2cs.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.py2cs.ast.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PythonAstModuleTest {

    private final ObjectMapper mapper = Py2CsJackson.createObjectMapper();

    private Statement statement(String json) throws Exception {
        return mapper.readValue(json, Statement.class);
    }

    private Expression expression(String json) throws Exception {
        return mapper.readValue(json, Expression.class);
    }

    @Test
    void testAssignWithConstant() throws Exception {
        Statement statement = statement("""
            {
              "_type": "Assign",
              "targets": [{"_type": "Name", "id": "x", "ctx": {"_type": "Store"}}],
              "value": {"_type": "Constant", "value": 1, "kind": null},
              "lineno": 3,
              "col_offset": 0
            }
            """);

        Assignment assignment = assertInstanceOf(Assignment.class, statement);
        assertEquals(3, assignment.line());
        assertEquals(List.of(new Identifier(0, 0, "x")), assignment.targets());
        assertEquals(new NumericLiteral(0, 0, 1L), assignment.value());
    }

    @Test
    void testLegacyNumAndStr() throws Exception {
        assertEquals(new NumericLiteral(0, 0, 7L), expression("{\"_type\": \"Num\", \"n\": 7}"));
        assertEquals(new NumericLiteral(0, 0, 2.5), expression("{\"_type\": \"Num\", \"n\": 2.5}"));
        assertEquals(new StringLiteral(0, 0, "hi"), expression("{\"_type\": \"Str\", \"s\": \"hi\"}"));
    }

    @Test
    void testLargeIntegerKeepsPrecision() throws Exception {
        Expression literal = expression("{\"_type\": \"Constant\", \"value\": 123456789012345678901234567890}");
        assertEquals(new BigInteger("123456789012345678901234567890"), ((NumericLiteral) literal).value());
    }

    @Test
    void testNonNumericConstantIsUnsupported() throws Exception {
        Expression none = expression("{\"_type\": \"Constant\", \"value\": null, \"lineno\": 2}");
        Expression flag = expression("{\"_type\": \"Constant\", \"value\": true}");
        assertEquals(new UnsupportedExpressionNode(2, 0, "Constant"), none);
        assertEquals("Constant", flag.kind());
        assertInstanceOf(UnsupportedExpressionNode.class, flag);
    }

    @Test
    void testChainedCompare() throws Exception {
        Expression compare = expression("""
            {
              "_type": "Compare",
              "left": {"_type": "Name", "id": "a"},
              "ops": [{"_type": "Lt"}, {"_type": "LtE"}],
              "comparators": [{"_type": "Name", "id": "b"}, {"_type": "Name", "id": "c"}]
            }
            """);

        Comparison comparison = assertInstanceOf(Comparison.class, compare);
        assertEquals(List.of(Operator.Lt, Operator.LtE), comparison.operators());
        assertEquals(2, comparison.comparators().size());
    }

    @Test
    void testBoolOpAndUnaryOp() throws Exception {
        Expression boolOp = expression("""
            {"_type": "BoolOp", "op": {"_type": "Or"}, "values": [{"_type": "Name", "id": "a"}, {"_type": "Name", "id": "b"}]}
            """);
        Expression unary = expression("""
            {"_type": "UnaryOp", "op": {"_type": "Not"}, "operand": {"_type": "Name", "id": "done"}}
            """);

        assertEquals(Operator.Or, ((BooleanOp) boolOp).op());
        assertEquals(new UnaryOp(0, 0, Operator.Not, new Identifier(0, 0, "done")), unary);
    }

    @Test
    void testLambdaParameters() throws Exception {
        Expression lambda = expression("""
            {
              "_type": "Lambda",
              "args": {"_type": "arguments", "posonlyargs": [], "args": [{"_type": "arg", "arg": "n"}],
                       "vararg": null, "kwonlyargs": [], "kw_defaults": [], "kwarg": null, "defaults": []},
              "body": {"_type": "BinOp", "left": {"_type": "Name", "id": "n"}, "op": {"_type": "Mult"},
                       "right": {"_type": "Constant", "value": 2}}
            }
            """);

        Lambda parsed = assertInstanceOf(Lambda.class, lambda);
        assertEquals(List.of(new Parameter(0, 0, "n")), parsed.parameters());
        assertEquals(Operator.Mult, ((BinaryOp) parsed.body()).op());
    }

    @Test
    void testDefaultParametersAreUnsupported() throws Exception {
        Statement function = statement("""
            {
              "_type": "FunctionDef",
              "name": "f",
              "args": {"_type": "arguments", "args": [{"_type": "arg", "arg": "n"}],
                       "defaults": [{"_type": "Constant", "value": 1}]},
              "body": [{"_type": "Pass"}],
              "decorator_list": [],
              "lineno": 5
            }
            """);

        assertEquals(new UnsupportedStatementNode(5, 0, "arguments"), function);
    }

    @Test
    void testCallWithAttributeCallee() throws Exception {
        Expression call = expression("""
            {
              "_type": "Call",
              "func": {"_type": "Attribute", "value": {"_type": "Name", "id": "self"}, "attr": "save"},
              "args": [],
              "keywords": []
            }
            """);

        Call parsed = assertInstanceOf(Call.class, call);
        assertEquals(new Attribute(0, 0, new Identifier(0, 0, "self"), "save"), parsed.callee());
    }

    @Test
    void testKeywordArgumentsAreUnsupported() throws Exception {
        Expression call = expression("""
            {
              "_type": "Call",
              "func": {"_type": "Name", "id": "print"},
              "args": [{"_type": "Name", "id": "x"}],
              "keywords": [{"_type": "keyword", "arg": "end", "value": {"_type": "Constant", "value": ""}}]
            }
            """);

        assertEquals("keyword", call.kind());
    }

    @Test
    void testUnknownKindsBecomePlaceholders() throws Exception {
        Statement tryStatement = statement("""
            {"_type": "Try", "body": [], "handlers": [], "orelse": [], "finalbody": [], "lineno": 9, "col_offset": 4}
            """);
        Expression subscript = expression("""
            {"_type": "Subscript", "value": {"_type": "Name", "id": "xs"}, "slice": {"_type": "Constant", "value": 0}}
            """);

        assertEquals(new UnsupportedStatementNode(9, 4, "Try"), tryStatement);
        assertEquals(new UnsupportedExpressionNode(0, 0, "Subscript"), subscript);
    }

    @Test
    void testLoopElseIsUnsupported() throws Exception {
        Statement loop = statement("""
            {
              "_type": "While",
              "test": {"_type": "Name", "id": "running"},
              "body": [{"_type": "Break"}],
              "orelse": [{"_type": "Pass"}]
            }
            """);

        assertEquals("While-else", loop.kind());
    }

    @Test
    void testForIfAndClass() throws Exception {
        Statement loop = statement("""
            {
              "_type": "For",
              "target": {"_type": "Name", "id": "item"},
              "iter": {"_type": "Name", "id": "items"},
              "body": [{"_type": "Continue"}],
              "orelse": []
            }
            """);
        Statement cls = statement("""
            {"_type": "ClassDef", "name": "Dog", "bases": [{"_type": "Name", "id": "Animal"}],
             "keywords": [], "body": [{"_type": "Pass"}], "decorator_list": []}
            """);
        Statement conditional = statement("""
            {"_type": "If", "test": {"_type": "Name", "id": "ok"}, "body": [{"_type": "Pass"}], "orelse": []}
            """);

        assertEquals(new ForLoop(0, 0, new Identifier(0, 0, "item"), new Identifier(0, 0, "items"), List.of(new Continue(0, 0))), loop);
        assertEquals(List.of(new Identifier(0, 0, "Animal")), ((ClassDefinition) cls).bases());
        assertTrue(((Conditional) conditional).orElse().isEmpty());
    }

    @Test
    void testUnknownOperatorFails() {
        assertThrows(MismatchedInputException.class, () -> expression("""
            {"_type": "BinOp", "left": {"_type": "Name", "id": "a"}, "op": {"_type": "Spaceship"},
             "right": {"_type": "Name", "id": "b"}}
            """));
    }

    @Test
    void testMissingTypeFails() {
        assertThrows(MismatchedInputException.class, () -> expression("{\"id\": \"x\"}"));
        assertThrows(MismatchedInputException.class, () -> statement("[]"));
    }

    @Test
    void testMissingRequiredChildFails() {
        assertThrows(MismatchedInputException.class, () -> statement("{\"_type\": \"Expr\"}"));
    }

    @Test
    void testRootMustBeModule() {
        assertThrows(MismatchedInputException.class, () -> mapper.readValue("{\"_type\": \"Expression\", \"body\": {}}", Program.class));
    }
}
