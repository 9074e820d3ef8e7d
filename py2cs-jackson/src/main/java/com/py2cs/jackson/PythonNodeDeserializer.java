package com.py2cs.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.py2cs.ast.Parameter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for deserializers that read one node of a Python {@code ast} dump.
 *
 * <p>The node is read as a tree first and then converted, so subclasses only deal with
 * {@link JsonNode}s. Child nodes are converted through the context, which routes them
 * back to the deserializer registered for their type.</p>
 */
abstract class PythonNodeDeserializer<T> extends StdDeserializer<T> {

    static final String TYPE_FIELD = "_type";

    protected PythonNodeDeserializer(Class<T> type) {
        super(type);
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        return fromTree(node, typeOf(node, ctxt), ctxt);
    }

    /**
     * Converts a node whose {@code _type} has already been read.
     */
    protected abstract T fromTree(JsonNode node, String type, DeserializationContext ctxt) throws IOException;

    protected String typeOf(JsonNode node, DeserializationContext ctxt) throws IOException {
        if (node == null || !node.isObject()) {
            return ctxt.reportInputMismatch(this, "Expected a %s node object, got %s",
                handledType().getSimpleName(), node == null ? "nothing" : node.getNodeType());
        }
        JsonNode type = node.get(TYPE_FIELD);
        if (type == null || !type.isTextual()) {
            return ctxt.reportInputMismatch(this, "%s node is missing its '%s' property",
                handledType().getSimpleName(), TYPE_FIELD);
        }
        return type.asText();
    }

    protected static int line(JsonNode node) {
        return node.path("lineno").asInt(0);
    }

    protected static int column(JsonNode node) {
        return node.path("col_offset").asInt(0);
    }

    protected String text(JsonNode node, String field, DeserializationContext ctxt) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return ctxt.reportInputMismatch(this, "'%s' of %s must be a string", field, node.path(TYPE_FIELD).asText());
        }
        return value.asText();
    }

    /**
     * A required child node.
     */
    protected <C> C child(JsonNode node, String field, Class<C> type, DeserializationContext ctxt) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return ctxt.reportInputMismatch(this, "'%s' of %s is required", field, node.path(TYPE_FIELD).asText());
        }
        return ctxt.readTreeAsValue(value, type);
    }

    /**
     * An optional child node; null when the field is absent or JSON null.
     */
    protected <C> C optionalChild(JsonNode node, String field, Class<C> type, DeserializationContext ctxt) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return ctxt.readTreeAsValue(value, type);
    }

    /**
     * A list of child nodes; empty when the field is absent.
     */
    protected <C> List<C> children(JsonNode node, String field, Class<C> type, DeserializationContext ctxt) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            return ctxt.reportInputMismatch(this, "'%s' of %s must be an array", field, node.path(TYPE_FIELD).asText());
        }
        List<C> result = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (element.isNull()) {
                return ctxt.reportInputMismatch(this, "'%s' of %s contains null", field, node.path(TYPE_FIELD).asText());
            }
            result.add(ctxt.readTreeAsValue(element, type));
        }
        return result;
    }

    /**
     * Positional parameters of an {@code arguments} node, or null when it declares anything
     * else ({@code *args}, keyword-only parameters, {@code **kwargs} or defaults).
     */
    protected List<Parameter> positionalParameters(JsonNode node, DeserializationContext ctxt) throws IOException {
        JsonNode arguments = node.get("args");
        if (arguments == null || !arguments.isObject()) {
            return ctxt.reportInputMismatch(this, "'args' of %s must be an arguments object", node.path(TYPE_FIELD).asText());
        }
        for (String field : new String[] {"vararg", "kwonlyargs", "kw_defaults", "kwarg", "defaults"}) {
            if (isPresent(arguments, field)) {
                return null;
            }
        }
        List<Parameter> parameters = new ArrayList<>();
        for (String field : new String[] {"posonlyargs", "args"}) {
            for (JsonNode arg : arguments.path(field)) {
                parameters.add(new Parameter(line(arg), column(arg), text(arg, "arg", ctxt)));
            }
        }
        return parameters;
    }

    protected static boolean isPresent(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        return !value.isArray() || !value.isEmpty();
    }
}
