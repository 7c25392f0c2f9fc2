package org.databaseclone.clone.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.common.ObjectMapperFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

/** Conversions between {@link FieldValue} trees and Jackson JSON trees. */
@UtilityClass
public class FieldValues {
    private static final ObjectMapper objectMapper = ObjectMapperFactory.createDefaultMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.withExactBigDecimals(true);

    public static FieldValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldValue.NULL;
        } else if (node.isBoolean()) {
            return new FieldValue.BooleanValue(node.booleanValue());
        } else if (node.isNumber()) {
            return new FieldValue.NumberValue(node.decimalValue());
        } else if (node.isTextual()) {
            return new FieldValue.StringValue(node.textValue());
        } else if (node.isArray()) {
            var values = new ArrayList<FieldValue>(node.size());
            node.forEach(child -> values.add(fromJson(child)));
            return new FieldValue.ListValue(values);
        } else if (node.isObject()) {
            return mapFromJson(node);
        }
        throw new CloneException("Unsupported JSON value in document: " + node.getNodeType());
    }

    public static FieldValue.MapValue mapFromJson(JsonNode node) {
        var entries = new LinkedHashMap<String, FieldValue>();
        node.fields().forEachRemaining(e -> entries.put(e.getKey(), fromJson(e.getValue())));
        return new FieldValue.MapValue(entries);
    }

    public static JsonNode toJson(FieldValue value) {
        if (value instanceof FieldValue.NullValue) {
            return nodes.nullNode();
        } else if (value instanceof FieldValue.BooleanValue) {
            return nodes.booleanNode(((FieldValue.BooleanValue) value).value());
        } else if (value instanceof FieldValue.NumberValue) {
            return nodes.numberNode(((FieldValue.NumberValue) value).value());
        } else if (value instanceof FieldValue.StringValue) {
            return nodes.textNode(((FieldValue.StringValue) value).value());
        } else if (value instanceof FieldValue.ListValue) {
            ArrayNode array = nodes.arrayNode();
            ((FieldValue.ListValue) value).values().forEach(v -> array.add(toJson(v)));
            return array;
        }
        return toJson((FieldValue.MapValue) value);
    }

    public static ObjectNode toJson(FieldValue.MapValue value) {
        ObjectNode object = nodes.objectNode();
        value.entries().forEach((k, v) -> object.set(k, toJson(v)));
        return object;
    }

    /** Compact JSON text, keys in their stored order. */
    public static String toCompactJson(FieldValue value) {
        try {
            return objectMapper.writeValueAsString(toJson(value));
        } catch (JsonProcessingException e) {
            throw new CloneException("Unable to serialize document value", e);
        }
    }

    /**
     * Renders a value the way it reads in a text cell: strings as-is, numbers in plain notation,
     * lists and maps as compact JSON, null as the empty string.
     */
    public static String asText(FieldValue value) {
        if (value instanceof FieldValue.NullValue) {
            return "";
        } else if (value instanceof FieldValue.StringValue) {
            return ((FieldValue.StringValue) value).value();
        } else if (value instanceof FieldValue.NumberValue) {
            return ((FieldValue.NumberValue) value).value().toPlainString();
        } else if (value instanceof FieldValue.BooleanValue) {
            return Boolean.toString(((FieldValue.BooleanValue) value).value());
        }
        return toCompactJson(value);
    }
}
