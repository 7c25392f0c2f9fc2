package org.databaseclone.clone.models;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A value stored in a document field.  Documents are schemaless from the point of view of this
 * tool, so every field is one of these variants, nested arbitrarily.
 */
public sealed interface FieldValue
    permits FieldValue.NullValue, FieldValue.BooleanValue, FieldValue.NumberValue,
        FieldValue.StringValue, FieldValue.ListValue, FieldValue.MapValue {

    NullValue NULL = new NullValue();

    static FieldValue of(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static FieldValue of(Number value) {
        if (value == null) {
            return NULL;
        }
        return new NumberValue(value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString()));
    }

    static FieldValue of(boolean value) {
        return new BooleanValue(value);
    }

    default boolean isNull() {
        return this instanceof NullValue;
    }

    record NullValue() implements FieldValue {}

    record BooleanValue(boolean value) implements FieldValue {}

    record NumberValue(BigDecimal value) implements FieldValue {}

    record StringValue(String value) implements FieldValue {}

    record ListValue(List<FieldValue> values) implements FieldValue {
        public ListValue {
            values = List.copyOf(values);
        }
    }

    /** Keyed fields in their original order. */
    record MapValue(Map<String, FieldValue> entries) implements FieldValue {
        public static final MapValue EMPTY = new MapValue(Map.of());

        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public Optional<FieldValue> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public Optional<String> getString(String key) {
            var value = entries.get(key);
            return value instanceof StringValue ? Optional.of(((StringValue) value).value()) : Optional.empty();
        }
    }
}
