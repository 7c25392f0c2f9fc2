package org.databaseclone.clone;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.databaseclone.clone.models.AttributeMetadata;
import org.databaseclone.clone.models.AttributeType;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.models.IndexMetadata;
import org.databaseclone.clone.models.SchemaStatus;

import lombok.experimental.UtilityClass;

/** Shorthand for building documents and schema in tests. */
@UtilityClass
public class TestDocuments {

    /** Alternating keys and plain Java values: String, Number, Boolean, List, Map, FieldValue or null. */
    public static FieldValue.MapValue map(Object... keysAndValues) {
        var entries = new LinkedHashMap<String, FieldValue>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put((String) keysAndValues[i], value(keysAndValues[i + 1]));
        }
        return new FieldValue.MapValue(entries);
    }

    public static Document document(Object... keysAndValues) {
        return new Document(map(keysAndValues));
    }

    public static FieldValue value(Object value) {
        if (value == null) {
            return FieldValue.NULL;
        } else if (value instanceof FieldValue) {
            return (FieldValue) value;
        } else if (value instanceof String) {
            return FieldValue.of((String) value);
        } else if (value instanceof Number) {
            return FieldValue.of((Number) value);
        } else if (value instanceof Boolean) {
            return FieldValue.of((Boolean) value);
        } else if (value instanceof List) {
            var values = new ArrayList<FieldValue>();
            ((List<?>) value).forEach(v -> values.add(value(v)));
            return new FieldValue.ListValue(values);
        } else if (value instanceof Map) {
            var entries = new LinkedHashMap<String, FieldValue>();
            ((Map<?, ?>) value).forEach((k, v) -> entries.put((String) k, value(v)));
            return new FieldValue.MapValue(entries);
        }
        throw new IllegalArgumentException("Unsupported test value " + value);
    }

    public static CollectionMetadata collection(String id) {
        return new CollectionMetadata(id, id + "-name", List.of("read(\"any\")"), false, true);
    }

    public static AttributeMetadata stringAttribute(String key) {
        return AttributeMetadata.builder()
            .key(key)
            .type(AttributeType.STRING)
            .rawType("string")
            .size(255)
            .status(SchemaStatus.AVAILABLE)
            .build();
    }

    public static IndexMetadata keyIndex(String key, String... attributes) {
        var orders = new ArrayList<String>();
        for (int i = 0; i < attributes.length; i++) {
            orders.add("ASC");
        }
        return new IndexMetadata(key, "key", List.of(attributes), orders, SchemaStatus.AVAILABLE);
    }
}
