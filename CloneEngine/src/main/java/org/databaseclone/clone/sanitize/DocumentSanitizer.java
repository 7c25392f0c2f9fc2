package org.databaseclone.clone.sanitize;

import java.util.ArrayList;
import java.util.LinkedHashMap;

import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;

/**
 * Turns a fetched document into data the service accepts on create.  Service metadata is removed,
 * and related documents the service expanded inline are collapsed back to their ids.
 */
public class DocumentSanitizer {

    public FieldValue.MapValue sanitize(Document document) {
        var cleaned = new LinkedHashMap<String, FieldValue>();
        document.getFields().entries().forEach((key, value) -> {
            if (!Document.SERVICE_FIELDS.contains(key)) {
                cleaned.put(key, cleanField(value));
            }
        });
        return new FieldValue.MapValue(cleaned);
    }

    private FieldValue cleanField(FieldValue value) {
        if (value instanceof FieldValue.ListValue) {
            var cleaned = new ArrayList<FieldValue>();
            for (var item : ((FieldValue.ListValue) value).values()) {
                if (Document.isRelationshipExpansion(item)) {
                    cleaned.add(idOf(item));
                } else if (item instanceof FieldValue.MapValue) {
                    cleaned.add(cleanNested((FieldValue.MapValue) item));
                } else {
                    cleaned.add(item);
                }
            }
            return new FieldValue.ListValue(cleaned);
        } else if (Document.isRelationshipExpansion(value)) {
            return idOf(value);
        } else if (value instanceof FieldValue.MapValue) {
            return cleanNested((FieldValue.MapValue) value);
        }
        return value;
    }

    /** Below the top level only service metadata is stripped, related documents are not collapsed. */
    private FieldValue.MapValue cleanNested(FieldValue.MapValue object) {
        var cleaned = new LinkedHashMap<String, FieldValue>();
        object.entries().forEach((key, value) -> {
            if (Document.SERVICE_FIELDS.contains(key)) {
                return;
            }
            if (value instanceof FieldValue.MapValue) {
                cleaned.put(key, cleanNested((FieldValue.MapValue) value));
            } else if (value instanceof FieldValue.ListValue) {
                var items = new ArrayList<FieldValue>();
                for (var item : ((FieldValue.ListValue) value).values()) {
                    items.add(item instanceof FieldValue.MapValue ? cleanNested((FieldValue.MapValue) item) : item);
                }
                cleaned.put(key, new FieldValue.ListValue(items));
            } else {
                cleaned.put(key, value);
            }
        });
        return new FieldValue.MapValue(cleaned);
    }

    private static FieldValue idOf(FieldValue relationshipExpansion) {
        return ((FieldValue.MapValue) relationshipExpansion).get(Document.ID_FIELD).orElse(FieldValue.NULL);
    }
}
