package org.databaseclone.clone.models;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.Value;

/** A document as returned by the service: service metadata fields plus user fields. */
@Value
public class Document {
    public static final String ID_FIELD = "$id";
    public static final String COLLECTION_ID_FIELD = "$collectionId";
    public static final String DATABASE_ID_FIELD = "$databaseId";

    /** Service metadata the service assigns itself and refuses on create. */
    public static final List<String> SERVICE_FIELDS = List.of(
        ID_FIELD,
        COLLECTION_ID_FIELD,
        DATABASE_ID_FIELD,
        "$createdAt",
        "$updatedAt",
        "$permissions",
        "$sequence"
    );

    @NonNull
    FieldValue.MapValue fields;

    public String getId() {
        return fields.getString(ID_FIELD).orElse(null);
    }

    public String getCollectionId() {
        return fields.getString(COLLECTION_ID_FIELD).orElse(null);
    }

    public FieldValue get(String key) {
        return fields.get(key).orElse(FieldValue.NULL);
    }

    public static Document fromJson(JsonNode node) {
        return new Document(FieldValues.mapFromJson(node));
    }

    /** A map carrying both an id and a collection id is an expanded related document. */
    public static boolean isRelationshipExpansion(FieldValue value) {
        return value instanceof FieldValue.MapValue
            && ((FieldValue.MapValue) value).containsKey(ID_FIELD)
            && ((FieldValue.MapValue) value).containsKey(COLLECTION_ID_FIELD);
    }
}
