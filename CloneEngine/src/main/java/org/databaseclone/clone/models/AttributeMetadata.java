package org.databaseclone.clone.models;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Definition of a single attribute of a collection, as listed by the service.  Only the fields
 * relevant to the attribute's type are set.
 */
@Value
@Builder(toBuilder = true)
public class AttributeMetadata {
    @NonNull
    String key;
    @NonNull
    AttributeType type;
    /** Raw type name as reported, kept for error messages about unsupported types */
    String rawType;
    @Builder.Default
    SchemaStatus status = SchemaStatus.AVAILABLE;
    boolean required;
    boolean array;
    @Builder.Default
    FieldValue defaultValue = FieldValue.NULL;
    Integer size;
    BigDecimal min;
    BigDecimal max;
    @Builder.Default
    List<String> elements = List.of();

    String relatedCollection;
    String relationType;
    boolean twoWay;
    String twoWayKey;
    String onDelete;
    RelationSide side;

    public boolean isChildRelationship() {
        return type == AttributeType.RELATIONSHIP && side == RelationSide.CHILD;
    }

    public static AttributeMetadata fromJson(JsonNode node) {
        var rawType = node.path("type").asText(null);
        var elements = new ArrayList<String>();
        node.path("elements").forEach(e -> elements.add(e.asText()));
        return AttributeMetadata.builder()
            .key(node.path("key").asText())
            .type(AttributeType.fromWire(rawType, node.path("format").asText(null)))
            .rawType(rawType)
            .status(SchemaStatus.fromString(node.path("status").asText(null)))
            .required(node.path("required").asBoolean(false))
            .array(node.path("array").asBoolean(false))
            .defaultValue(FieldValues.fromJson(node.get("default")))
            .size(node.hasNonNull("size") ? node.get("size").asInt() : null)
            .min(node.hasNonNull("min") ? node.get("min").decimalValue() : null)
            .max(node.hasNonNull("max") ? node.get("max").decimalValue() : null)
            .elements(elements)
            .relatedCollection(node.path("relatedCollection").asText(null))
            .relationType(node.path("relationType").asText(null))
            .twoWay(node.path("twoWay").asBoolean(false))
            .twoWayKey(node.path("twoWayKey").asText(null))
            .onDelete(node.path("onDelete").asText(null))
            .side(node.has("side") ? RelationSide.fromString(node.get("side").asText()) : null)
            .build();
    }
}
