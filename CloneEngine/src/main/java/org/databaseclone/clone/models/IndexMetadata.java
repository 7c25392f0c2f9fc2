package org.databaseclone.clone.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/** An index over one or more attribute keys; {@code type} is key, unique or fulltext. */
public record IndexMetadata(
    String key,
    String type,
    List<String> attributes,
    List<String> orders,
    SchemaStatus status
) {
    public IndexMetadata {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        orders = orders == null ? List.of() : List.copyOf(orders);
    }

    public IndexMetadata withStatus(SchemaStatus newStatus) {
        return new IndexMetadata(key, type, attributes, orders, newStatus);
    }

    public static IndexMetadata fromJson(JsonNode node) {
        var attributes = new ArrayList<String>();
        node.path("attributes").forEach(a -> attributes.add(a.asText()));
        var orders = new ArrayList<String>();
        node.path("orders").forEach(o -> orders.add(o.asText()));
        return new IndexMetadata(
            node.path("key").asText(),
            node.path("type").asText(),
            attributes,
            orders,
            SchemaStatus.fromString(node.path("status").asText(null))
        );
    }
}
