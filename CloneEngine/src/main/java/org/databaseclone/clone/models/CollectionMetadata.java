package org.databaseclone.clone.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record CollectionMetadata(
    String id,
    String name,
    List<String> permissions,
    boolean documentSecurity,
    boolean enabled
) {
    public CollectionMetadata {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static CollectionMetadata fromJson(JsonNode node) {
        var permissions = new ArrayList<String>();
        node.path("permissions").forEach(p -> permissions.add(p.asText()));
        return new CollectionMetadata(
            node.path("$id").asText(),
            node.path("name").asText(),
            permissions,
            node.path("documentSecurity").asBoolean(false),
            node.path("enabled").asBoolean(true)
        );
    }
}
