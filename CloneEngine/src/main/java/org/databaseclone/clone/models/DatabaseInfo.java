package org.databaseclone.clone.models;

import com.fasterxml.jackson.databind.JsonNode;

public record DatabaseInfo(String id, String name) {
    public static DatabaseInfo fromJson(JsonNode node) {
        return new DatabaseInfo(node.path("$id").asText(), node.path("name").asText(null));
    }
}
