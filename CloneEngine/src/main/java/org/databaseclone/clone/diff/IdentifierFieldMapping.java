package org.databaseclone.clone.diff;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Collection id to the user field that identifies its documents across databases. */
@EqualsAndHashCode
@ToString
public class IdentifierFieldMapping {
    private static final IdentifierFieldMapping EMPTY = new IdentifierFieldMapping(Map.of());

    private final Map<String, String> fieldsByCollection;

    private IdentifierFieldMapping(Map<String, String> fieldsByCollection) {
        this.fieldsByCollection = fieldsByCollection;
    }

    public static IdentifierFieldMapping empty() {
        return EMPTY;
    }

    public static IdentifierFieldMapping of(Map<String, String> fieldsByCollection) {
        var copy = new LinkedHashMap<String, String>();
        fieldsByCollection.forEach((collection, field) -> {
            if (collection != null && field != null && !field.isBlank()) {
                copy.put(collection, field.trim());
            }
        });
        return new IdentifierFieldMapping(Map.copyOf(copy));
    }

    public Optional<String> fieldFor(String collectionId) {
        return Optional.ofNullable(fieldsByCollection.get(collectionId));
    }

    public Map<String, String> asMap() {
        return fieldsByCollection;
    }
}
