package org.databaseclone.clone.models;

import java.util.Arrays;
import java.util.Locale;

/** Readiness of an attribute or index on the service side. */
public enum SchemaStatus {
    PROCESSING,
    AVAILABLE,
    DELETING,
    STUCK,
    FAILED,
    UNKNOWN;

    public static SchemaStatus fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.name().equals(normalized))
            .findFirst()
            .orElse(UNKNOWN);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
