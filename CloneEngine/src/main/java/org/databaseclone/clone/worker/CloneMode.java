package org.databaseclone.clone.worker;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum CloneMode {
    FULL("full", true, true, false),
    STRUCTURE_ONLY("structure-only", true, false, false),
    DATA_ONLY("data-only", false, true, false),
    MISSING_ONLY("missing-only", false, false, true);

    private final String label;
    private final boolean cloneStructure;
    private final boolean cloneData;
    private final boolean missingOnly;

    /** Whether this mode drops every destination collection before replicating structure. */
    public boolean dropsDestination() {
        return cloneStructure && !missingOnly;
    }

    public boolean copiesDocuments() {
        return cloneData || missingOnly;
    }

    public static CloneMode fromLabel(String value) {
        var normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
            .filter(m -> m.label.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown clone mode '" + value + "', expected one of "
                + Arrays.stream(values()).map(CloneMode::getLabel).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return label;
    }
}
