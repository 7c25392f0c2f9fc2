package org.databaseclone.clone.schema;

import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.ToString;

/** Outcome of creating one collection, attribute or index on the destination. */
@Builder
@Data
@ToString
public class CreationResult implements Comparable<CreationResult> {
    private final String name;
    private final Exception exception;
    private final CreationFailureType failureType;

    public boolean wasSuccessful() {
        return getFailureType() == null;
    }

    public boolean wasFatal() {
        return Optional.ofNullable(getFailureType()).map(CreationFailureType::isFatal)
            .orElse(false);
    }

    /** The service's message when there is one, otherwise the failure type's description. */
    public String errorMessage() {
        if (exception != null && exception.getMessage() != null) {
            return exception.getMessage();
        }
        return Optional.ofNullable(failureType).map(CreationFailureType::getMessage).orElse(null);
    }

    public static CreationResult success(String name) {
        return CreationResult.builder().name(name).build();
    }

    public static CreationResult failure(String name, CreationFailureType type, Exception exception) {
        return CreationResult.builder().name(name).failureType(type).exception(exception).build();
    }

    @AllArgsConstructor
    @Getter
    public enum CreationFailureType {
        TARGET_FAILURE(true, "failed on the destination database"),
        UNSUPPORTED_TYPE(true, "has an unsupported type"),
        READINESS_FAILED(true, "was reported as failed by the destination database"),
        READINESS_TIMEOUT(true, "did not become available in time"),
        READINESS_TIMEOUT_IGNORED(false, "did not become available in time, continuing"),
        DEPENDENCY_UNAVAILABLE(true, "references attributes that are not available"),
        SKIPPED_CHILD_RELATIONSHIP(false, "skipped, created together with its parent relationship");

        private final boolean fatal;
        private final String message;
    }

    @Override
    public int compareTo(CreationResult that) {
        if (this.wasSuccessful() != that.wasSuccessful()) {
            return this.wasSuccessful() ? -1 : 1;
        }
        if (this.getFailureType() != that.getFailureType()) {
            return this.getFailureType().compareTo(that.getFailureType());
        }
        return this.getName().compareTo(that.getName());
    }
}
