package org.databaseclone.clone.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Everything that happened while replicating one collection's structure.  A collection counts as
 * cloned when it was created and none of its attributes failed; index failures are reported but
 * do not fail the collection.
 */
@ToString
public class CollectionCloneResult {
    @Getter
    private final String collectionId;
    @Getter
    private final String collectionName;
    private final List<CreationResult> attributes = new ArrayList<>();
    private final List<CreationResult> indexes = new ArrayList<>();
    @Getter
    private Exception collectionError;

    public CollectionCloneResult(@NonNull String collectionId, String collectionName) {
        this.collectionId = collectionId;
        this.collectionName = collectionName;
    }

    void addAttribute(CreationResult result) {
        attributes.add(result);
    }

    void addIndex(CreationResult result) {
        indexes.add(result);
    }

    void failCollection(Exception e) {
        this.collectionError = e;
    }

    public List<CreationResult> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    public List<CreationResult> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    public List<CreationResult> getFailedAttributes() {
        return attributes.stream().filter(CreationResult::wasFatal).collect(Collectors.toList());
    }

    public List<CreationResult> getFailedIndexes() {
        return indexes.stream().filter(CreationResult::wasFatal).collect(Collectors.toList());
    }

    /** Non fatal outcomes worth reporting, such as readiness timeouts under the continue policy. */
    public List<CreationResult> getWarnings() {
        var warnings = new ArrayList<CreationResult>();
        attributes.stream().filter(r -> !r.wasSuccessful() && !r.wasFatal()
            && r.getFailureType() != CreationResult.CreationFailureType.SKIPPED_CHILD_RELATIONSHIP)
            .forEach(warnings::add);
        indexes.stream().filter(r -> !r.wasSuccessful() && !r.wasFatal()).forEach(warnings::add);
        return warnings;
    }

    public boolean wasSuccessful() {
        return collectionError == null && getFailedAttributes().isEmpty();
    }

    /** Why the collection failed, or null when it did not. */
    public String errorMessage() {
        if (collectionError != null) {
            return collectionError.getMessage();
        }
        var failed = getFailedAttributes().size();
        return failed == 0 ? null : failed + " attribute(s) failed to create";
    }
}
