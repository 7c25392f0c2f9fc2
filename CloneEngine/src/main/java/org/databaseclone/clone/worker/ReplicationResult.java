package org.databaseclone.clone.worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.databaseclone.clone.schema.CollectionCloneResult;
import org.databaseclone.clone.schema.CreationResult;

import lombok.Getter;
import lombok.ToString;

/**
 * Everything a clone run did.  Failures of individual collections, attributes, indexes and
 * documents are collected here rather than thrown.
 */
@ToString
public class ReplicationResult {
    @Getter
    private final CloneMode mode;
    private final List<CreationResult> droppedCollections = new ArrayList<>();
    private final List<CollectionCloneResult> collections = new ArrayList<>();
    @Getter
    private final DocumentResults documents = new DocumentResults();

    public ReplicationResult(CloneMode mode) {
        this.mode = mode;
    }

    void addDropped(CreationResult result) {
        droppedCollections.add(result);
    }

    void addCollection(CollectionCloneResult result) {
        collections.add(result);
    }

    public List<CreationResult> getDroppedCollections() {
        return Collections.unmodifiableList(droppedCollections);
    }

    public List<CollectionCloneResult> getCollections() {
        return Collections.unmodifiableList(collections);
    }

    public long getDroppedCount() {
        return droppedCollections.stream().filter(CreationResult::wasSuccessful).count();
    }

    public List<CreationResult> getDropErrors() {
        return droppedCollections.stream().filter(r -> !r.wasSuccessful()).collect(Collectors.toList());
    }

    public long getCollectionSuccessCount() {
        return collections.stream().filter(CollectionCloneResult::wasSuccessful).count();
    }

    public long getCollectionFailureCount() {
        return collections.size() - getCollectionSuccessCount();
    }

    public long getIndexFailureCount() {
        return collections.stream().mapToLong(c -> c.getFailedIndexes().size()).sum();
    }

    /** Errors the run reports: drop errors, failed collections, failed indexes and failed documents. */
    public int errorCount() {
        return (int) (getDropErrors().size() + getCollectionFailureCount() + getIndexFailureCount() + documents.getFailed());
    }
}
