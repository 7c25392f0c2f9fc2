package org.databaseclone.clone.snapshot;

import java.util.List;

/** The source documents fetched for a run, kept on disk until the run has written them. */
public record Snapshot(String sourceId, String destId, String fetchedAt, List<SnapshotCollection> collections) {
    public Snapshot {
        collections = List.copyOf(collections);
    }

    public int documentCount() {
        return collections.stream().mapToInt(SnapshotCollection::documentCount).sum();
    }
}
