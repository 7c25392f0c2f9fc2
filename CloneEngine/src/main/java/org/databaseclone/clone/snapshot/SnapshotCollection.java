package org.databaseclone.clone.snapshot;

import java.util.List;

import org.databaseclone.clone.models.Document;

public record SnapshotCollection(String collectionId, String collectionName, List<Document> documents) {
    public SnapshotCollection {
        documents = List.copyOf(documents);
    }

    public int documentCount() {
        return documents.size();
    }
}
