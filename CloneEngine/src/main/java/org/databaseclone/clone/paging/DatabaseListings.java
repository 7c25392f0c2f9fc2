package org.databaseclone.clone.paging;

import java.util.List;

import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.models.AttributeMetadata;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.IndexMetadata;

import lombok.AllArgsConstructor;

/** Complete listings of a database's contents, one paginated traversal per call. */
@AllArgsConstructor
public class DatabaseListings {
    private final DatabaseClient client;

    public List<CollectionMetadata> allCollections(String databaseId) {
        return new Paginator<>(
            Paginator.SCHEMA_PAGE_SIZE,
            page -> client.listCollections(databaseId, page),
            CollectionMetadata::id
        ).fetchAll();
    }

    public List<AttributeMetadata> allAttributes(String databaseId, String collectionId) {
        return new Paginator<>(
            Paginator.SCHEMA_PAGE_SIZE,
            page -> client.listAttributes(databaseId, collectionId, page),
            AttributeMetadata::getKey
        ).fetchAll();
    }

    public List<IndexMetadata> allIndexes(String databaseId, String collectionId) {
        return new Paginator<>(
            Paginator.SCHEMA_PAGE_SIZE,
            page -> client.listIndexes(databaseId, collectionId, page),
            IndexMetadata::key
        ).fetchAll();
    }

    public List<Document> allDocuments(String databaseId, String collectionId, int batchSize) {
        return new Paginator<>(
            batchSize,
            page -> client.listDocuments(databaseId, collectionId, page),
            Document::getId
        ).fetchAll();
    }
}
