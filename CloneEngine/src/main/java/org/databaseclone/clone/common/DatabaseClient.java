package org.databaseclone.clone.common;

import java.util.List;
import java.util.Optional;

import org.databaseclone.clone.models.AttributeMetadata;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.DatabaseInfo;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValue;
import org.databaseclone.clone.models.IndexMetadata;

/**
 * The remote operations the clone needs from the document database service.  Every call is
 * blocking and throws {@link DatabaseApiException} when the service rejects it.  Listing calls
 * return a single page; see {@link org.databaseclone.clone.paging.Paginator} for traversal.
 */
public interface DatabaseClient {
    Optional<DatabaseInfo> getDatabase(String databaseId);

    List<CollectionMetadata> listCollections(String databaseId, PageRequest page);

    void createCollection(String databaseId, CollectionMetadata collection);

    void deleteCollection(String databaseId, String collectionId);

    List<AttributeMetadata> listAttributes(String databaseId, String collectionId, PageRequest page);

    /** Submits the attribute through the create call for its type.  The attribute starts out processing. */
    void createAttribute(String databaseId, String collectionId, AttributeMetadata attribute);

    List<IndexMetadata> listIndexes(String databaseId, String collectionId, PageRequest page);

    void createIndex(String databaseId, String collectionId, IndexMetadata index);

    List<Document> listDocuments(String databaseId, String collectionId, PageRequest page);

    void createDocument(String databaseId, String collectionId, String documentId, FieldValue.MapValue data);
}
