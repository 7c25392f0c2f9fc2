package org.databaseclone.clone.diff;

import java.util.ArrayList;
import java.util.List;

import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.paging.DatabaseListings;
import org.databaseclone.clone.sanitize.DocumentSanitizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Finds the source documents a destination collection does not have yet.  Without an identifier
 * field only exact duplicates of the sanitized content are recognized.
 */
@Slf4j
public class DiffEngine {
    private final DatabaseListings listings;
    private final IdentifierFieldMapping identifierFields;
    private final DocumentSanitizer sanitizer;
    private final int batchSize;

    public DiffEngine(DatabaseClient client, IdentifierFieldMapping identifierFields, DocumentSanitizer sanitizer, int batchSize) {
        this.listings = new DatabaseListings(client);
        this.identifierFields = identifierFields;
        this.sanitizer = sanitizer;
        this.batchSize = batchSize;
    }

    public record Selection(List<Document> missing, int skipped) {}

    public ExistingRecordSet existingRecords(String destDatabaseId, String collectionId) {
        var existing = new ExistingRecordSet(identifierFields.fieldFor(collectionId), sanitizer);
        listings.allDocuments(destDatabaseId, collectionId, batchSize).forEach(existing::add);
        log.atInfo().setMessage("Collection {} has {} existing records on the destination, compared by {}")
            .addArgument(collectionId)
            .addArgument(existing::size)
            .addArgument(() -> existing.getIdentifierField().map(f -> "field " + f).orElse("content"))
            .log();
        return existing;
    }

    public Selection selectMissing(String destDatabaseId, String collectionId, List<Document> sourceDocuments) {
        var existing = existingRecords(destDatabaseId, collectionId);
        var missing = new ArrayList<Document>();
        for (var document : sourceDocuments) {
            if (!existing.contains(document)) {
                missing.add(document);
            }
        }
        return new Selection(missing, sourceDocuments.size() - missing.size());
    }
}
