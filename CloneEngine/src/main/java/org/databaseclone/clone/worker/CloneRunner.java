package org.databaseclone.clone.worker;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.common.UniqueIdGenerator;
import org.databaseclone.clone.diff.DiffEngine;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.paging.DatabaseListings;
import org.databaseclone.clone.sanitize.DocumentSanitizer;
import org.databaseclone.clone.schema.CreationResult;
import org.databaseclone.clone.schema.SchemaReplicator;
import org.databaseclone.clone.schema.Sleeper;
import org.databaseclone.clone.snapshot.Snapshot;
import org.databaseclone.clone.snapshot.SnapshotCollection;
import org.databaseclone.clone.snapshot.SnapshotStore;
import org.databaseclone.clone.worker.CloneProgressListener.Phase;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a clone from a source database into a destination database in the same project.
 * <ol>
 *   <li>Modes that replicate structure from scratch first drop every destination collection</li>
 *   <li>Each source collection's structure is replicated in source order</li>
 *   <li>Documents are fetched into a snapshot file, read back, optionally reduced to the ones
 *       missing on the destination, sanitized and created under fresh ids</li>
 * </ol>
 * The snapshot file is removed only once the write phase completed.
 */
@Slf4j
public class CloneRunner {
    private final DatabaseClient client;
    private final CloneOptions options;
    private final CloneProgressListener listener;
    private final DatabaseListings listings;
    private final SchemaReplicator schemaReplicator;
    private final DiffEngine diffEngine;
    private final DocumentSanitizer sanitizer;
    private final SnapshotStore snapshotStore;
    private final Supplier<String> idGenerator;
    private final Clock clock;

    @Builder
    private CloneRunner(
        @NonNull DatabaseClient client,
        @NonNull CloneOptions options,
        CloneProgressListener listener,
        Sleeper sleeper,
        Supplier<String> idGenerator,
        Clock clock
    ) {
        this.client = client;
        this.options = options;
        this.listener = listener != null ? listener : CloneProgressListener.NONE;
        this.listings = new DatabaseListings(client);
        this.sanitizer = new DocumentSanitizer();
        this.schemaReplicator = new SchemaReplicator(
            client,
            options.getAttributePollPolicy(),
            options.getIndexPollPolicy(),
            options.getReadinessTimeoutPolicy(),
            sleeper != null ? sleeper : Sleeper.THREAD_SLEEPER
        );
        this.diffEngine = new DiffEngine(client, options.getIdentifierFields(), sanitizer, options.getBatchSize());
        this.snapshotStore = new SnapshotStore(options.getSnapshotPath());
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.idGenerator = idGenerator != null ? idGenerator : new UniqueIdGenerator(this.clock, new SecureRandom());
    }

    public ReplicationResult run(String sourceDatabaseId, String destDatabaseId) {
        var mode = options.getMode();
        var result = new ReplicationResult(mode);
        log.atInfo().setMessage("Starting {} clone from {} to {} with batch size {}")
            .addArgument(mode).addArgument(sourceDatabaseId).addArgument(destDatabaseId).addArgument(options.getBatchSize()).log();

        if (mode.dropsDestination()) {
            dropDestinationCollections(destDatabaseId, result);
        }

        var collections = listings.allCollections(sourceDatabaseId);
        if (collections.isEmpty()) {
            log.atInfo().setMessage("No collections found in source database {}").addArgument(sourceDatabaseId).log();
            return result;
        }
        log.atInfo().setMessage("Found {} collections to clone").addArgument(collections.size()).log();

        if (mode.isCloneStructure()) {
            replicateStructure(sourceDatabaseId, destDatabaseId, collections, result);
        }

        if (mode.copiesDocuments()) {
            copyDocuments(sourceDatabaseId, destDatabaseId, collections, result);
        }
        return result;
    }

    private void dropDestinationCollections(String destDatabaseId, ReplicationResult result) {
        var existing = listings.allCollections(destDatabaseId);
        listener.phaseStarted(Phase.DROP, existing.size());
        int done = 0;
        for (var collection : existing) {
            CreationResult outcome;
            try {
                client.deleteCollection(destDatabaseId, collection.id());
                outcome = CreationResult.success(collection.name());
            } catch (CloneException e) {
                log.atWarn().setMessage("Unable to drop collection {}").addArgument(collection.id()).setCause(e).log();
                outcome = CreationResult.failure(collection.name(), CreationResult.CreationFailureType.TARGET_FAILURE, e);
            }
            result.addDropped(outcome);
            listener.itemCompleted(Phase.DROP, collection.name(), outcome.wasSuccessful(), ++done, existing.size());
        }
        listener.phaseCompleted(Phase.DROP);
        log.atInfo().setMessage("Dropped {} collections, {} errors")
            .addArgument(result::getDroppedCount).addArgument(() -> result.getDropErrors().size()).log();
    }

    private void replicateStructure(
        String sourceDatabaseId,
        String destDatabaseId,
        List<CollectionMetadata> collections,
        ReplicationResult result
    ) {
        listener.phaseStarted(Phase.STRUCTURE, collections.size());
        int done = 0;
        for (var collection : collections) {
            var outcome = schemaReplicator.replicate(sourceDatabaseId, destDatabaseId, collection);
            result.addCollection(outcome);
            listener.itemCompleted(Phase.STRUCTURE, collection.name(), outcome.wasSuccessful(), ++done, collections.size());
        }
        listener.phaseCompleted(Phase.STRUCTURE);
        log.atInfo().setMessage("Structures completed: {} success, {} failed")
            .addArgument(result::getCollectionSuccessCount).addArgument(result::getCollectionFailureCount).log();
    }

    private void copyDocuments(
        String sourceDatabaseId,
        String destDatabaseId,
        List<CollectionMetadata> collections,
        ReplicationResult result
    ) {
        snapshotStore.write(fetchSnapshot(sourceDatabaseId, destDatabaseId, collections));
        var snapshot = snapshotStore.read();

        var queue = new ArrayList<SnapshotCollection>();
        if (options.getMode().isMissingOnly()) {
            listener.phaseStarted(Phase.DIFF, snapshot.collections().size());
            int done = 0;
            for (var collection : snapshot.collections()) {
                var selection = diffEngine.selectMissing(destDatabaseId, collection.collectionId(), collection.documents());
                log.atInfo().setMessage("{}: {} missing of {} total")
                    .addArgument(collection.collectionName())
                    .addArgument(() -> selection.missing().size())
                    .addArgument(collection::documentCount)
                    .log();
                result.getDocuments().recordSkipped(selection.skipped());
                queue.add(new SnapshotCollection(collection.collectionId(), collection.collectionName(), selection.missing()));
                listener.itemCompleted(Phase.DIFF, collection.collectionName(), true, ++done, snapshot.collections().size());
            }
            listener.phaseCompleted(Phase.DIFF);
        } else {
            queue.addAll(snapshot.collections());
        }

        writeDocuments(destDatabaseId, queue, result);
        snapshotStore.delete();
    }

    private Snapshot fetchSnapshot(String sourceDatabaseId, String destDatabaseId, List<CollectionMetadata> collections) {
        listener.phaseStarted(Phase.FETCH, collections.size());
        var fetched = new ArrayList<SnapshotCollection>();
        int done = 0;
        for (var collection : collections) {
            var documents = listings.allDocuments(sourceDatabaseId, collection.id(), options.getBatchSize());
            log.atInfo().setMessage("{}: {} documents").addArgument(collection.name()).addArgument(documents::size).log();
            fetched.add(new SnapshotCollection(collection.id(), collection.name(), documents));
            listener.itemCompleted(Phase.FETCH, collection.name(), true, ++done, collections.size());
        }
        listener.phaseCompleted(Phase.FETCH);
        return new Snapshot(sourceDatabaseId, destDatabaseId, clock.instant().toString(), fetched);
    }

    private void writeDocuments(String destDatabaseId, List<SnapshotCollection> queue, ReplicationResult result) {
        var total = queue.stream().mapToInt(SnapshotCollection::documentCount).sum();
        log.atInfo().setMessage("Documents to insert: {}").addArgument(total).log();
        listener.phaseStarted(Phase.WRITE, total);
        int done = 0;
        for (var collection : queue) {
            for (var document : collection.documents()) {
                var success = writeDocument(destDatabaseId, collection, document, result);
                listener.itemCompleted(Phase.WRITE, collection.collectionName(), success, ++done, total);
            }
        }
        listener.phaseCompleted(Phase.WRITE);
        log.atInfo().setMessage("Documents completed: {} success, {} failed, {} skipped")
            .addArgument(() -> result.getDocuments().getSuccess())
            .addArgument(() -> result.getDocuments().getFailed())
            .addArgument(() -> result.getDocuments().getSkipped())
            .log();
    }

    private boolean writeDocument(String destDatabaseId, SnapshotCollection collection, Document document, ReplicationResult result) {
        var data = sanitizer.sanitize(document);
        try {
            client.createDocument(destDatabaseId, collection.collectionId(), idGenerator.get(), data);
            result.getDocuments().recordSuccess();
            return true;
        } catch (CloneException e) {
            log.atWarn().setMessage("Unable to copy document {} of {}: {}")
                .addArgument(document::getId).addArgument(collection.collectionName()).addArgument(e::getMessage).log();
            result.getDocuments().recordFailure(collection.collectionName(), new DocumentFailure(document.getId(), e.getMessage()));
            return false;
        }
    }
}
