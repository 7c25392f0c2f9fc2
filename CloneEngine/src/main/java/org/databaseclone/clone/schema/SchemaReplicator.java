package org.databaseclone.clone.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.models.AttributeMetadata;
import org.databaseclone.clone.models.AttributeType;
import org.databaseclone.clone.models.CollectionMetadata;
import org.databaseclone.clone.models.IndexMetadata;
import org.databaseclone.clone.models.SchemaStatus;
import org.databaseclone.clone.paging.DatabaseListings;
import org.databaseclone.clone.schema.CreationResult.CreationFailureType;

import lombok.extern.slf4j.Slf4j;

/**
 * Recreates a collection's structure on the destination: the collection itself, then each
 * attribute, then each index.  Attributes and indexes are built asynchronously by the service,
 * so every submission is followed by a readiness poll before the next one goes out.
 */
@Slf4j
public class SchemaReplicator {
    private final DatabaseClient client;
    private final DatabaseListings listings;
    private final ReadinessPoller attributePoller;
    private final ReadinessPoller indexPoller;
    private final ReadinessTimeoutPolicy timeoutPolicy;

    public SchemaReplicator(
        DatabaseClient client,
        PollPolicy attributePolicy,
        PollPolicy indexPolicy,
        ReadinessTimeoutPolicy timeoutPolicy,
        Sleeper sleeper
    ) {
        this.client = client;
        this.listings = new DatabaseListings(client);
        this.attributePoller = new ReadinessPoller(attributePolicy, sleeper);
        this.indexPoller = new ReadinessPoller(indexPolicy, sleeper);
        this.timeoutPolicy = timeoutPolicy;
    }

    public CollectionCloneResult replicate(String sourceDatabaseId, String destDatabaseId, CollectionMetadata collection) {
        var result = new CollectionCloneResult(collection.id(), collection.name());
        log.atInfo().setMessage("Creating collection {} ({})").addArgument(collection.name()).addArgument(collection.id()).log();
        try {
            client.createCollection(destDatabaseId, collection);
        } catch (CloneException e) {
            log.atError().setMessage("Unable to create collection {}").addArgument(collection.id()).setCause(e).log();
            result.failCollection(e);
            return result;
        }

        try {
            var available = new HashSet<String>();
            for (var attribute : listings.allAttributes(sourceDatabaseId, collection.id())) {
                var outcome = createAttribute(destDatabaseId, collection.id(), attribute);
                result.addAttribute(outcome);
                if (outcome.wasSuccessful()) {
                    available.add(attribute.getKey());
                }
            }

            for (var index : listings.allIndexes(sourceDatabaseId, collection.id())) {
                result.addIndex(createIndex(destDatabaseId, collection.id(), index, available));
            }
        } catch (CloneException e) {
            log.atError().setMessage("Structure of collection {} could not be completed").addArgument(collection.id()).setCause(e).log();
            result.failCollection(e);
        }

        if (!result.wasSuccessful()) {
            log.atWarn().setMessage("Collection {} failed: {}").addArgument(collection.id()).addArgument(result::errorMessage).log();
        }
        return result;
    }

    private CreationResult createAttribute(String databaseId, String collectionId, AttributeMetadata attribute) {
        var key = attribute.getKey();
        if (attribute.isChildRelationship()) {
            log.atInfo().setMessage("Skipping child side of relationship {}.{}").addArgument(collectionId).addArgument(key).log();
            return CreationResult.failure(key, CreationFailureType.SKIPPED_CHILD_RELATIONSHIP, null);
        }
        if (attribute.getType() == AttributeType.UNKNOWN) {
            log.atWarn().setMessage("Attribute {}.{} has unknown type {}")
                .addArgument(collectionId).addArgument(key).addArgument(attribute.getRawType()).log();
            return CreationResult.failure(key, CreationFailureType.UNSUPPORTED_TYPE,
                new CloneException("Unknown type: " + attribute.getRawType()));
        }

        try {
            log.atInfo().setMessage("Creating {} attribute {}.{}")
                .addArgument(() -> attribute.getType().getWireName()).addArgument(collectionId).addArgument(key).log();
            client.createAttribute(databaseId, collectionId, attribute);
        } catch (CloneException e) {
            log.atError().setMessage("Unable to create attribute {}.{}").addArgument(collectionId).addArgument(key).setCause(e).log();
            return CreationResult.failure(key, CreationFailureType.TARGET_FAILURE, e);
        }

        var outcome = attributePoller.awaitAvailable("Attribute " + collectionId + "." + key,
            () -> attributeStatus(databaseId, collectionId, key));
        return toCreationResult(key, outcome);
    }

    private CreationResult createIndex(String databaseId, String collectionId, IndexMetadata index, Set<String> available) {
        var missing = unavailableAttributes(index, available);
        if (!missing.isEmpty()) {
            // Attributes created as a side effect, or that finished after a timeout, are only visible on the destination
            refreshAvailable(databaseId, collectionId, available);
            missing = unavailableAttributes(index, available);
        }
        if (!missing.isEmpty()) {
            log.atError().setMessage("Not creating index {}.{}, attributes {} are not available")
                .addArgument(collectionId).addArgument(index.key()).addArgument(missing).log();
            return CreationResult.failure(index.key(), CreationFailureType.DEPENDENCY_UNAVAILABLE,
                new CloneException("Index " + index.key() + " references unavailable attributes: " + String.join(", ", missing)));
        }

        try {
            log.atInfo().setMessage("Creating {} index {}.{} on {}")
                .addArgument(index.type()).addArgument(collectionId).addArgument(index.key()).addArgument(index.attributes()).log();
            client.createIndex(databaseId, collectionId, index);
        } catch (CloneException e) {
            log.atError().setMessage("Unable to create index {}.{}").addArgument(collectionId).addArgument(index.key()).setCause(e).log();
            return CreationResult.failure(index.key(), CreationFailureType.TARGET_FAILURE, e);
        }

        var outcome = indexPoller.awaitAvailable("Index " + collectionId + "." + index.key(),
            () -> indexStatus(databaseId, collectionId, index.key()));
        return toCreationResult(index.key(), outcome);
    }

    private CreationResult toCreationResult(String key, ReadinessPoller.Outcome outcome) {
        switch (outcome.state()) {
            case AVAILABLE:
                return CreationResult.success(key);
            case FAILED:
                return CreationResult.failure(key, CreationFailureType.READINESS_FAILED,
                    new CloneException(key + " was reported as failed by the destination database"));
            default:
                var message = key + " was still " + outcome.lastStatus().wireName() + " after " + outcome.attempts() + " attempts";
                if (timeoutPolicy == ReadinessTimeoutPolicy.CONTINUE) {
                    log.atWarn().setMessage("{}, continuing").addArgument(message).log();
                    return CreationResult.failure(key, CreationFailureType.READINESS_TIMEOUT_IGNORED, new CloneException(message));
                }
                return CreationResult.failure(key, CreationFailureType.READINESS_TIMEOUT, new CloneException(message));
        }
    }

    static List<String> unavailableAttributes(IndexMetadata index, Set<String> available) {
        return index.attributes().stream()
            .filter(k -> !k.startsWith("$"))
            .filter(k -> !available.contains(k))
            .collect(Collectors.toList());
    }

    private void refreshAvailable(String databaseId, String collectionId, Set<String> available) {
        listings.allAttributes(databaseId, collectionId).stream()
            .filter(a -> a.getStatus() == SchemaStatus.AVAILABLE)
            .forEach(a -> available.add(a.getKey()));
    }

    private Optional<SchemaStatus> attributeStatus(String databaseId, String collectionId, String key) {
        return listings.allAttributes(databaseId, collectionId).stream()
            .filter(a -> a.getKey().equals(key))
            .map(AttributeMetadata::getStatus)
            .findFirst();
    }

    private Optional<SchemaStatus> indexStatus(String databaseId, String collectionId, String key) {
        return listings.allIndexes(databaseId, collectionId).stream()
            .filter(i -> i.key().equals(key))
            .map(IndexMetadata::status)
            .findFirst();
    }
}
