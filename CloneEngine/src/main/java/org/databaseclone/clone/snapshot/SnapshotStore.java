package org.databaseclone.clone.snapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.common.ObjectMapperFactory;
import org.databaseclone.clone.models.Document;
import org.databaseclone.clone.models.FieldValues;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists a {@link Snapshot} as a JSON file.  The file stays behind when a run fails part way
 * through writing so the fetched data can be inspected.
 */
@Slf4j
public class SnapshotStore {
    public static final String DEFAULT_FILE_NAME = ".database-clone-cache.json";

    private final ObjectMapper objectMapper;
    @Getter
    private final Path path;

    public SnapshotStore(Path path) {
        this.path = path;
        this.objectMapper = ObjectMapperFactory.createDefaultMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Snapshot snapshot) {
        var root = objectMapper.createObjectNode();
        root.put("sourceId", snapshot.sourceId());
        root.put("destId", snapshot.destId());
        root.put("fetchedAt", snapshot.fetchedAt());
        var collections = root.putArray("collections");
        for (var collection : snapshot.collections()) {
            var node = collections.addObject();
            node.put("collectionId", collection.collectionId());
            node.put("collectionName", collection.collectionName());
            node.put("documentCount", collection.documentCount());
            var documents = node.putArray("documents");
            collection.documents().forEach(d -> documents.add(FieldValues.toJson(d.getFields())));
        }

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), root);
        } catch (IOException e) {
            throw new CloneException("Unable to write snapshot to " + path, e);
        }
        log.atInfo().setMessage("Saved {} documents to {}").addArgument(snapshot::documentCount).addArgument(path).log();
    }

    public Snapshot read() {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new CloneException("Unable to read snapshot from " + path, e);
        }
        var collections = new ArrayList<SnapshotCollection>();
        for (var node : root.path("collections")) {
            var documents = new ArrayList<Document>();
            node.path("documents").forEach(d -> documents.add(Document.fromJson(d)));
            collections.add(new SnapshotCollection(
                node.path("collectionId").asText(),
                node.path("collectionName").asText(),
                documents
            ));
        }
        return new Snapshot(
            root.path("sourceId").asText(null),
            root.path("destId").asText(null),
            root.path("fetchedAt").asText(null),
            collections
        );
    }

    public boolean exists() {
        return Files.exists(path);
    }

    public void delete() {
        try {
            if (Files.deleteIfExists(path)) {
                log.atInfo().setMessage("Removed snapshot {}").addArgument(path).log();
            }
        } catch (IOException e) {
            throw new CloneException("Unable to delete snapshot " + path, e);
        }
    }
}
