package org.databaseclone.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.databaseclone.clone.schema.CollectionCloneResult;
import org.databaseclone.clone.schema.CreationResult;
import org.databaseclone.clone.worker.ReplicationResult;
import org.databaseclone.commands.JsonOutput;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;

/**
 * What a clone run replicated, rendered for the console or as JSON.  Sections only appear for
 * the phases the clone mode ran.
 */
@AllArgsConstructor
public class CloneSummary implements JsonOutput {
    static final String NONE_FOUND_MARKER = "<NONE FOUND>";

    @Getter
    @NonNull
    private final ReplicationResult result;

    public int getErrorCount() {
        return result.errorCount();
    }

    public List<String> getAllErrors() {
        var errors = new ArrayList<String>();
        result.getDropErrors().forEach(r -> errors.add("ERROR - drop " + r.getName() + ": " + r.errorMessage()));
        for (var collection : result.getCollections()) {
            if (!collection.wasSuccessful()) {
                errors.add("ERROR - " + collection.getCollectionName() + " " + collection.errorMessage());
            }
            collection.getFailedAttributes().forEach(r -> errors.add(failureMessage(collection, r)));
            collection.getFailedIndexes().forEach(r -> errors.add(failureMessage(collection, r)));
        }
        result.getDocuments().getFailuresByCollection().forEach((collection, failures) ->
            failures.forEach(f -> errors.add("ERROR - " + collection + " document " + f.documentId() + ": " + f.message())));
        return errors;
    }

    public String asCliOutput() {
        var sb = new StringBuilder();
        var mode = result.getMode();
        sb.append("Clone Results (" + mode + "):" + System.lineSeparator());

        if (mode.dropsDestination()) {
            sb.append(Format.indentToLevel(1))
                .append("Dropped collections: ")
                .append(result.getDroppedCount())
                .append(System.lineSeparator());
        }

        if (mode.isCloneStructure()) {
            appendCollections(sb);
        }

        if (mode.copiesDocuments()) {
            appendDocuments(sb);
        }
        return sb.toString();
    }

    private void appendCollections(StringBuilder sb) {
        sb.append(Format.indentToLevel(1))
            .append("Collections cloned: ")
            .append(result.getCollectionSuccessCount())
            .append(", failed: ")
            .append(result.getCollectionFailureCount())
            .append(System.lineSeparator());

        if (result.getCollections().isEmpty()) {
            sb.append(Format.indentToLevel(2)).append(NONE_FOUND_MARKER).append(System.lineSeparator());
            return;
        }

        result.getCollections().stream()
            .filter(CollectionCloneResult::wasSuccessful)
            .map(CollectionCloneResult::getCollectionName)
            .sorted()
            .forEach(name -> sb.append(Format.indentToLevel(2)).append("- ").append(name).append(System.lineSeparator()));

        for (var collection : result.getCollections()) {
            if (!collection.wasSuccessful()) {
                sb.append(Format.indentToLevel(2))
                    .append("ERROR - ")
                    .append(collection.getCollectionName())
                    .append(": ")
                    .append(collection.errorMessage())
                    .append(System.lineSeparator());
            }
            var problems = new ArrayList<CreationResult>();
            problems.addAll(collection.getFailedAttributes());
            problems.addAll(collection.getFailedIndexes());
            problems.addAll(collection.getWarnings());
            problems.stream()
                .sorted()
                .forEach(r -> sb.append(Format.indentToLevel(3)).append(failureMessage(collection, r)).append(System.lineSeparator()));
        }
    }

    private void appendDocuments(StringBuilder sb) {
        var documents = result.getDocuments();
        sb.append(Format.indentToLevel(1)).append("Documents copied: ").append(documents.getSuccess()).append(System.lineSeparator());
        if (documents.getFailed() > 0) {
            sb.append(Format.indentToLevel(1)).append("Documents failed: ").append(documents.getFailed()).append(System.lineSeparator());
        }
        if (result.getMode().isMissingOnly()) {
            sb.append(Format.indentToLevel(1))
                .append("Documents skipped: ")
                .append(documents.getSkipped())
                .append(" (already exist)")
                .append(System.lineSeparator());
        }
        documents.getFailuresByCollection().forEach((collection, failures) -> {
            sb.append(Format.indentToLevel(2)).append(collection).append(":").append(System.lineSeparator());
            failures.forEach(f -> sb.append(Format.indentToLevel(3))
                .append("- Document ")
                .append(f.documentId())
                .append(": ")
                .append(f.message())
                .append(System.lineSeparator()));
        });
    }

    private static String failureMessage(CollectionCloneResult collection, CreationResult result) {
        var sb = new StringBuilder()
            .append(result.wasFatal() ? "ERROR" : "WARN")
            .append(" - ")
            .append(collection.getCollectionName())
            .append(".")
            .append(result.getName())
            .append(" ")
            .append(result.getFailureType().getMessage());

        if (result.wasFatal() && result.getException() != null) {
            var exceptionDetail = result.getException().getMessage() != null
                ? result.getException().getMessage()
                : result.getException().toString();
            sb.append(": " + exceptionDetail);
        }
        return sb.toString();
    }

    @Override
    public JsonNode asJsonOutput() {
        var root = JsonNodeFactory.instance.objectNode();
        root.put("mode", result.getMode().getLabel());

        var dropped = root.putObject("droppedCollections");
        dropped.put("count", result.getDroppedCount());
        buildArray("failures", result.getDropErrors(), dropped);

        var collections = root.putArray("collections");
        for (var collection : result.getCollections()) {
            var obj = collections.addObject();
            obj.put("id", collection.getCollectionId());
            obj.put("name", collection.getCollectionName());
            obj.put("successful", collection.wasSuccessful());
            if (!collection.wasSuccessful()) {
                obj.put("error", collection.errorMessage());
            }
            buildArray("attributes", collection.getAttributes(), obj);
            buildArray("indexes", collection.getIndexes(), obj);
        }

        var documents = root.putObject("documents");
        documents.put("success", result.getDocuments().getSuccess());
        documents.put("failed", result.getDocuments().getFailed());
        documents.put("skipped", result.getDocuments().getSkipped());
        var failures = documents.putObject("failures");
        result.getDocuments().getFailuresByCollection().forEach((collection, list) -> {
            var array = failures.putArray(collection);
            list.forEach(f -> array.addObject().put("documentId", f.documentId()).put("message", f.message()));
        });

        var errorsNode = root.putArray("errors");
        getAllErrors().forEach(errorsNode::add);
        return root;
    }

    private static void buildArray(String fieldName, List<CreationResult> items, ObjectNode parent) {
        var array = parent.putArray(fieldName);
        for (var item : items.stream().sorted().collect(Collectors.toList())) {
            var obj = array.addObject();
            obj.put("name", item.getName());
            obj.put("successful", item.wasSuccessful());

            if (!item.wasSuccessful()) {
                var failure = obj.putObject("failure");
                var ft = item.getFailureType();
                failure.put("type", ft.name());
                failure.put("message", ft.getMessage());
                failure.put("fatal", ft.isFatal());
                if (ft.isFatal() && item.getException() != null) {
                    var exMsg = item.getException().getMessage();
                    failure.put("exception", exMsg != null ? exMsg : item.getException().toString());
                }
            }
        }
    }
}
