package org.databaseclone.clone.export;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.paging.DatabaseListings;
import org.databaseclone.clone.worker.CloneProgressListener;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Writes every collection of a database to its own CSV file. */
@Slf4j
public class CsvExporter {
    public static final Path DEFAULT_EXPORT_DIR = Path.of("csv-export");

    private final DatabaseListings listings;
    private final Path exportDir;
    private final int batchSize;
    private final boolean includeServiceFields;
    private final Clock clock;
    private final CloneProgressListener listener;

    @Builder
    private CsvExporter(
        @NonNull DatabaseClient client,
        Path exportDir,
        int batchSize,
        boolean includeServiceFields,
        Clock clock,
        CloneProgressListener listener
    ) {
        this.listings = new DatabaseListings(client);
        this.exportDir = exportDir != null ? exportDir : DEFAULT_EXPORT_DIR;
        this.batchSize = batchSize > 0 ? batchSize : 100;
        this.includeServiceFields = includeServiceFields;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.listener = listener != null ? listener : CloneProgressListener.NONE;
    }

    /** @param file null when the collection had no documents */
    public record ExportedCollection(String name, Path file, int recordCount) {}

    public record ExportResult(Path exportDir, List<ExportedCollection> collections) {
        public int totalRecords() {
            return collections.stream().mapToInt(ExportedCollection::recordCount).sum();
        }
    }

    public ExportResult export(String sourceDatabaseId) {
        var collections = listings.allCollections(sourceDatabaseId);
        var exported = new ArrayList<ExportedCollection>();
        if (collections.isEmpty()) {
            log.atInfo().setMessage("No collections found in source database {}").addArgument(sourceDatabaseId).log();
            return new ExportResult(exportDir, exported);
        }

        createExportDir();
        log.atInfo().setMessage("Exporting {} collections to {}").addArgument(collections.size()).addArgument(exportDir).log();
        listener.phaseStarted(CloneProgressListener.Phase.FETCH, collections.size());
        int done = 0;
        for (var collection : collections) {
            var documents = listings.allDocuments(sourceDatabaseId, collection.id(), batchSize);
            if (documents.isEmpty()) {
                exported.add(new ExportedCollection(collection.name(), null, 0));
            } else {
                var file = exportDir.resolve(fileName(collection.name()));
                writeFile(file, CsvFormatter.toCsv(documents, includeServiceFields));
                log.atInfo().setMessage("Wrote {} records of {} to {}")
                    .addArgument(documents::size).addArgument(collection.name()).addArgument(file).log();
                exported.add(new ExportedCollection(collection.name(), file, documents.size()));
            }
            listener.itemCompleted(CloneProgressListener.Phase.FETCH, collection.name(), true, ++done, collections.size());
        }
        listener.phaseCompleted(CloneProgressListener.Phase.FETCH);
        return new ExportResult(exportDir, exported);
    }

    /** e.g. {@code orders_2024-05-01T10-15-30.csv} */
    String fileName(String collectionName) {
        var timestamp = clock.instant().toString().replaceAll("[:.]", "-");
        return collectionName + "_" + timestamp.substring(0, Math.min(19, timestamp.length())) + ".csv";
    }

    private void createExportDir() {
        try {
            Files.createDirectories(exportDir);
        } catch (IOException e) {
            throw new CloneException("Unable to create export directory " + exportDir, e);
        }
    }

    private static void writeFile(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CloneException("Unable to write " + file, e);
        }
    }
}
