package org.databaseclone.commands;

import java.nio.file.Path;
import java.util.List;

import org.databaseclone.cli.LoggingProgressListener;
import org.databaseclone.clone.export.CsvExporter;

import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Export extends CommandBase {
    private final ExportArgs exportArgs;

    public Export(ExportArgs arguments) {
        super(arguments);
        this.exportArgs = arguments;
    }

    public ExportResult execute() {
        var exportResult = ExportResult.builder();

        try {
            log.info("Running CSV Export");
            validateArguments(List.of());
            var batchSize = resolveBatchSize(loadConfig());

            var client = createClient();
            var source = requireDatabase(client, exportArgs.sourceDatabaseId, "Source");
            exportResult.source(source);

            if (exportArgs.includeSystemFields) {
                log.atWarn().setMessage("Including service fields; the files cannot be imported again as they are").log();
            }
            var exporter = CsvExporter.builder()
                .client(client)
                .exportDir(isBlank(exportArgs.exportDir) ? null : Path.of(exportArgs.exportDir))
                .batchSize(batchSize)
                .includeServiceFields(exportArgs.includeSystemFields)
                .listener(new LoggingProgressListener())
                .build();
            exportResult.export(exporter.export(source.id()));
        } catch (DatabaseNotFoundException nfe) {
            log.atError().setCause(nfe).setMessage("Database not found").log();
            exportResult.exitCode(DATABASE_NOT_FOUND_CODE)
                .errorMessage(nfe.getMessage());
        } catch (ParameterException pe) {
            log.atError().setCause(pe).setMessage("Invalid parameter").log();
            exportResult.exitCode(INVALID_PARAMETER_CODE)
                .errorMessage("Invalid parameter: " + pe.getMessage());
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Unexpected failure").log();
            exportResult.exitCode(UNEXPECTED_FAILURE_CODE)
                .errorMessage(createUnexpectedErrorMessage(e));
        }

        return exportResult.build();
    }
}
