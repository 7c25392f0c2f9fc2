package org.databaseclone.commands;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

import org.databaseclone.cli.CloneSummary;
import org.databaseclone.cli.ConfirmationPrompt;
import org.databaseclone.cli.LoggingProgressListener;
import org.databaseclone.clone.diff.IdentifierFieldMapping;
import org.databaseclone.clone.models.DatabaseInfo;
import org.databaseclone.clone.schema.PollPolicy;
import org.databaseclone.clone.schema.ReadinessTimeoutPolicy;
import org.databaseclone.clone.worker.CloneMode;
import org.databaseclone.clone.worker.CloneOptions;
import org.databaseclone.clone.worker.CloneRunner;
import org.databaseclone.config.CloneConfig;

import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Clone extends CommandBase {
    private static final String BANNER_RULE = "=".repeat(60);

    private final CloneArgs cloneArgs;
    private final ConfirmationPrompt prompt;

    public Clone(CloneArgs arguments, ConfirmationPrompt prompt) {
        super(arguments);
        this.cloneArgs = arguments;
        this.prompt = prompt;
    }

    public CloneResult execute() {
        var cloneResult = CloneResult.builder();

        try {
            log.info("Running Database Clone");
            validateArguments(isBlank(cloneArgs.destDatabaseId)
                ? List.of("--dest-database-id (DEST_DATABASE_ID)")
                : List.of());
            var options = buildOptions(loadConfig());
            cloneResult.mode(options.getMode());

            var client = createClient();
            var source = requireDatabase(client, cloneArgs.sourceDatabaseId, "Source");
            cloneResult.source(source);
            var destination = requireDatabase(client, cloneArgs.destDatabaseId, "Destination");
            cloneResult.destination(destination);

            if (cloneArgs.yes) {
                log.atWarn().setMessage("Confirmations skipped with --yes").log();
            } else {
                confirm(source, destination, options.getMode());
            }

            var replication = CloneRunner.builder()
                .client(client)
                .options(options)
                .listener(new LoggingProgressListener())
                .build()
                .run(source.id(), destination.id());
            cloneResult.summary(new CloneSummary(replication));
        } catch (CloneCancelledException ce) {
            log.atInfo().setMessage("{}").addArgument(ce::getMessage).log();
            cloneResult.cancelled(true).exitCode(CANCELLED_CODE);
        } catch (DatabaseNotFoundException nfe) {
            log.atError().setCause(nfe).setMessage("Database not found").log();
            cloneResult.exitCode(DATABASE_NOT_FOUND_CODE)
                .errorMessage(nfe.getMessage());
        } catch (ParameterException pe) {
            log.atError().setCause(pe).setMessage("Invalid parameter").log();
            cloneResult.exitCode(INVALID_PARAMETER_CODE)
                .errorMessage("Invalid parameter: " + pe.getMessage());
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Unexpected failure").log();
            cloneResult.exitCode(UNEXPECTED_FAILURE_CODE)
                .errorMessage(createUnexpectedErrorMessage(e));
        }

        return cloneResult.build();
    }

    CloneOptions buildOptions(CloneConfig config) {
        var options = CloneOptions.builder()
            .mode(cloneArgs.cloneMode != null ? cloneArgs.cloneMode : CloneMode.FULL)
            .batchSize(resolveBatchSize(config))
            .identifierFields(resolveIdentifierFields(config))
            .readinessTimeoutPolicy(resolveTimeoutPolicy(config));

        var snapshotPath = !isBlank(cloneArgs.snapshotPath) ? cloneArgs.snapshotPath : config.snapshot_path;
        if (!isBlank(snapshotPath)) {
            options.snapshotPath(Path.of(snapshotPath));
        }
        if (config.attribute_poll != null) {
            options.attributePollPolicy(toPollPolicy(config.attribute_poll, PollPolicy.ATTRIBUTE_DEFAULT));
        }
        if (config.index_poll != null) {
            options.indexPollPolicy(toPollPolicy(config.index_poll, PollPolicy.INDEX_DEFAULT));
        }
        return options.build();
    }

    /** Config file entries first, each --identifier-field overriding the entry for its collection. */
    private IdentifierFieldMapping resolveIdentifierFields(CloneConfig config) {
        var fields = new LinkedHashMap<String, String>(config.unique_identifier_fields);
        for (var entry : cloneArgs.identifierFields) {
            var separator = entry.indexOf('=');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new ParameterException("--identifier-field expects collectionId=field, was " + entry);
            }
            fields.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
        }
        return IdentifierFieldMapping.of(fields);
    }

    private ReadinessTimeoutPolicy resolveTimeoutPolicy(CloneConfig config) {
        var value = !isBlank(cloneArgs.readinessTimeoutPolicy) ? cloneArgs.readinessTimeoutPolicy : config.readiness_timeout_policy;
        if (isBlank(value)) {
            return ReadinessTimeoutPolicy.FAIL;
        }
        try {
            return ReadinessTimeoutPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParameterException("Readiness timeout policy must be fail or continue, was " + value);
        }
    }

    private static PollPolicy toPollPolicy(CloneConfig.PollSettings settings, PollPolicy defaults) {
        var attempts = settings.max_attempts != null ? settings.max_attempts : defaults.maxAttempts();
        var interval = settings.interval_millis != null ? Duration.ofMillis(settings.interval_millis) : defaults.interval();
        try {
            return new PollPolicy(attempts, interval);
        } catch (IllegalArgumentException e) {
            throw new ParameterException("Invalid poll settings: " + e.getMessage());
        }
    }

    private void confirm(DatabaseInfo source, DatabaseInfo destination, CloneMode mode) {
        var lines = new ArrayList<String>();
        lines.add(BANNER_RULE);
        lines.add("DATABASE CLONE CONFIRMATION");
        lines.add(BANNER_RULE);
        lines.add("Source database (FROM):      " + source.name() + " (" + source.id() + ")");
        lines.add("Destination database (TO):   " + destination.name() + " (" + destination.id() + ")");
        lines.add("Mode:                        " + mode);
        if (mode.dropsDestination()) {
            lines.add("WARNING: ALL existing collections in the destination will be DELETED.");
            lines.add("WARNING: This action CANNOT be undone.");
        }
        prompt.inform(String.join(System.lineSeparator(), lines));

        ask("Is \"" + source.id() + "\" the correct SOURCE database?");
        ask("Is \"" + destination.id() + "\" the correct DESTINATION database to overwrite?");
        ask(mode.dropsDestination()
            ? "Are you ABSOLUTELY SURE you want to proceed? This will DELETE all data in the destination."
            : "Are you ABSOLUTELY SURE you want to proceed?");
    }

    private void ask(String question) {
        if (!prompt.confirm(question)) {
            throw new CloneCancelledException(question);
        }
    }
}
