package org.databaseclone.commands;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.databaseclone.SourceDatabaseArgs;
import org.databaseclone.clone.common.DatabaseClient;
import org.databaseclone.clone.common.RestClient;
import org.databaseclone.clone.common.RestDatabaseClient;
import org.databaseclone.clone.models.DatabaseInfo;
import org.databaseclone.clone.worker.CloneOptions;
import org.databaseclone.config.CloneConfig;

import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;

/** Shared functionality between the clone and export commands */
@Slf4j
public abstract class CommandBase {
    static final int INVALID_PARAMETER_CODE = 999;
    static final int UNEXPECTED_FAILURE_CODE = 888;
    static final int DATABASE_NOT_FOUND_CODE = 2;
    static final int CANCELLED_CODE = 0;
    /** Process exit statuses keep only the low eight bits, so error counts stop here. */
    static final int MAX_ERROR_COUNT_CODE = 255;

    protected final SourceDatabaseArgs arguments;

    protected CommandBase(SourceDatabaseArgs arguments) {
        this.arguments = arguments;
    }

    protected DatabaseClient createClient() {
        var connectionContext = arguments.connectionArgs.toConnectionContext();
        log.atInfo().setMessage("Connecting to {}").addArgument(connectionContext).log();
        return new RestDatabaseClient(new RestClient(connectionContext));
    }

    /** Checks everything every command needs, plus whatever the command adds, before any remote call is made. */
    protected void validateArguments(List<String> additionalMissing) {
        var missing = new ArrayList<String>();
        var connection = arguments.connectionArgs;
        if (isBlank(connection.endpoint)) {
            missing.add("--endpoint (APPWRITE_ENDPOINT)");
        }
        if (isBlank(connection.projectId)) {
            missing.add("--project-id (APPWRITE_PROJECT_ID)");
        }
        if (isBlank(connection.apiKey)) {
            missing.add("--api-key (APPWRITE_API_KEY)");
        }
        if (isBlank(arguments.sourceDatabaseId)) {
            missing.add("--source-database-id (SOURCE_DATABASE_ID)");
        }
        missing.addAll(additionalMissing);
        if (!missing.isEmpty()) {
            throw new ParameterException("Missing required parameter(s): " + String.join(", ", missing));
        }
    }

    protected CloneConfig loadConfig() {
        if (isBlank(arguments.configFile)) {
            return new CloneConfig();
        }
        try {
            var config = CloneConfig.loadFrom(arguments.configFile);
            log.atInfo().setMessage("Loaded config file {}").addArgument(arguments.configFile).log();
            return config;
        } catch (IOException | RuntimeException e) {
            throw new ParameterException("Unable to read config file " + arguments.configFile + ": " + e.getMessage(), e);
        }
    }

    /** Command line or environment first, then the config file, then the default. */
    protected int resolveBatchSize(CloneConfig config) {
        var batchSize = Optional.ofNullable(arguments.batchSize)
            .or(() -> Optional.ofNullable(config.batch_size))
            .orElse(CloneOptions.DEFAULT_BATCH_SIZE);
        if (batchSize <= 0) {
            throw new ParameterException("--batch-size must be positive, was " + batchSize);
        }
        return batchSize;
    }

    protected DatabaseInfo requireDatabase(DatabaseClient client, String databaseId, String role) {
        var database = client.getDatabase(databaseId)
            .orElseThrow(() -> new DatabaseNotFoundException(role, databaseId));
        log.atInfo().setMessage("{} database: {} ({})").addArgument(role).addArgument(database.name()).addArgument(database.id()).log();
        return database;
    }

    protected String createUnexpectedErrorMessage(Throwable e) {
        var causeMessage = Optional.of(e).map(Throwable::getCause).map(Throwable::getMessage).orElse(null);
        return "Unexpected failure: " + e.getMessage() + (causeMessage == null ? "" : ", inner cause: " + causeMessage);
    }

    static int errorCountExitCode(int errorCount) {
        return Math.min(errorCount, MAX_ERROR_COUNT_CODE);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
