package org.databaseclone;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.databaseclone.arguments.ArgLogUtils;
import org.databaseclone.arguments.ArgNameConstants;
import org.databaseclone.cli.ConsoleConfirmationPrompt;
import org.databaseclone.cli.OutputFormat;
import org.databaseclone.commands.Clone;
import org.databaseclone.commands.CloneArgs;
import org.databaseclone.commands.Export;
import org.databaseclone.commands.ExportArgs;
import org.databaseclone.commands.Result;
import org.databaseclone.jcommander.EnvVarParameterPuller;
import org.databaseclone.jcommander.EnvVarParameterPuller.EnvVarGetter;

import com.beust.jcommander.JCommander;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;

@Slf4j
public class DatabaseClone {

    /** Connection settings are read from APPWRITE_ENDPOINT, APPWRITE_PROJECT_ID and APPWRITE_API_KEY */
    public static final String CONNECTION_ENV_PREFIX = "APPWRITE_";
    /** Everything else is read without a prefix, e.g. SOURCE_DATABASE_ID or CLONE_MODE */
    public static final String ENV_PREFIX = "";
    // Log appender name is in from the DatabaseClone/src/main/resources/log4j2.properties
    static final String RUN_LOG_APPENDER_NAME = "CloneRun";

    public static void main(String[] args) {
        new DatabaseClone().run(args);
    }

    private final EnvVarGetter envVarGetter;
    private final AtomicReference<OutputFormat> outputFormat = new AtomicReference<>();

    public DatabaseClone() {
        this(System::getenv);
    }

    DatabaseClone(EnvVarGetter envVarGetter) {
        this.envVarGetter = envVarGetter;
    }

    protected void run(String[] args) {
        System.err.println("Starting program with: "
            + ArgLogUtils.redactedCommandLine(args, ArgNameConstants.CENSORED_CONNECTION_ARGS));
        var topLevelArgs = new DatabaseCloneArgs();
        var cloneArgs = injectFromEnv(new CloneArgs());
        var exportArgs = injectFromEnv(new ExportArgs());
        var jCommander = JCommander.newBuilder()
            .addObject(topLevelArgs)
            .addCommand(cloneArgs)
            .addCommand(exportArgs)
            .build();
        jCommander.parse(args);

        if (cloneArgs.outputFormat == OutputFormat.JSON || exportArgs.outputFormat == OutputFormat.JSON) {
            outputFormat.set(OutputFormat.JSON);
        } else {
            outputFormat.set(OutputFormat.HUMAN_READABLE);
        }

        if (topLevelArgs.help || jCommander.getParsedCommand() == null) {
            printTopLevelHelp(jCommander);
            return;
        }

        if (cloneArgs.help || exportArgs.help) {
            printCommandUsage(jCommander);
            return;
        }

        var result = runCommand(jCommander, cloneArgs, exportArgs);

        // Output format determines which version is printed to the user
        writeOutput(result.asCliOutput());
        writeOutput(result.asJsonOutput());
        reportLogPath();

        exitWithCode(result.getExitCode());
    }

    /** Unprefixed variables first so that the APPWRITE_ connection variables win. */
    private <T extends SourceDatabaseArgs> T injectFromEnv(T args) {
        EnvVarParameterPuller.injectFromEnv(args, envVarGetter, ENV_PREFIX);
        EnvVarParameterPuller.injectFromEnv(args.connectionArgs, envVarGetter, CONNECTION_ENV_PREFIX);
        return args;
    }

    private Result runCommand(JCommander jCommander, CloneArgs cloneArgs, ExportArgs exportArgs) {
        var command = Optional.ofNullable(jCommander.getParsedCommand())
            .map(DatabaseCloneCommands::fromString)
            .orElse(DatabaseCloneCommands.CLONE);

        switch (command) {
            default:
            case CLONE:
                writeOutput("Starting Database Clone");
                return cloneDatabase(cloneArgs).execute();
            case EXPORT:
                writeOutput("Starting CSV Export");
                return exportCsv(exportArgs).execute();
        }
    }

    protected void exitWithCode(int code) {
        System.exit(code);
    }

    public Clone cloneDatabase(CloneArgs arguments) {
        return new Clone(arguments, new ConsoleConfirmationPrompt(System.in, System.out));
    }

    public Export exportCsv(ExportArgs arguments) {
        return new Export(arguments);
    }

    protected void writeOutput(String humanReadableOutput) {
        if (outputFormat.get() == OutputFormat.HUMAN_READABLE) {
            log.atInfo().setMessage("{}").addArgument(humanReadableOutput).log();
        }
    }

    protected void writeOutput(JsonNode output) {
        if (outputFormat.get() == OutputFormat.JSON) {
            log.atInfo().setMessage("{}").addArgument(output::toPrettyString).log();
        }
    }

    private void printTopLevelHelp(JCommander commander) {
        var sb = new StringBuilder();
        sb.append("Usage: [options] [command] [commandOptions]").append(System.lineSeparator());
        sb.append("Options:").append(System.lineSeparator());
        for (var parameter : commander.getParameters()) {
            sb.append("  ").append(parameter.getNames());
            sb.append("    ").append(parameter.getDescription()).append(System.lineSeparator());
        }

        sb.append("Commands:").append(System.lineSeparator());
        for (var command : commander.getCommands().entrySet()) {
            sb.append("  ").append(command.getKey());
            sb.append("    ").append(commander.getUsageFormatter().getCommandDescription(command.getKey()))
                .append(System.lineSeparator());
        }
        sb.append("Use --help with a specific command for more information.");
        writeOutput(sb.toString());
    }

    private void printCommandUsage(JCommander jCommander) {
        var sb = new StringBuilder();
        jCommander.getUsageFormatter().usage(jCommander.getParsedCommand(), sb);
        writeOutput(sb.toString());
    }

    private void reportLogPath() {
        try {
            var loggingContext = (LoggerContext) LogManager.getContext(false);
            var loggingConfig = loggingContext.getConfiguration();
            var runLogAppender = loggingConfig.getAppender(RUN_LOG_APPENDER_NAME);
            if (runLogAppender instanceof FileAppender) {
                var logFilePath = Path.of(((FileAppender) runLogAppender).getFileName()).normalize();
                writeOutput("Consult " + logFilePath.toAbsolutePath() + " to see detailed logs for this run");
            }
        } catch (ClassCastException e) {
            log.atDebug().setMessage("Unable to locate the run log file").setCause(e).log();
        }
    }
}
