package org.databaseclone;

import org.databaseclone.cli.OutputFormat;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

/** Arguments shared by every command that reads from a source database */
public class SourceDatabaseArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
    public boolean help;

    @Parameter(names = { "--output-format", "--output" }, description = "Output format: human_readable (default) or json",
            converter = OutputFormat.OutputFormatConverter.class)
    public OutputFormat outputFormat = OutputFormat.HUMAN_READABLE;

    @ParametersDelegate
    public ConnectionArgs connectionArgs = new ConnectionArgs();

    @Parameter(names = { "--source-database-id" }, description = "The database to read from")
    public String sourceDatabaseId;

    @Parameter(names = { "--batch-size" }, description = "Documents requested per page.  Default: 100, or batch_size from the config file")
    public Integer batchSize;

    @Parameter(names = { "--config-file", "-c" }, description = "The path to a YAML config file")
    public String configFile;
}
