package org.databaseclone.commands;

import org.databaseclone.SourceDatabaseArgs;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "export", commandDescription = "Writes every collection of the source database to a CSV file")
public class ExportArgs extends SourceDatabaseArgs {
    @Parameter(names = { "--export-dir" }, description = "Directory the CSV files are written to.  Default: csv-export")
    public String exportDir;

    @Parameter(names = { "--include-system-fields" }, description = "Include $id, $createdAt and the other service fields.  "
        + "Leave off when the files will be imported again.")
    public boolean includeSystemFields;
}
