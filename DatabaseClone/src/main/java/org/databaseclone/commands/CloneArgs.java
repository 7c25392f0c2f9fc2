package org.databaseclone.commands;

import java.util.ArrayList;
import java.util.List;

import org.databaseclone.SourceDatabaseArgs;
import org.databaseclone.clone.worker.CloneMode;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "clone", commandDescription = "Replicates collections, attributes, indexes and documents into a destination database")
public class CloneArgs extends SourceDatabaseArgs {
    @Parameter(names = { "--dest-database-id" }, description = "The database to write to")
    public String destDatabaseId;

    @Parameter(names = { "--clone-mode", "--mode" }, description = "One of full, structure-only, data-only or missing-only",
            converter = CloneModeConverter.class)
    public CloneMode cloneMode = CloneMode.FULL;

    @Parameter(names = { "--yes", "-y" }, description = "Skip the interactive confirmations")
    public boolean yes;

    @Parameter(names = { "--snapshot-path" }, description = "Where fetched documents are cached between the fetch and write phases")
    public String snapshotPath;

    @Parameter(names = { "--on-readiness-timeout" }, description = "fail (default) or continue when an attribute or index never becomes available")
    public String readinessTimeoutPolicy;

    @Parameter(names = { "--identifier-field" }, description = "collectionId=field, the field that identifies documents of a "
        + "collection in missing-only mode.  May be repeated.")
    public List<String> identifierFields = new ArrayList<>();

    public static class CloneModeConverter implements IStringConverter<CloneMode> {
        @Override
        public CloneMode convert(String value) {
            try {
                return CloneMode.fromLabel(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }
}
