package org.databaseclone;

/** The list of supported commands for the database clone tool */
public enum DatabaseCloneCommands {
    /** Replicates collections and documents from a source database into a destination database */
    CLONE,

    /** Writes every collection of a source database to CSV files */
    EXPORT;

    public static DatabaseCloneCommands fromString(String s) {
        for (var command : values()) {
            if (command.name().equalsIgnoreCase(s)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unable to find matching command for text:" + s);
    }
}
