package org.databaseclone.commands;

/** The operator declined one of the confirmations; nothing was changed. */
public class CloneCancelledException extends RuntimeException {
    public CloneCancelledException(String question) {
        super("Clone cancelled by user at: " + question);
    }
}
