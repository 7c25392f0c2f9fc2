package org.databaseclone.cli;

/** Asks the operator yes/no questions before destructive work. */
@FunctionalInterface
public interface ConfirmationPrompt {
    /** Any answer other than yes, including no answer at all, is a no. */
    boolean confirm(String question);

    default void inform(String message) {}
}
