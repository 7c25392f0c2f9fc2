package org.databaseclone.clone.worker;

/** Receives progress of a clone run as it happens.  All methods default to doing nothing. */
public interface CloneProgressListener {
    CloneProgressListener NONE = new CloneProgressListener() {};

    enum Phase {
        DROP,
        STRUCTURE,
        FETCH,
        DIFF,
        WRITE
    }

    default void phaseStarted(Phase phase, int total) {}

    /** One unit of a phase finished: a collection, or a document in the write phase. */
    default void itemCompleted(Phase phase, String name, boolean success, int done, int total) {}

    default void phaseCompleted(Phase phase) {}
}
