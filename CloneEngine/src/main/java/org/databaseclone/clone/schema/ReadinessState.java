package org.databaseclone.clone.schema;

public enum ReadinessState {
    SUBMITTED,
    AVAILABLE,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != SUBMITTED;
    }
}
