package org.databaseclone.commands;

import lombok.Getter;

public class DatabaseNotFoundException extends RuntimeException {
    @Getter
    private final String databaseId;

    public DatabaseNotFoundException(String role, String databaseId) {
        super(role + " database \"" + databaseId + "\" not found");
        this.databaseId = databaseId;
    }
}
