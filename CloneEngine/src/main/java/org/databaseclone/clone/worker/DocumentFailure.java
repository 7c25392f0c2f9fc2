package org.databaseclone.clone.worker;

/** A source document that could not be written, by its id in the source database. */
public record DocumentFailure(String documentId, String message) {}
