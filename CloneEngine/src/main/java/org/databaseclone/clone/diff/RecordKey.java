package org.databaseclone.clone.diff;

/**
 * Identity of a document when comparing source and destination.  The kind keeps an identifier
 * value from ever matching a content key with the same text.
 */
public record RecordKey(Kind kind, String value) {
    public enum Kind {
        IDENTIFIER,
        CONTENT
    }

    public static RecordKey identifier(String value) {
        return new RecordKey(Kind.IDENTIFIER, value);
    }

    public static RecordKey content(String value) {
        return new RecordKey(Kind.CONTENT, value);
    }
}
