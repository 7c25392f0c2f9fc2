package org.databaseclone.clone.schema;

import java.time.Duration;

/** How often and how long to wait for an attribute or index to become available. */
public record PollPolicy(int maxAttempts, Duration interval) {
    public static final PollPolicy ATTRIBUTE_DEFAULT = new PollPolicy(30, Duration.ofSeconds(1));
    public static final PollPolicy INDEX_DEFAULT = new PollPolicy(60, Duration.ofSeconds(1));

    public PollPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, was " + maxAttempts);
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
    }
}
