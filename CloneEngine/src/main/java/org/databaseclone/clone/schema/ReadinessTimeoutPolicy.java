package org.databaseclone.clone.schema;

/**
 * What to do when an attribute or index is still not available after the last poll.
 * <ul>
 *   <li>FAIL records the timeout as a failure; for attributes this fails the collection</li>
 *   <li>CONTINUE logs a warning and moves on</li>
 * </ul>
 */
public enum ReadinessTimeoutPolicy {
    FAIL,
    CONTINUE
}
