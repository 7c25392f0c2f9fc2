package org.databaseclone.clone.schema;

import java.util.Optional;
import java.util.function.Supplier;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.models.SchemaStatus;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls the status of a just submitted attribute or index until it leaves the
 * {@link ReadinessState#SUBMITTED} state.  Errors from the status probe propagate.
 */
@Slf4j
@AllArgsConstructor
public class ReadinessPoller {
    private final PollPolicy policy;
    private final Sleeper sleeper;

    public record Outcome(ReadinessState state, int attempts, SchemaStatus lastStatus) {}

    /**
     * @param name        what is being waited for, for logging
     * @param statusProbe current status on the destination, empty while it is not listed yet
     */
    public Outcome awaitAvailable(String name, Supplier<Optional<SchemaStatus>> statusProbe) {
        var state = ReadinessState.SUBMITTED;
        var lastStatus = SchemaStatus.UNKNOWN;
        int attempt = 0;
        while (!state.isTerminal()) {
            attempt++;
            lastStatus = statusProbe.get().orElse(SchemaStatus.UNKNOWN);
            if (lastStatus == SchemaStatus.AVAILABLE) {
                state = ReadinessState.AVAILABLE;
            } else if (lastStatus == SchemaStatus.FAILED) {
                state = ReadinessState.FAILED;
            } else if (attempt >= policy.maxAttempts()) {
                state = ReadinessState.TIMED_OUT;
            } else {
                log.atDebug().setMessage("{} is {} after attempt {} of {}")
                    .addArgument(name)
                    .addArgument(lastStatus::wireName)
                    .addArgument(attempt)
                    .addArgument(policy.maxAttempts())
                    .log();
                pause(name);
            }
        }
        log.atDebug().setMessage("{} reached {} after {} attempt(s)").addArgument(name).addArgument(state).addArgument(attempt).log();
        return new Outcome(state, attempt, lastStatus);
    }

    private void pause(String name) {
        try {
            sleeper.sleep(policy.interval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloneException("Interrupted while waiting for " + name + " to become available", e);
        }
    }
}
