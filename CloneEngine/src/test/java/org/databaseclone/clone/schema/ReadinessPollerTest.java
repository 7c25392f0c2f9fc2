package org.databaseclone.clone.schema;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.databaseclone.clone.common.CloneException;
import org.databaseclone.clone.models.SchemaStatus;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReadinessPollerTest {
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private static Supplier<Optional<SchemaStatus>> statuses(SchemaStatus... sequence) {
        Iterator<SchemaStatus> it = List.of(sequence).iterator();
        return () -> Optional.of(it.hasNext() ? it.next() : sequence[sequence.length - 1]);
    }

    @Test
    void awaitAvailable_stopsAsSoonAsAvailable() {
        var poller = new ReadinessPoller(new PollPolicy(30, Duration.ofSeconds(1)), recordingSleeper);

        var outcome = poller.awaitAvailable("title",
            statuses(SchemaStatus.PROCESSING, SchemaStatus.PROCESSING, SchemaStatus.AVAILABLE));

        assertThat(outcome.state(), equalTo(ReadinessState.AVAILABLE));
        assertThat(outcome.attempts(), equalTo(3));
        assertThat(sleeps, hasSize(2));
        assertThat(sleeps, everyItem(equalTo(Duration.ofSeconds(1))));
    }

    @Test
    void awaitAvailable_failedStatusEndsEarly() {
        var poller = new ReadinessPoller(PollPolicy.ATTRIBUTE_DEFAULT, recordingSleeper);

        var outcome = poller.awaitAvailable("title", statuses(SchemaStatus.PROCESSING, SchemaStatus.FAILED));

        assertThat(outcome.state(), equalTo(ReadinessState.FAILED));
        assertThat(outcome.attempts(), equalTo(2));
    }

    @Test
    void awaitAvailable_timesOutAfterMaxAttempts() {
        var poller = new ReadinessPoller(new PollPolicy(5, Duration.ofMillis(10)), recordingSleeper);

        var outcome = poller.awaitAvailable("title", statuses(SchemaStatus.PROCESSING));

        assertThat(outcome.state(), equalTo(ReadinessState.TIMED_OUT));
        assertThat(outcome.attempts(), equalTo(5));
        assertThat(outcome.lastStatus(), equalTo(SchemaStatus.PROCESSING));
        assertThat(sleeps, hasSize(4));
    }

    @Test
    void awaitAvailable_treatsUnlistedItemAsNotReady() {
        var poller = new ReadinessPoller(new PollPolicy(3, Duration.ZERO), recordingSleeper);

        var outcome = poller.awaitAvailable("title", Optional::empty);

        assertThat(outcome.state(), equalTo(ReadinessState.TIMED_OUT));
        assertThat(outcome.lastStatus(), equalTo(SchemaStatus.UNKNOWN));
    }

    @Test
    void awaitAvailable_interruptionBecomesCloneException() {
        var poller = new ReadinessPoller(new PollPolicy(3, Duration.ZERO), d -> {
            throw new InterruptedException("stop");
        });

        assertThrows(CloneException.class, () -> poller.awaitAvailable("title", statuses(SchemaStatus.PROCESSING)));
        assertThat(Thread.interrupted(), equalTo(true));
    }

    @Test
    void defaultPolicies() {
        assertThat(PollPolicy.ATTRIBUTE_DEFAULT.maxAttempts(), equalTo(30));
        assertThat(PollPolicy.INDEX_DEFAULT.maxAttempts(), equalTo(60));
        assertThat(PollPolicy.INDEX_DEFAULT.interval(), equalTo(Duration.ofSeconds(1)));
    }
}
