package org.databaseclone.clone.common;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;

class UniqueIdGeneratorTest {

    @Test
    void get_isTimePrefixedHex() {
        var clock = Clock.fixed(Instant.ofEpochSecond(1714558530L, 123_456_000L), ZoneOffset.UTC);
        var generator = new UniqueIdGenerator(clock, new Random(42));

        var id = generator.get();

        assertThat(id, matchesPattern("[0-9a-f]{20}"));
        assertThat(id, startsWith(Long.toHexString(1714558530L) + String.format("%05x", 123_456)));
    }

    @Test
    void get_isUniqueAcrossCalls() {
        var generator = new UniqueIdGenerator();
        var ids = new HashSet<String>();

        for (int i = 0; i < 1000; i++) {
            ids.add(generator.get());
        }

        assertThat(ids.size(), equalTo(1000));
    }
}
