package org.databaseclone.clone.common;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Generates 20 character document ids: the current time as hex followed by random hex digits,
 * so ids sort roughly by creation time.
 */
public class UniqueIdGenerator implements Supplier<String> {
    private static final int RANDOM_DIGITS = 7;

    private final Clock clock;
    private final Random random;

    public UniqueIdGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    public UniqueIdGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public String get() {
        var instant = clock.instant();
        var micros = instant.getNano() / 1000;
        var sb = new StringBuilder(20)
            .append(Long.toHexString(instant.getEpochSecond()))
            .append(String.format("%05x", micros));
        for (int i = 0; i < RANDOM_DIGITS; i++) {
            sb.append(Integer.toHexString(random.nextInt(16)));
        }
        return sb.toString();
    }
}
