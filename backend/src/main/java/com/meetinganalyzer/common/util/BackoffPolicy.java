package com.meetinganalyzer.common.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public final class BackoffPolicy {

    private static final int MAX_EXPONENT = 30;

    private final Duration baseDelay;
    private final Duration jitter;
    private final Duration maxDelay;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, Duration jitter, Duration maxDelay, Sleeper sleeper) {
        this(baseDelay, jitter, maxDelay, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration baseDelay, Duration jitter, Duration maxDelay, Sleeper sleeper, DoubleSupplier random) {
        if (baseDelay.isNegative() || jitter.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (jitter.compareTo(baseDelay) > 0) {
            throw new IllegalArgumentException("Backoff jitter must not exceed the base delay");
        }
        this.baseDelay = baseDelay;
        this.jitter = jitter;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
        this.random = random;
    }

    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt, MAX_EXPONENT));
        double millis = baseDelay.toMillis() * Math.pow(2, exponent) + random.getAsDouble() * jitter.toMillis();
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public Duration pause(int attempt) throws InterruptedException {
        Duration delay = delayFor(attempt);
        sleeper.sleep(delay);
        return delay;
    }
}
