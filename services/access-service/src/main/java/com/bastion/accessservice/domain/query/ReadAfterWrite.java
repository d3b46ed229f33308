package com.bastion.accessservice.domain.query;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Repeats a read until its result satisfies a predicate or a time budget runs out.
 * <p>
 * Lets a client that just committed a change wait for the eventually-consistent read views to
 * reflect it.
 */
public final class ReadAfterWrite {

    private final Duration maxWait;
    private final Duration tick;

    public ReadAfterWrite(Duration maxWait, Duration tick) {
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be null or negative");
        }
        if (tick == null || tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tick must be positive");
        }
        this.maxWait = maxWait;
        this.tick = tick;
    }

    /** {@link #await(Supplier, Predicate, Duration, Duration)} with this instance's budget. */
    public <T> Optional<T> await(Supplier<T> read, Predicate<? super T> predicate) {
        return await(read, predicate, maxWait, tick);
    }

    /**
     * Reads immediately, then every {@code tick}, until {@code predicate} accepts the value.
     *
     * @param read must not return null
     * @return the first accepted value, or empty if none was accepted within {@code maxWait} or
     *         the thread was interrupted
     */
    public static <T> Optional<T> await(Supplier<T> read, Predicate<? super T> predicate,
                                        Duration maxWait, Duration tick) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            T value = read.get();
            if (predicate.test(value)) {
                return Optional.of(value);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.max(1, Math.min(tick.toMillis(), remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    public Duration maxWait() {
        return maxWait;
    }

    public Duration tick() {
        return tick;
    }
}
