package com.pagesmith.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Capped exponential backoff for calls to external services.
 *
 * Attempt n (1-based) that fails with a retryable exception is followed by a
 * pause of {@code initialBackoff * multiplier^(n-1)}, never longer than
 * {@code maxBackoff}. After {@code maxAttempts} the last exception is rethrown.
 *
 * Pauses are interruptible: when the orchestrator abandons a run the waiting
 * thread gets an {@link InterruptedException} instead of sleeping on.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws InterruptedException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final Sleeper THREAD_SLEEP = d -> Thread.sleep(d.toMillis());

    private final int      maxAttempts;
    private final Duration initialBackoff;
    private final double   multiplier;
    private final Duration maxBackoff;
    private final Sleeper  sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, multiplier, maxBackoff, THREAD_SLEEP);
    }

    private RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier,
                        Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.maxAttempts    = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier     = multiplier;
        this.maxBackoff     = maxBackoff;
        this.sleeper        = sleeper;
    }

    /** Same limits, no waiting between attempts. */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff, sleeper);
    }

    public int maxAttempts() { return maxAttempts; }

    /** Pause after the given failed attempt (1-based). */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(Math.max(capped, 0));
    }

    /**
     * Run {@code attempt} until it succeeds, throws a non-retryable exception, or
     * the attempt ceiling is reached.
     *
     * @param operation name used in log lines
     * @param retryable decides whether a failure is worth another attempt
     */
    public <T> T execute(String operation, Attempt<T> attempt,
                         Predicate<RuntimeException> retryable) throws InterruptedException {
        for (int n = 1; ; n++) {
            try {
                return attempt.run();
            } catch (RuntimeException e) {
                if (n >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration pause = backoffAfter(n);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, n, maxAttempts, pause.toMillis(), e.getMessage());
                if (!pause.isZero()) {
                    sleeper.sleep(pause);
                }
            }
        }
    }
}
