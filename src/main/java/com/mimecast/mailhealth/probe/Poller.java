package com.mimecast.mailhealth.probe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Bounded poll loop.
 *
 * <p>Runs a check repeatedly with a fixed interval until it yields a value or the deadline passes.
 * <br>The first check runs immediately and the last one runs at the deadline.
 * <br>Retryable {@link ProbeException} failures are remembered and retried, any other failure ends the loop.
 * <br>If the deadline passes while the most recent check had failed, that failure is thrown
 * instead of returning empty so callers can tell a broken mailbox from a missing message.
 *
 * <p>Usage:
 * <pre>{@code
 * Poller poller = new Poller(clock, Sleeper.SYSTEM, Duration.ofSeconds(10), Duration.ofSeconds(60));
 * Optional<Boolean> found = poller.poll(() -> mailbox.remove(message) ? Optional.of(true) : Optional.empty());
 * }</pre>
 */
public class Poller {
    private static final Logger log = LogManager.getLogger(Poller.class);

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration interval;
    private final Duration timeout;

    /**
     * Constructs a new Poller instance.
     *
     * @param clock    Clock instance.
     * @param sleeper  Sleeper instance.
     * @param interval Pause between checks.
     * @param timeout  Total time budget measured from the first check.
     */
    public Poller(Clock clock, Sleeper sleeper, Duration interval, Duration timeout) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Poll timeout must not be negative");
        }
        this.clock = clock;
        this.sleeper = sleeper;
        this.interval = interval;
        this.timeout = timeout;
    }

    /**
     * Check to poll.
     *
     * @param <T> Result type.
     */
    @FunctionalInterface
    public interface Check<T> {

        /**
         * Runs one check.
         *
         * @return Optional result, empty if not there yet.
         * @throws ProbeException On failure.
         */
        Optional<T> run() throws ProbeException;
    }

    /**
     * Polls until the check yields a value or the deadline passes.
     *
     * @param check Check instance.
     * @param <T>   Result type.
     * @return Optional result, empty on timeout.
     * @throws ProbeException Non-retryable failure, or the last retryable failure if still failing at the deadline.
     */
    public <T> Optional<T> poll(Check<T> check) throws ProbeException {
        Instant deadline = clock.instant().plus(timeout);
        int count = 0;

        while (true) {
            count++;
            ProbeException lastError = null;
            try {
                Optional<T> result = check.run();
                if (result.isPresent()) {
                    log.debug("Poll matched after {} checks", count);
                    return result;
                }
            } catch (ProbeException e) {
                if (!e.getFailure().isRetryable()) {
                    throw e;
                }
                log.debug("Poll check {} failed: {}", count, e.getMessage());
                lastError = e;
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                log.debug("Poll deadline reached after {} checks", count);
                if (lastError != null) {
                    throw lastError;
                }
                return Optional.empty();
            }

            try {
                sleeper.sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProbeException(ProbeFailure.UNEXPECTED, "Interrupted while polling", e);
            }
        }
    }

    /**
     * Gets timeout.
     *
     * @return Duration.
     */
    public Duration getTimeout() {
        return timeout;
    }
}
