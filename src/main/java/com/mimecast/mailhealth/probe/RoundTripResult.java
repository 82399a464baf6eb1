package com.mimecast.mailhealth.probe;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of a full round trip.
 *
 * @param attempts    One attempt per direction, in execution order.
 * @param completedAt Instant the second direction finished.
 */
public record RoundTripResult(List<ProbeAttempt> attempts, Instant completedAt) {

    public RoundTripResult {
        attempts = List.copyOf(attempts);
    }

    /**
     * Sum of both directions' elapsed time.
     *
     * @return Duration.
     */
    public Duration totalDuration() {
        return attempts.stream()
                .map(ProbeAttempt::elapsed)
                .reduce(Duration.ZERO, Duration::plus);
    }

    /**
     * Whether every direction's send step succeeded.
     *
     * @return Boolean.
     */
    public boolean isSendingWorking() {
        return !attempts.isEmpty() && attempts.stream().allMatch(a -> a.send() == StepOutcome.SUCCESS);
    }

    /**
     * Whether every direction's receive step succeeded.
     * <p>A receive that was not attempted counts as not working since delivery could not be confirmed.
     *
     * @return Boolean.
     */
    public boolean isReceivingWorking() {
        return !attempts.isEmpty() && attempts.stream().allMatch(a -> a.receive() == StepOutcome.SUCCESS);
    }
}
