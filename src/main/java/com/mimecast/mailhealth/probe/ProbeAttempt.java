package com.mimecast.mailhealth.probe;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one directional probe.
 *
 * @param direction ProbeDirection.
 * @param token     Correlation token used.
 * @param startedAt Instant the message was handed to the sender.
 * @param send      Send step outcome.
 * @param receive   Receive step outcome.
 * @param failure   Failure kind, null on success.
 * @param elapsed   Time from hand-off to match, or to giving up.
 */
public record ProbeAttempt(ProbeDirection direction,
                           String token,
                           Instant startedAt,
                           StepOutcome send,
                           StepOutcome receive,
                           ProbeFailure failure,
                           Duration elapsed) {

    /**
     * Whether both steps succeeded.
     *
     * @return Boolean.
     */
    public boolean isSuccess() {
        return send == StepOutcome.SUCCESS && receive == StepOutcome.SUCCESS;
    }
}
