package com.mimecast.mailhealth.probe;

import com.mimecast.mailhealth.mail.MailAccount;
import com.mimecast.mailhealth.mail.ProbeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Send and receive round trip probe.
 *
 * <p>A direction sends a tokenised message from one account, polls the other account's mailbox until the
 * message shows up or the poll window closes, and deletes it on arrival.
 * <br>A round trip runs {@link ProbeDirection#INTERNAL_TO_EXTERNAL} then {@link ProbeDirection#EXTERNAL_TO_INTERNAL}.
 * <br>Each direction always gets its attempt regardless of how the other one went.
 *
 * <p>Nothing thrown leaves this class, errors included: every failure is folded into the returned {@link ProbeAttempt}.
 */
public class RoundTripProbe {
    private static final Logger log = LogManager.getLogger(RoundTripProbe.class);

    private final MailAccount internal;
    private final MailAccount external;
    private final Poller poller;
    private final Clock clock;

    /**
     * Constructs a new RoundTripProbe instance.
     *
     * @param internal Internal MailAccount.
     * @param external External MailAccount.
     * @param poller   Poller bounding the receive wait.
     * @param clock    Clock instance.
     */
    public RoundTripProbe(MailAccount internal, MailAccount external, Poller poller, Clock clock) {
        this.internal = internal;
        this.external = external;
        this.poller = poller;
        this.clock = clock;
    }

    /**
     * Runs both directions sequentially.
     *
     * @return RoundTripResult instance.
     */
    public RoundTripResult run() {
        List<ProbeAttempt> attempts = new ArrayList<>(2);
        for (ProbeDirection direction : ProbeDirection.values()) {
            attempts.add(probe(direction));
        }

        RoundTripResult result = new RoundTripResult(attempts, clock.instant());
        log.info("Mail round trip completed in {} seconds", String.format("%.2f", result.totalDuration().toMillis() / 1000.0));
        return result;
    }

    /**
     * Runs a single direction.
     *
     * @param direction ProbeDirection.
     * @return ProbeAttempt instance.
     */
    public ProbeAttempt probe(ProbeDirection direction) {
        MailAccount from = direction.isInternalSender() ? internal : external;
        MailAccount to = direction.isInternalSender() ? external : internal;

        String token = CorrelationToken.next();
        Instant start = clock.instant();
        ProbeMessage message = new ProbeMessage(from.address(), to.address(), token, start);
        log.info("Starting mail test ({}) with ID: {}", direction, token);

        try {
            from.sender().send(message);
            log.info("Successfully sent test email with ID: {}", token);
        } catch (ProbeException e) {
            log.warn("Failed to send test email ({}) with ID: {}: {} {}", direction, token, e.getFailure(), e.getMessage());
            return attempt(direction, token, start, StepOutcome.FAILURE, StepOutcome.NOT_ATTEMPTED, e.getFailure());
        } catch (Throwable e) {
            log.error("Unexpected error sending test email ({}) with ID: {}", direction, token, e);
            return attempt(direction, token, start, StepOutcome.FAILURE, StepOutcome.NOT_ATTEMPTED, ProbeFailure.UNEXPECTED);
        }

        try {
            Optional<Boolean> found = poller.poll(() -> to.mailbox().findAndDelete(message)
                    ? Optional.of(Boolean.TRUE)
                    : Optional.empty());

            if (found.isPresent()) {
                log.info("Successfully received and deleted test email: {}", token);
                return attempt(direction, token, start, StepOutcome.SUCCESS, StepOutcome.SUCCESS, null);
            }

            log.warn("Test email not found within {} seconds: {}", poller.getTimeout().toSeconds(), token);
            return attempt(direction, token, start, StepOutcome.SUCCESS, StepOutcome.FAILURE, ProbeFailure.TIMEOUT);

        } catch (ProbeException e) {
            log.warn("Error checking for test email ({}) with ID: {}: {} {}", direction, token, e.getFailure(), e.getMessage());
            return attempt(direction, token, start, StepOutcome.SUCCESS, StepOutcome.FAILURE, e.getFailure());
        } catch (Throwable e) {
            log.error("Unexpected error checking for test email ({}) with ID: {}", direction, token, e);
            return attempt(direction, token, start, StepOutcome.SUCCESS, StepOutcome.FAILURE, ProbeFailure.UNEXPECTED);
        }
    }

    private ProbeAttempt attempt(ProbeDirection direction, String token, Instant start,
                                 StepOutcome send, StepOutcome receive, ProbeFailure failure) {
        Duration elapsed = Duration.between(start, clock.instant());
        return new ProbeAttempt(direction, token, start, send, receive, failure, elapsed);
    }
}
