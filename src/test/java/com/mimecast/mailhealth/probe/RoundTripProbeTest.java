package com.mimecast.mailhealth.probe;

import com.mimecast.mailhealth.mail.InMemoryMailServer;
import com.mimecast.mailhealth.mail.MailAccount;
import com.mimecast.mailhealth.mail.ProbeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ServiceConfigurationError;

import static org.junit.jupiter.api.Assertions.*;

class RoundTripProbeTest {

    private static final String INTERNAL = "monitor@internal.example.com";
    private static final String EXTERNAL = "monitor@external.example.net";
    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryMailServer mail;
    private RoundTripProbe probe;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        mail = new InMemoryMailServer(clock);
        Poller poller = new Poller(clock, clock.sleeper(), Duration.ofSeconds(1), Duration.ofSeconds(60));
        probe = new RoundTripProbe(mail.account(INTERNAL), mail.account(EXTERNAL), poller, clock);
    }

    @Test
    void testHealthyRoundTrip() {
        mail.deliverAfter(EXTERNAL, Duration.ofSeconds(2))
                .deliverAfter(INTERNAL, Duration.ofSeconds(3));

        RoundTripResult result = probe.run();

        assertEquals(2, result.attempts().size());
        ProbeAttempt outbound = result.attempts().get(0);
        ProbeAttempt inbound = result.attempts().get(1);

        assertEquals(ProbeDirection.INTERNAL_TO_EXTERNAL, outbound.direction());
        assertEquals(ProbeDirection.EXTERNAL_TO_INTERNAL, inbound.direction());
        assertTrue(outbound.isSuccess());
        assertTrue(inbound.isSuccess());
        assertNull(outbound.failure());
        assertEquals(Duration.ofSeconds(2), outbound.elapsed());
        assertEquals(Duration.ofSeconds(3), inbound.elapsed());

        assertEquals(Duration.ofSeconds(5), result.totalDuration());
        assertTrue(result.isSendingWorking());
        assertTrue(result.isReceivingWorking());
        assertEquals(START.plusSeconds(5), result.completedAt());

        // Both messages were found and deleted.
        assertEquals(0, mail.getPending(INTERNAL));
        assertEquals(0, mail.getPending(EXTERNAL));
    }

    @Test
    void testMessagesCarryDistinctTokens() {
        mail.deliverAfter(EXTERNAL, Duration.ZERO)
                .deliverAfter(INTERNAL, Duration.ZERO);

        RoundTripResult result = probe.run();

        assertEquals(2, mail.getSent().size());
        ProbeMessage first = mail.getSent().get(0);
        ProbeMessage second = mail.getSent().get(1);
        assertNotEquals(first.token(), second.token());
        assertEquals(first.token(), result.attempts().get(0).token());
        assertEquals(INTERNAL, first.from());
        assertEquals(EXTERNAL, first.to());
        assertEquals(EXTERNAL, second.from());
        assertEquals(INTERNAL, second.to());
        assertEquals(ProbeMessage.SUBJECT_PREFIX + first.token(), first.subject());
    }

    @Test
    void testSendFailureSkipsReceiveAndOtherDirectionStillRuns() {
        mail.failSend(INTERNAL, ProbeFailure.CONNECTION)
                .deliverAfter(INTERNAL, Duration.ofSeconds(1));

        RoundTripResult result = probe.run();

        ProbeAttempt outbound = result.attempts().get(0);
        assertEquals(StepOutcome.FAILURE, outbound.send());
        assertEquals(StepOutcome.NOT_ATTEMPTED, outbound.receive());
        assertEquals(ProbeFailure.CONNECTION, outbound.failure());
        assertEquals(0, mail.getSearches(EXTERNAL), "No polling after a failed send");

        ProbeAttempt inbound = result.attempts().get(1);
        assertTrue(inbound.isSuccess());

        assertFalse(result.isSendingWorking());
        assertFalse(result.isReceivingWorking());
    }

    @Test
    void testUndeliveredMessageTimesOut() {
        mail.deliverAfter(INTERNAL, Duration.ZERO);

        ProbeAttempt attempt = probe.probe(ProbeDirection.INTERNAL_TO_EXTERNAL);

        assertEquals(StepOutcome.SUCCESS, attempt.send());
        assertEquals(StepOutcome.FAILURE, attempt.receive());
        assertEquals(ProbeFailure.TIMEOUT, attempt.failure());
        assertEquals(Duration.ofSeconds(60), attempt.elapsed());
    }

    @Test
    void testOlderProbeMessageDoesNotMatch() {
        ProbeMessage stale = new ProbeMessage(INTERNAL, EXTERNAL, CorrelationToken.next(), START.minusSeconds(300));
        mail.place(stale);

        ProbeAttempt attempt = probe.probe(ProbeDirection.INTERNAL_TO_EXTERNAL);

        assertEquals(ProbeFailure.TIMEOUT, attempt.failure());
        assertEquals(1, mail.getPending(EXTERNAL), "Stale message is left alone");
    }

    @Test
    void testAuthenticationFailureStopsPolling() {
        mail.deliverAfter(EXTERNAL, Duration.ofSeconds(5))
                .failMailbox(EXTERNAL, ProbeFailure.AUTHENTICATION);

        ProbeAttempt attempt = probe.probe(ProbeDirection.INTERNAL_TO_EXTERNAL);

        assertEquals(StepOutcome.SUCCESS, attempt.send());
        assertEquals(StepOutcome.FAILURE, attempt.receive());
        assertEquals(ProbeFailure.AUTHENTICATION, attempt.failure());
        assertEquals(1, mail.getSearches(EXTERNAL));
        assertEquals(Duration.ZERO, attempt.elapsed());
    }

    @Test
    void testMailboxUnreachableUntilDeadline() {
        mail.deliverAfter(EXTERNAL, Duration.ofSeconds(5))
                .failMailbox(EXTERNAL, ProbeFailure.CONNECTION);

        ProbeAttempt attempt = probe.probe(ProbeDirection.INTERNAL_TO_EXTERNAL);

        assertEquals(ProbeFailure.CONNECTION, attempt.failure());
        assertEquals(Duration.ofSeconds(60), attempt.elapsed());
    }

    @Test
    void testUnexpectedSenderErrorIsContained() {
        MailAccount broken = new MailAccount(INTERNAL, message -> {
            throw new IllegalStateException("boom");
        }, mail.mailbox(INTERNAL));
        Poller poller = new Poller(clock, clock.sleeper(), Duration.ofSeconds(1), Duration.ofSeconds(60));
        RoundTripProbe brokenProbe = new RoundTripProbe(broken, mail.account(EXTERNAL), poller, clock);

        ProbeAttempt attempt = brokenProbe.probe(ProbeDirection.INTERNAL_TO_EXTERNAL);

        assertEquals(StepOutcome.FAILURE, attempt.send());
        assertEquals(ProbeFailure.UNEXPECTED, attempt.failure());
    }

    @Test
    void testLinkageErrorInOneDirectionLeavesTheOtherRunning() {
        MailAccount broken = new MailAccount(INTERNAL, message -> {
            throw new ServiceConfigurationError("provider broken");
        }, mail.mailbox(INTERNAL));
        Poller poller = new Poller(clock, clock.sleeper(), Duration.ofSeconds(1), Duration.ofSeconds(60));
        RoundTripProbe brokenProbe = new RoundTripProbe(broken, mail.account(EXTERNAL), poller, clock);
        mail.deliverAfter(INTERNAL, Duration.ofSeconds(2));

        RoundTripResult result = brokenProbe.run();

        assertEquals(2, result.attempts().size());
        ProbeAttempt first = result.attempts().get(0);
        assertEquals(ProbeDirection.INTERNAL_TO_EXTERNAL, first.direction());
        assertEquals(StepOutcome.FAILURE, first.send());
        assertEquals(StepOutcome.NOT_ATTEMPTED, first.receive());
        assertEquals(ProbeFailure.UNEXPECTED, first.failure());

        ProbeAttempt second = result.attempts().get(1);
        assertEquals(ProbeDirection.EXTERNAL_TO_INTERNAL, second.direction());
        assertEquals(StepOutcome.SUCCESS, second.send());
        assertEquals(StepOutcome.SUCCESS, second.receive());
    }

    @Test
    void testErrorWhileSearchingIsReceiveFailure() {
        MailAccount broken = new MailAccount(EXTERNAL, mail.sender(EXTERNAL), message -> {
            throw new NoClassDefFoundError("org/eclipse/angus/mail/imap/IMAPStore");
        });
        Poller poller = new Poller(clock, clock.sleeper(), Duration.ofSeconds(1), Duration.ofSeconds(60));
        RoundTripProbe brokenProbe = new RoundTripProbe(mail.account(INTERNAL), broken, poller, clock);

        ProbeAttempt attempt = brokenProbe.probe(ProbeDirection.INTERNAL_TO_EXTERNAL);

        assertEquals(StepOutcome.SUCCESS, attempt.send());
        assertEquals(StepOutcome.FAILURE, attempt.receive());
        assertEquals(ProbeFailure.UNEXPECTED, attempt.failure());
    }
}
