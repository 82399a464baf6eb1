package com.mimecast.mailhealth.probe;

import com.mimecast.mailhealth.mail.MailSender;
import com.mimecast.mailhealth.mail.ProbeMessage;
import com.mimecast.mailhealth.scanners.SpamScoreFetcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Spam score probe.
 *
 * <p>Sends a probe message to a third-party scoring address and reads the resulting score back from the
 * service's result page.
 * <br>The service is queried at most once per minimum interval; inside that window {@link #attempt} returns
 * {@link SpamScoreResult.Outcome#SKIPPED} without touching the network.
 * <br>The result page is polled since the service only renders a score once the message has arrived.
 */
public class SpamScoreProbe {
    private static final Logger log = LogManager.getLogger(SpamScoreProbe.class);

    private final MailSender sender;
    private final String fromAddress;
    private final String testAddress;
    private final SpamScoreFetcher fetcher;
    private final String sourceUrl;
    private final Duration minInterval;
    private final Poller poller;
    private final Clock clock;

    /**
     * Constructs a new SpamScoreProbe instance.
     *
     * @param sender      MailSender of the internal account.
     * @param fromAddress Internal account address.
     * @param testAddress Scoring service address.
     * @param fetcher     SpamScoreFetcher reading the result page.
     * @param sourceUrl   Result page URL, reported with results.
     * @param minInterval Minimum time between two attempts.
     * @param poller      Poller bounding the wait for a score.
     * @param clock       Clock instance.
     */
    public SpamScoreProbe(MailSender sender, String fromAddress, String testAddress,
                          SpamScoreFetcher fetcher, String sourceUrl,
                          Duration minInterval, Poller poller, Clock clock) {
        this.sender = sender;
        this.fromAddress = fromAddress;
        this.testAddress = testAddress;
        this.fetcher = fetcher;
        this.sourceUrl = sourceUrl;
        this.minInterval = minInterval;
        this.poller = poller;
        this.clock = clock;
    }

    /**
     * Checks whether an attempt is due.
     *
     * @param lastCheckedAt Instant of the previous attempt, empty if none yet.
     * @param now           Current instant.
     * @return Boolean.
     */
    public boolean isDue(Optional<Instant> lastCheckedAt, Instant now) {
        return lastCheckedAt.isEmpty() || Duration.between(lastCheckedAt.get(), now).compareTo(minInterval) >= 0;
    }

    /**
     * Runs the probe if due.
     *
     * @param lastCheckedAt Instant of the previous attempt, empty if none yet.
     * @param now           Current instant.
     * @return SpamScoreResult instance.
     */
    public SpamScoreResult attempt(Optional<Instant> lastCheckedAt, Instant now) {
        if (!isDue(lastCheckedAt, now)) {
            log.info("Spam score test doesn't need to run yet, last run at {}", lastCheckedAt.orElse(null));
            return SpamScoreResult.skipped(sourceUrl, now);
        }

        String token = CorrelationToken.next();
        log.info("Starting spam score test with ID: {}", token);

        try {
            log.info("Sending email to spam score test from {} to {}", fromAddress, testAddress);
            sender.send(new ProbeMessage(fromAddress, testAddress, token, now));

            log.info("Retrieving spam score from url {}", sourceUrl);
            Optional<Double> score = poller.poll(() -> {
                OptionalDouble fetched = fetcher.fetchScore();
                return fetched.isPresent() ? Optional.of(fetched.getAsDouble()) : Optional.empty();
            });

            if (score.isEmpty()) {
                log.warn("No spam score found at {} within {} seconds", sourceUrl, poller.getTimeout().toSeconds());
                return SpamScoreResult.failure(ProbeFailure.SCRAPE, sourceUrl, clock.instant());
            }

            log.info("Successfully parsed spam score: {}", score.get());
            return SpamScoreResult.success(score.get(), sourceUrl, clock.instant());

        } catch (ProbeException e) {
            log.warn("Spam score test failed with ID: {}: {} {}", token, e.getFailure(), e.getMessage());
            return SpamScoreResult.failure(e.getFailure(), sourceUrl, clock.instant());
        }
    }
}
