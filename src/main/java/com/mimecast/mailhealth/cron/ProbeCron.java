package com.mimecast.mailhealth.cron;

import com.mimecast.mailhealth.metrics.HealthMetrics;
import com.mimecast.mailhealth.metrics.MetricName;
import com.mimecast.mailhealth.probe.ProbeAttempt;
import com.mimecast.mailhealth.probe.ProbeDirection;
import com.mimecast.mailhealth.probe.RoundTripProbe;
import com.mimecast.mailhealth.probe.RoundTripResult;
import com.mimecast.mailhealth.probe.SpamScoreProbe;
import com.mimecast.mailhealth.probe.SpamScoreResult;
import com.mimecast.mailhealth.probe.StepOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Probe cron job.
 * <p>Runs the round trip check and the spam score check on two independent schedules.
 * <p>Each check has its own single thread executor scheduled with a fixed delay, so a slow run pushes the
 * next run of the same check back by a full interval instead of overlapping with it.
 * <p>Every tick is guarded: any throwable escaping a probe, errors included, is logged and folded into the
 * metrics as a failure and never cancels the schedule.
 */
public class ProbeCron {
    private static final Logger log = LogManager.getLogger(ProbeCron.class);

    private final RoundTripProbe roundTripProbe;
    private final SpamScoreProbe spamScoreProbe;
    private final HealthMetrics metrics;
    private final Clock clock;
    private final Duration checkInterval;
    private final Duration spamCheckInterval;
    private final Duration shutdownGrace;

    // Schedulers.
    private ScheduledExecutorService roundTripScheduler;
    private ScheduledExecutorService spamScheduler;

    // In flight guards.
    private final AtomicBoolean roundTripRunning = new AtomicBoolean();
    private final AtomicBoolean spamRunning = new AtomicBoolean();

    // Last spam score attempt, success or failure.
    private final AtomicReference<Instant> lastSpamAttempt = new AtomicReference<>();

    /**
     * Constructs a new ProbeCron instance.
     *
     * @param roundTripProbe    RoundTripProbe instance.
     * @param spamScoreProbe    SpamScoreProbe instance.
     * @param metrics           HealthMetrics instance.
     * @param clock             Clock instance.
     * @param checkInterval     Delay between round trip checks.
     * @param spamCheckInterval Delay between spam score check attempts.
     * @param shutdownGrace     Time allowed for in flight checks on shutdown.
     */
    public ProbeCron(RoundTripProbe roundTripProbe, SpamScoreProbe spamScoreProbe, HealthMetrics metrics, Clock clock,
                     Duration checkInterval, Duration spamCheckInterval, Duration shutdownGrace) {
        this.roundTripProbe = roundTripProbe;
        this.spamScoreProbe = spamScoreProbe;
        this.metrics = metrics;
        this.clock = clock;
        this.checkInterval = checkInterval;
        this.spamCheckInterval = spamCheckInterval;
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Starts both schedules.
     * <p>Both checks run once right away; safe to call once.
     */
    public synchronized void start() {
        if (roundTripScheduler != null) return;

        log.info("ProbeCron starting: checkIntervalSeconds={}, spamCheckIntervalSeconds={}",
                checkInterval.toSeconds(), spamCheckInterval.toSeconds());

        roundTripScheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "probe-roundtrip"));
        spamScheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "probe-spamscore"));

        roundTripScheduler.scheduleWithFixedDelay(this::runRoundTripCheck,
                0, checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        spamScheduler.scheduleWithFixedDelay(this::runSpamScoreCheck,
                0, spamCheckInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops both schedules.
     * <p>In flight checks are not interrupted and get up to the shutdown grace to finish on their own timeouts.
     */
    public synchronized void stop() {
        if (roundTripScheduler == null) return;

        log.info("ProbeCron shutdown initiated");
        roundTripScheduler.shutdown();
        spamScheduler.shutdown();
        try {
            long graceMillis = shutdownGrace.toMillis();
            if (!roundTripScheduler.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Round trip check still running after {} seconds", shutdownGrace.toSeconds());
            }
            if (!spamScheduler.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Spam score check still running after {} seconds", shutdownGrace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for checks to finish");
        }
        roundTripScheduler = null;
        spamScheduler = null;
    }

    /**
     * Runs one guarded round trip check.
     */
    public void runRoundTripCheck() {
        if (!roundTripRunning.compareAndSet(false, true)) {
            log.warn("Round trip check still in flight, skipping tick");
            return;
        }
        try {
            record(roundTripProbe.run());
        } catch (Throwable e) {
            // Anything escaping here would cancel the schedule.
            log.error("Round trip check error: {}", e.getMessage(), e);
            recordFailure();
        } finally {
            roundTripRunning.set(false);
        }
    }

    /**
     * Runs one guarded spam score check.
     */
    public void runSpamScoreCheck() {
        if (!spamRunning.compareAndSet(false, true)) {
            log.warn("Spam score check still in flight, skipping tick");
            return;
        }
        try {
            Instant now = clock.instant();
            Optional<Instant> last = Optional.ofNullable(lastSpamAttempt.get());
            if (spamScoreProbe.isDue(last, now)) {
                lastSpamAttempt.set(now);
            }
            record(spamScoreProbe.attempt(last, now));
        } catch (Throwable e) {
            // Score and timestamp stay as they were.
            log.error("Spam score check error: {}", e.getMessage(), e);
        } finally {
            spamRunning.set(false);
        }
    }

    /**
     * Folds a round trip result into the metrics.
     *
     * @param result RoundTripResult instance.
     */
    void record(RoundTripResult result) {
        for (ProbeAttempt attempt : result.attempts()) {
            metrics.incrementCounter(MetricName.send(attempt.direction(), attempt.send() == StepOutcome.SUCCESS));
            if (attempt.receive() != StepOutcome.NOT_ATTEMPTED) {
                metrics.incrementCounter(MetricName.receive(attempt.direction(), attempt.receive() == StepOutcome.SUCCESS));
            }
        }

        Map<MetricName, Double> gauges = new EnumMap<>(MetricName.class);
        gauges.put(MetricName.SENDING_MAILS_WORKING, result.isSendingWorking() ? 1.0 : 0.0);
        gauges.put(MetricName.RECEIVING_MAILS_WORKING, result.isReceivingWorking() ? 1.0 : 0.0);
        gauges.put(MetricName.ROUNDTRIP_DURATION_SECONDS, result.totalDuration().toMillis() / 1000.0);
        metrics.setGauges(gauges, result.completedAt());
    }

    /**
     * Folds a round trip that never produced a result into the metrics.
     * <p>Counts a send failure for every direction and marks sending and receiving as not working.
     */
    void recordFailure() {
        for (ProbeDirection direction : ProbeDirection.values()) {
            metrics.incrementCounter(MetricName.send(direction, false));
        }
        metrics.setGauges(Map.of(
                MetricName.SENDING_MAILS_WORKING, 0.0,
                MetricName.RECEIVING_MAILS_WORKING, 0.0
        ), clock.instant());
    }

    /**
     * Folds a spam score result into the metrics.
     * <p>Only successful results touch the score, failures keep the last known good value.
     *
     * @param result SpamScoreResult instance.
     */
    void record(SpamScoreResult result) {
        if (result.outcome() == SpamScoreResult.Outcome.SUCCESS) {
            metrics.setGauge(MetricName.SPAM_SCORE, result.score(), result.checkedAt());
        } else if (result.outcome() == SpamScoreResult.Outcome.FAILURE) {
            log.warn("Spam score unchanged after failed check: {}", result.failure());
        }
    }

    /**
     * Gets last spam score attempt.
     *
     * @return Optional of Instant.
     */
    public Optional<Instant> getLastSpamAttempt() {
        return Optional.ofNullable(lastSpamAttempt.get());
    }
}
