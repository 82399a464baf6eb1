package com.mimecast.mailhealth.probe;

import java.time.Instant;

/**
 * Result of a spam score probe.
 *
 * @param outcome   Outcome.
 * @param score     Score, only meaningful on success.
 * @param source    URL the score was read from.
 * @param checkedAt Instant of the check.
 * @param failure   Failure kind, null unless failed.
 */
public record SpamScoreResult(Outcome outcome, double score, String source, Instant checkedAt, ProbeFailure failure) {

    /**
     * Spam score probe outcome.
     */
    public enum Outcome {
        SUCCESS,
        FAILURE,

        /**
         * Minimum interval not elapsed, nothing was sent or fetched.
         */
        SKIPPED
    }

    static SpamScoreResult success(double score, String source, Instant checkedAt) {
        return new SpamScoreResult(Outcome.SUCCESS, score, source, checkedAt, null);
    }

    static SpamScoreResult failure(ProbeFailure failure, String source, Instant checkedAt) {
        return new SpamScoreResult(Outcome.FAILURE, Double.NaN, source, checkedAt, failure);
    }

    static SpamScoreResult skipped(String source, Instant checkedAt) {
        return new SpamScoreResult(Outcome.SKIPPED, Double.NaN, source, checkedAt, null);
    }

    /**
     * Whether the probe did any network work.
     *
     * @return Boolean.
     */
    public boolean isAttempted() {
        return outcome != Outcome.SKIPPED;
    }
}
