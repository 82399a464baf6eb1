package com.mimecast.mailhealth.probe;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlation token generator.
 *
 * <p>Each probe message carries a fresh token so the receiving side can recognise it among unrelated mail.
 * <br>Tokens combine a process wide sequence, the current epoch millis and random bits.
 */
public final class CorrelationToken {

    private static final AtomicLong sequence = new AtomicLong();
    private static final SecureRandom random = new SecureRandom();

    /**
     * Private constructor for utility class.
     */
    private CorrelationToken() {
    }

    /**
     * Generates a new token.
     *
     * @return Token string, lowercase alphanumeric separated by dashes.
     */
    public static String next() {
        long seq = sequence.incrementAndGet();
        long millis = System.currentTimeMillis();
        long bits = random.nextLong() >>> 1;

        return Long.toString(millis, 36) + "-" + Long.toString(seq, 36) + "-" + Long.toString(bits, 36);
    }
}
