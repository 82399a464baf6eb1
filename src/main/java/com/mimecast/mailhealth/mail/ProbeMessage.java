package com.mimecast.mailhealth.mail;

import java.time.Instant;

/**
 * Probe message carrying a correlation token.
 *
 * <p>The token is placed in the subject so the receiving mailbox can be searched server side.
 *
 * @param from      Sender address.
 * @param to        Recipient address.
 * @param token     Correlation token.
 * @param createdAt Creation instant.
 */
public record ProbeMessage(String from, String to, String token, Instant createdAt) {

    /**
     * Subject prefix shared by all probe messages.
     */
    public static final String SUBJECT_PREFIX = "Mail Health Exporter - ";

    /**
     * Mailer header value.
     */
    public static final String MAILER = "Mail Health Exporter";

    /**
     * Gets subject.
     *
     * @return Subject string.
     */
    public String subject() {
        return SUBJECT_PREFIX + token;
    }

    /**
     * Gets plain text body.
     *
     * @return Body string.
     */
    public String body() {
        return "This is an automated test email from the mail health exporter service.\r\n" +
                "\r\n" +
                "Test ID: " + token + "\r\n" +
                "Timestamp: " + createdAt + "\r\n" +
                "\r\n" +
                "This email should be automatically processed and deleted.\r\n";
    }

    /**
     * Checks if a subject belongs to this message.
     * <p>The token must not be followed by further token characters so one token can never match another
     * that merely starts with it.
     *
     * @param candidate Subject string, may be null.
     * @return Boolean.
     */
    public boolean matchesSubject(String candidate) {
        if (candidate == null) {
            return false;
        }
        String expected = subject();
        int index = candidate.indexOf(expected);
        if (index < 0) {
            return false;
        }
        int end = index + expected.length();
        return end == candidate.length() || !isTokenChar(candidate.charAt(end));
    }

    private static boolean isTokenChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-';
    }
}
