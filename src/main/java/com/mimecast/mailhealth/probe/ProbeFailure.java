package com.mimecast.mailhealth.probe;

/**
 * Classification of a failed probe step.
 */
public enum ProbeFailure {

    /**
     * Credentials rejected by the SMTP or IMAP server.
     */
    AUTHENTICATION(false),

    /**
     * Network, TLS or protocol level failure.
     */
    CONNECTION(true),

    /**
     * Probe message not observed within the poll window.
     */
    TIMEOUT(false),

    /**
     * Spam score page could not be parsed.
     */
    SCRAPE(true),

    /**
     * Anything not modelled above.
     */
    UNEXPECTED(false);

    private final boolean retryable;

    ProbeFailure(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a poll loop may try again after this failure.
     *
     * @return Boolean.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
