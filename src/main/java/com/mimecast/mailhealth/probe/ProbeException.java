package com.mimecast.mailhealth.probe;

/**
 * Probe exception.
 *
 * <p>Thrown by mail and scoring capabilities with a {@link ProbeFailure} classification.
 */
public class ProbeException extends Exception {

    private final ProbeFailure failure;

    /**
     * Constructs a new ProbeException instance.
     *
     * @param failure ProbeFailure kind.
     * @param message Message string.
     */
    public ProbeException(ProbeFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    /**
     * Constructs a new ProbeException instance with cause.
     *
     * @param failure ProbeFailure kind.
     * @param message Message string.
     * @param cause   Throwable.
     */
    public ProbeException(ProbeFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    /**
     * Gets failure kind.
     *
     * @return ProbeFailure.
     */
    public ProbeFailure getFailure() {
        return failure;
    }
}
