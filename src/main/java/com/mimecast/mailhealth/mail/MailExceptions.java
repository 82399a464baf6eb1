package com.mimecast.mailhealth.mail;

import com.mimecast.mailhealth.probe.ProbeException;
import com.mimecast.mailhealth.probe.ProbeFailure;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;

/**
 * Maps Jakarta Mail exceptions to probe failures.
 */
final class MailExceptions {

    private MailExceptions() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Wraps a messaging exception.
     * <p>Rejected credentials are not worth retrying, everything else is treated as a connection problem.
     *
     * @param action Short description of what failed.
     * @param e      MessagingException instance.
     * @return ProbeException instance.
     */
    static ProbeException wrap(String action, MessagingException e) {
        ProbeFailure failure = e instanceof AuthenticationFailedException
                ? ProbeFailure.AUTHENTICATION
                : ProbeFailure.CONNECTION;
        return new ProbeException(failure, action + ": " + e.getMessage(), e);
    }
}
