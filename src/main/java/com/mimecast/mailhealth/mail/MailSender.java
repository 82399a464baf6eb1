package com.mimecast.mailhealth.mail;

import com.mimecast.mailhealth.probe.ProbeException;

/**
 * Capability to deliver a probe message.
 */
@FunctionalInterface
public interface MailSender {

    /**
     * Sends the message.
     *
     * @param message ProbeMessage instance.
     * @throws ProbeException Classified delivery failure.
     */
    void send(ProbeMessage message) throws ProbeException;
}
