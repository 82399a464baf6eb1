package com.mimecast.mailhealth.mail;

import com.mimecast.mailhealth.probe.ProbeException;

/**
 * Capability to find a probe message in a mailbox and remove it.
 */
@FunctionalInterface
public interface Mailbox {

    /**
     * Searches for the message and deletes every match.
     *
     * @param message ProbeMessage to look for.
     * @return True if at least one match was found and deleted.
     * @throws ProbeException Classified mailbox failure.
     */
    boolean findAndDelete(ProbeMessage message) throws ProbeException;
}
