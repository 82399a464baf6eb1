package com.mimecast.mailhealth.scanners;

import com.mimecast.mailhealth.probe.ProbeException;

import java.util.OptionalDouble;

/**
 * Capability to read a rendered spam score.
 */
@FunctionalInterface
public interface SpamScoreFetcher {

    /**
     * Fetches the current score.
     *
     * @return Score, empty if the page did not contain one yet.
     * @throws ProbeException Network failure.
     */
    OptionalDouble fetchScore() throws ProbeException;
}
