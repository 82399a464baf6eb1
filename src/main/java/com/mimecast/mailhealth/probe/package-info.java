/**
 * Probes and their results.
 *
 * <h2>RoundTripProbe</h2>
 * <p>Sends a message each way between the internal and external account and waits for it to arrive.
 * <br>Each direction is reported as a {@link com.mimecast.mailhealth.probe.ProbeAttempt} with separate send
 * and receive outcomes so a broken outbound path can be told apart from a broken inbound one.
 *
 * <h2>SpamScoreProbe</h2>
 * <p>Sends a message to a scoring service and scrapes the score from its result page.
 * <br>The service is rate limited on their side so attempts are spaced by a minimum interval.
 *
 * <h2>Poller</h2>
 * <p>Bounded retry loop shared by both probes.
 * <br>Time is read from a {@link java.time.Clock} and waited on through a {@link com.mimecast.mailhealth.probe.Sleeper}
 * so tests can run the loop in virtual time.
 *
 * <h2>Failures</h2>
 * <p>Probe capabilities throw {@link com.mimecast.mailhealth.probe.ProbeException} tagged with a
 * {@link com.mimecast.mailhealth.probe.ProbeFailure} kind. Probes never throw, they fold failures into results.
 */
package com.mimecast.mailhealth.probe;
