package com.mimecast.mailhealth.endpoints;

import com.mimecast.mailhealth.metrics.MetricName;

import java.util.Map;

/**
 * Values shown on the status page.
 *
 * @param sendingWorks     Sending gauge is up.
 * @param receivingWorks   Receiving gauge is up.
 * @param spamScore        Last known spam score.
 * @param spamTestUrl      Score page URL.
 * @param sendingUpdated   Round trip timestamp in epoch seconds.
 * @param receivingUpdated Round trip timestamp in epoch seconds.
 * @param spamUpdated      Spam score timestamp in epoch seconds.
 */
public record StatusSnapshot(boolean sendingWorks, boolean receivingWorks, double spamScore, String spamTestUrl,
                             double sendingUpdated, double receivingUpdated, double spamUpdated) {

    /**
     * Builds a snapshot from metric values.
     *
     * @param values      Metric snapshot.
     * @param spamTestUrl Score page URL.
     * @return StatusSnapshot instance.
     */
    public static StatusSnapshot from(Map<MetricName, Double> values, String spamTestUrl) {
        double roundTrip = values.get(MetricName.LAST_SEND_RECEIVE_CHECK_TIMESTAMP);
        return new StatusSnapshot(
                values.get(MetricName.SENDING_MAILS_WORKING) != 0.0,
                values.get(MetricName.RECEIVING_MAILS_WORKING) != 0.0,
                values.get(MetricName.SPAM_SCORE),
                spamTestUrl,
                roundTrip,
                roundTrip,
                values.get(MetricName.LAST_SPAM_SCORE_CHECK_TIMESTAMP)
        );
    }
}
