package com.mimecast.mailhealth.metrics;

import com.mimecast.mailhealth.probe.ProbeDirection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricNameTest {

    @Test
    void testExposedNames() {
        assertEquals("mail_health_exporter__send_internal_to_external_success_total",
                MetricName.SEND_INTERNAL_TO_EXTERNAL_SUCCESS.getExposedName());
        assertEquals("mail_health_exporter__last_spam_score_check_timestamp",
                MetricName.LAST_SPAM_SCORE_CHECK_TIMESTAMP.getExposedName());
        assertEquals(14, MetricName.values().length);
    }

    @Test
    void testCounterMeterNameDropsTotal() {
        assertEquals("mail_health_exporter__receive_external_to_internal_failures",
                MetricName.RECEIVE_EXTERNAL_TO_INTERNAL_FAILURES.getMeterName());
        assertEquals("mail_health_exporter__spam_score", MetricName.SPAM_SCORE.getMeterName());
    }

    @Test
    void testDirectionLookup() {
        for (ProbeDirection direction : ProbeDirection.values()) {
            String key = direction.getKey();
            assertEquals(MetricName.PREFIX + "send_" + key + "_success_total",
                    MetricName.send(direction, true).getExposedName());
            assertEquals(MetricName.PREFIX + "send_" + key + "_failures_total",
                    MetricName.send(direction, false).getExposedName());
            assertEquals(MetricName.PREFIX + "receive_" + key + "_success_total",
                    MetricName.receive(direction, true).getExposedName());
            assertEquals(MetricName.PREFIX + "receive_" + key + "_failures_total",
                    MetricName.receive(direction, false).getExposedName());
        }
    }

    @Test
    void testTimestampPairs() {
        assertEquals(MetricName.LAST_SEND_RECEIVE_CHECK_TIMESTAMP, MetricName.SENDING_MAILS_WORKING.getTimestamp());
        assertEquals(MetricName.LAST_SEND_RECEIVE_CHECK_TIMESTAMP, MetricName.ROUNDTRIP_DURATION_SECONDS.getTimestamp());
        assertEquals(MetricName.LAST_SPAM_SCORE_CHECK_TIMESTAMP, MetricName.SPAM_SCORE.getTimestamp());
        assertNull(MetricName.LAST_SPAM_SCORE_CHECK_TIMESTAMP.getTimestamp());
        assertNull(MetricName.SEND_INTERNAL_TO_EXTERNAL_SUCCESS.getTimestamp());
    }
}
