package com.mimecast.mailhealth.metrics;

import com.mimecast.mailhealth.probe.ProbeDirection;

/**
 * Fixed metric set exposed by the exporter.
 *
 * <p>Exposed names are a contract with dashboards and alert rules and must not change.
 */
public enum MetricName {
    SEND_INTERNAL_TO_EXTERNAL_SUCCESS("send_internal_to_external_success_total", Type.COUNTER,
            "Total successful mail sends from internal to external"),
    SEND_INTERNAL_TO_EXTERNAL_FAILURES("send_internal_to_external_failures_total", Type.COUNTER,
            "Total failed mail sends from internal to external"),
    RECEIVE_INTERNAL_TO_EXTERNAL_SUCCESS("receive_internal_to_external_success_total", Type.COUNTER,
            "Total successful mail receives from internal to external"),
    RECEIVE_INTERNAL_TO_EXTERNAL_FAILURES("receive_internal_to_external_failures_total", Type.COUNTER,
            "Total failed mail receives from internal to external"),
    SEND_EXTERNAL_TO_INTERNAL_SUCCESS("send_external_to_internal_success_total", Type.COUNTER,
            "Total successful mail sends from external to internal"),
    SEND_EXTERNAL_TO_INTERNAL_FAILURES("send_external_to_internal_failures_total", Type.COUNTER,
            "Total failed mail sends from external to internal"),
    RECEIVE_EXTERNAL_TO_INTERNAL_SUCCESS("receive_external_to_internal_success_total", Type.COUNTER,
            "Total successful mail receives from external to internal"),
    RECEIVE_EXTERNAL_TO_INTERNAL_FAILURES("receive_external_to_internal_failures_total", Type.COUNTER,
            "Total failed mail receives from external to internal"),
    SENDING_MAILS_WORKING("sending_mails_working", Type.GAUGE,
            "Status whether the server is able to send mails or not"),
    RECEIVING_MAILS_WORKING("receiving_mails_working", Type.GAUGE,
            "Status whether the server is able to receive mails or not"),
    ROUNDTRIP_DURATION_SECONDS("roundtrip_duration_seconds", Type.GAUGE,
            "Duration of last full internal->external->internal mail roundtrip"),
    LAST_SEND_RECEIVE_CHECK_TIMESTAMP("last_send_receive_check_timestamp", Type.GAUGE,
            "Timestamp of last send-receive check"),
    SPAM_SCORE("spam_score", Type.GAUGE,
            "Spam score of send mails"),
    LAST_SPAM_SCORE_CHECK_TIMESTAMP("last_spam_score_check_timestamp", Type.GAUGE,
            "Timestamp of last spam-score check");

    /**
     * Prefix of every exposed name.
     */
    public static final String PREFIX = "mail_health_exporter__";

    private static final String TOTAL_SUFFIX = "_total";

    /**
     * Metric type.
     */
    public enum Type {
        COUNTER,
        GAUGE
    }

    private final String suffix;
    private final Type type;
    private final String help;

    MetricName(String suffix, Type type, String help) {
        this.suffix = suffix;
        this.type = type;
        this.help = help;
    }

    /**
     * Gets the name as it appears in the exposition.
     *
     * @return Name string.
     */
    public String getExposedName() {
        return PREFIX + suffix;
    }

    /**
     * Gets the Micrometer meter name.
     * <p>Counters are registered without the total suffix since the Prometheus registry appends it.
     *
     * @return Name string.
     */
    public String getMeterName() {
        String name = getExposedName();
        return type == Type.COUNTER && name.endsWith(TOTAL_SUFFIX)
                ? name.substring(0, name.length() - TOTAL_SUFFIX.length())
                : name;
    }

    /**
     * Gets type.
     *
     * @return Type.
     */
    public Type getType() {
        return type;
    }

    /**
     * Gets help text.
     *
     * @return Help string.
     */
    public String getHelp() {
        return help;
    }

    /**
     * Gets the timestamp gauge updated together with this gauge.
     *
     * @return MetricName, null for counters and for timestamps themselves.
     */
    public MetricName getTimestamp() {
        return switch (this) {
            case SENDING_MAILS_WORKING, RECEIVING_MAILS_WORKING, ROUNDTRIP_DURATION_SECONDS -> LAST_SEND_RECEIVE_CHECK_TIMESTAMP;
            case SPAM_SCORE -> LAST_SPAM_SCORE_CHECK_TIMESTAMP;
            default -> null;
        };
    }

    /**
     * Gets the send counter for a direction.
     *
     * @param direction ProbeDirection.
     * @param success   Success or failure counter.
     * @return MetricName.
     */
    public static MetricName send(ProbeDirection direction, boolean success) {
        if (direction == ProbeDirection.INTERNAL_TO_EXTERNAL) {
            return success ? SEND_INTERNAL_TO_EXTERNAL_SUCCESS : SEND_INTERNAL_TO_EXTERNAL_FAILURES;
        }
        return success ? SEND_EXTERNAL_TO_INTERNAL_SUCCESS : SEND_EXTERNAL_TO_INTERNAL_FAILURES;
    }

    /**
     * Gets the receive counter for a direction.
     *
     * @param direction ProbeDirection.
     * @param success   Success or failure counter.
     * @return MetricName.
     */
    public static MetricName receive(ProbeDirection direction, boolean success) {
        if (direction == ProbeDirection.INTERNAL_TO_EXTERNAL) {
            return success ? RECEIVE_INTERNAL_TO_EXTERNAL_SUCCESS : RECEIVE_INTERNAL_TO_EXTERNAL_FAILURES;
        }
        return success ? RECEIVE_EXTERNAL_TO_INTERNAL_SUCCESS : RECEIVE_EXTERNAL_TO_INTERNAL_FAILURES;
    }
}
