package com.mimecast.mailhealth.probe;

/**
 * Direction of a single send and receive probe.
 */
public enum ProbeDirection {
    INTERNAL_TO_EXTERNAL("internal_to_external", "Internal -> External"),
    EXTERNAL_TO_INTERNAL("external_to_internal", "External -> Internal");

    private final String key;
    private final String label;

    ProbeDirection(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * Gets the metric name fragment.
     *
     * @return Key string.
     */
    public String getKey() {
        return key;
    }

    /**
     * Whether the internal account sends in this direction.
     *
     * @return Boolean.
     */
    public boolean isInternalSender() {
        return this == INTERNAL_TO_EXTERNAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
