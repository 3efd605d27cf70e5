package com.ouc.arq.sdk;

public enum Metric {
    PACKETS_SENT("packets_sent"),
    PACKETS_RESENT("packets_resent"),
    WINDOW_FULL("window_full"),
    ACKS_RECEIVED("acks_received"),
    NEW_ACKS("new_acks"),
    DUPLICATE_ACKS("duplicate_acks"),
    CORRUPTED_RECEIVED("corrupted_received"),
    PACKETS_DELIVERED("packets_delivered"),
    ACKS_SENT("acks_sent"),
    DUPLICATE_PACKETS("duplicate_packets");

    private final String metricName;

    Metric(String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}
