package com.ouc.arq.sdk;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-entity event counters. Every change is also published through
 * {@link SystemContext#recordMetric} as the running total.
 */
public final class Statistics {
    private final Map<Metric, Long> counters = new EnumMap<>(Metric.class);

    public void increment(SystemContext ctx, Metric metric) {
        long value = counters.merge(metric, 1L, Long::sum);
        ctx.recordMetric(metric.metricName(), value);
    }

    public long get(Metric metric) {
        return counters.getOrDefault(metric, 0L);
    }

    public void reset() {
        counters.clear();
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
