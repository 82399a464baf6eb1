package com.mimecast.mailhealth.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Mail health metric store.
 *
 * <p>Single source of truth for every counter and gauge the exporter publishes.
 * <br>Writers take the write lock; snapshots and scrapes take the read lock.
 * <br>A gauge and its paired timestamp gauge are always replaced under the same write lock so a reader
 * never sees a fresh value with a stale timestamp or the other way round.
 *
 * <p>The store is bound into a Micrometer registry through {@link #bindTo(MeterRegistry)}.
 * <br>Exposition code should render through {@link #read(Supplier)} to keep each logical update whole.
 */
public class HealthMetrics {
    private static final Logger log = LogManager.getLogger(HealthMetrics.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final EnumMap<MetricName, Double> values = new EnumMap<>(MetricName.class);

    /**
     * Constructs a new HealthMetrics instance.
     * <p>Working gauges start at 1 and timestamps at the given start instant.
     *
     * @param startedAt Process start instant.
     */
    public HealthMetrics(Instant startedAt) {
        double started = epochSeconds(startedAt);
        for (MetricName name : MetricName.values()) {
            values.put(name, 0.0);
        }
        values.put(MetricName.SENDING_MAILS_WORKING, 1.0);
        values.put(MetricName.RECEIVING_MAILS_WORKING, 1.0);
        values.put(MetricName.LAST_SEND_RECEIVE_CHECK_TIMESTAMP, started);
        values.put(MetricName.LAST_SPAM_SCORE_CHECK_TIMESTAMP, started);
    }

    /**
     * Increments a counter by one.
     *
     * @param name Counter name.
     */
    public void incrementCounter(MetricName name) {
        if (name.getType() != MetricName.Type.COUNTER) {
            throw new IllegalArgumentException(name + " is not a counter");
        }
        lock.writeLock().lock();
        try {
            values.merge(name, 1.0, Double::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sets a gauge together with its timestamp gauge.
     *
     * @param name      Gauge name.
     * @param value     New value.
     * @param timestamp Instant of the observation.
     */
    public void setGauge(MetricName name, double value, Instant timestamp) {
        setGauges(Map.of(name, value), timestamp);
    }

    /**
     * Sets several gauges and their timestamp gauges as one unit.
     *
     * @param gauges    Map of gauge name to value.
     * @param timestamp Instant of the observation.
     */
    public void setGauges(Map<MetricName, Double> gauges, Instant timestamp) {
        for (MetricName name : gauges.keySet()) {
            if (name.getType() != MetricName.Type.GAUGE) {
                throw new IllegalArgumentException(name + " is not a gauge");
            }
        }

        double seconds = epochSeconds(timestamp);
        lock.writeLock().lock();
        try {
            for (Map.Entry<MetricName, Double> entry : gauges.entrySet()) {
                values.put(entry.getKey(), entry.getValue());
                MetricName stamp = entry.getKey().getTimestamp();
                if (stamp != null) {
                    values.put(stamp, seconds);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Gauges updated: {} at {}", gauges, timestamp);
    }

    /**
     * Gets a single value.
     *
     * @param name MetricName.
     * @return Current value.
     */
    public double get(MetricName name) {
        lock.readLock().lock();
        try {
            return values.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets a point in time copy of every value in declaration order.
     *
     * @return Unmodifiable map.
     */
    public Map<MetricName, Double> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new EnumMap<>(values));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a reader while holding the read lock.
     *
     * @param reader Supplier to run.
     * @param <T>    Result type.
     * @return Reader result.
     */
    public <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registers every metric with a Micrometer registry.
     *
     * @param registry MeterRegistry instance.
     */
    public void bindTo(MeterRegistry registry) {
        for (MetricName name : MetricName.values()) {
            if (name.getType() == MetricName.Type.COUNTER) {
                FunctionCounter.builder(name.getMeterName(), this, m -> m.get(name))
                        .description(name.getHelp())
                        .register(registry);
            } else {
                Gauge.builder(name.getMeterName(), this, m -> m.get(name))
                        .description(name.getHelp())
                        .strongReference(true)
                        .register(registry);
            }
        }
        log.info("Mail health metrics bound: {} meters", MetricName.values().length);
    }

    /**
     * Converts an instant to fractional epoch seconds.
     *
     * @param instant Instant.
     * @return Seconds.
     */
    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
