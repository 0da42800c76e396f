package xyz.firestige.fleet.infrastructure.metrics;

import java.time.Duration;

/**
 * 部署指标
 * <p>
 * tags 为成对的键值，如 {@code "kind", "container"}
 */
public interface MetricsRegistry {

    void incrementCounter(String name, String... tags);

    void setGauge(String name, double value);

    void recordDuration(String name, Duration duration, String... tags);
}
