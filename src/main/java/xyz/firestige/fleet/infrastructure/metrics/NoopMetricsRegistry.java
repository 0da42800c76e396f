package xyz.firestige.fleet.infrastructure.metrics;

import java.time.Duration;

/**
 * 未接入指标时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name, String... tags) {
    }

    @Override
    public void setGauge(String name, double value) {
    }

    @Override
    public void recordDuration(String name, Duration duration, String... tags) {
    }
}
