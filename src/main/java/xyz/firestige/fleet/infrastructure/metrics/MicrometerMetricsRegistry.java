package xyz.firestige.fleet.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Micrometer 的指标实现
 * <p>
 * 仪表值以 double 位模式保存在 AtomicLong 中，由注册表持有引用
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name, String... tags) {
        registry.counter(name, tags).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        AtomicLong bits = gauges.computeIfAbsent(name, n ->
                registry.gauge(n, new AtomicLong(), b -> Double.longBitsToDouble(b.get())));
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public void recordDuration(String name, Duration duration, String... tags) {
        registry.timer(name, tags).record(duration);
    }
}
