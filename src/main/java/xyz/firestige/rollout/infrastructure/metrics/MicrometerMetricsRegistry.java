package xyz.firestige.rollout.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class MicrometerMetricsRegistry implements MetricsRegistry {
    private final MeterRegistry registry;
    private final ConcurrentMap<String, GaugeValue> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) { this.registry = registry; }

    @Override
    public void incrementCounter(String name) { registry.counter(name).increment(); }

    @Override
    public void setGauge(String name, double value) {
        gauges.computeIfAbsent(name, n -> {
            GaugeValue holder = new GaugeValue();
            registry.gauge(n, holder, GaugeValue::get);
            return holder;
        }).set(value);
    }

    /**
     * Micrometer 只持有弱引用，由本类保持强引用
     */
    static final class GaugeValue {
        private volatile double value;
        double get() { return value; }
        void set(double value) { this.value = value; }
    }
}
