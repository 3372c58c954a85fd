package xyz.firestige.rollout.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@DisplayName("MicrometerMetricsRegistry 测试")
class MicrometerMetricsRegistryTest {

    @Test
    @DisplayName("场景: 计数器累加、Gauge 取最后一次设置的值")
    void countersAndGauges() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MicrometerMetricsRegistry metrics = new MicrometerMetricsRegistry(meterRegistry);

        metrics.incrementCounter(MetricsRegistry.ROLLOUT_STARTED);
        metrics.incrementCounter(MetricsRegistry.ROLLOUT_STARTED);
        metrics.setGauge(MetricsRegistry.ROLLOUT_ACTIVE, 3);
        metrics.setGauge(MetricsRegistry.ROLLOUT_ACTIVE, 1);

        assertThat(meterRegistry.get(MetricsRegistry.ROLLOUT_STARTED).counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get(MetricsRegistry.ROLLOUT_ACTIVE).gauge().value()).isEqualTo(1.0);
    }
}
