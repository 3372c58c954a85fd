package xyz.firestige.rollout.domain.health;

import java.util.Map;

/**
 * 某一时刻活跃目标的健康快照
 *
 * @param successRate 成功率 [0, 1]
 * @param metrics     命名指标（error-rate、latency-p99、throughput 等，允许自定义名称）
 */
public record HealthSnapshot(double successRate, Map<String, Double> metrics) {

    public static final String ERROR_RATE = "error-rate";
    public static final String LATENCY_P99 = "latency-p99";
    public static final String THROUGHPUT = "throughput";

    public HealthSnapshot {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static HealthSnapshot of(double successRate) {
        return new HealthSnapshot(successRate, Map.of());
    }

    public static HealthSnapshot of(double successRate, Map<String, Double> metrics) {
        return new HealthSnapshot(successRate, metrics);
    }
}
