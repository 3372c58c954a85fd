package xyz.firestige.rollout.domain.health;

import java.util.Map;

/**
 * 健康门禁阈值
 *
 * @param successRateMin 最低成功率 [0, 1]
 * @param metricMaxima   命名指标上限；配置了但快照中缺失的指标视为不通过
 */
public record HealthThresholds(double successRateMin, Map<String, Double> metricMaxima) {

    public static final double DEFAULT_SUCCESS_RATE_MIN = 0.95;

    public HealthThresholds {
        if (Double.isNaN(successRateMin) || successRateMin < 0.0 || successRateMin > 1.0) {
            throw new IllegalArgumentException("successRateMin 必须在 [0, 1] 内: " + successRateMin);
        }
        metricMaxima = metricMaxima == null ? Map.of() : Map.copyOf(metricMaxima);
    }

    public static HealthThresholds defaults() {
        return new HealthThresholds(DEFAULT_SUCCESS_RATE_MIN, Map.of());
    }

    public static HealthThresholds of(double successRateMin) {
        return new HealthThresholds(successRateMin, Map.of());
    }

    public static HealthThresholds of(double successRateMin, Map<String, Double> metricMaxima) {
        return new HealthThresholds(successRateMin, metricMaxima);
    }
}
