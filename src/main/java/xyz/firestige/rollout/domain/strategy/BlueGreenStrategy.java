package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.health.HealthThresholds;

import java.time.Duration;

/**
 * 蓝绿发布：先部署绿色侧并验证，再切换流量
 *
 * @param validationPeriod           绿色侧部署后的验证窗口（默认 5 分钟）
 * @param postSwitchMonitoringPeriod 流量切换后的监控窗口（默认 1 分钟）
 * @param retentionPeriod            蓝色侧保留时长，供外部清理任务使用（默认 24 小时）
 */
public record BlueGreenStrategy(Duration validationPeriod,
                                Duration postSwitchMonitoringPeriod,
                                Duration retentionPeriod,
                                HealthThresholds thresholds,
                                boolean abortOnAnyTargetFailure,
                                int maxConcurrency) implements RolloutStrategy {

    public static final Duration DEFAULT_VALIDATION_PERIOD = Duration.ofMinutes(5);
    public static final Duration DEFAULT_POST_SWITCH_MONITORING_PERIOD = Duration.ofMinutes(1);
    public static final Duration DEFAULT_RETENTION_PERIOD = Duration.ofHours(24);

    public BlueGreenStrategy {
        if (validationPeriod == null) {
            validationPeriod = DEFAULT_VALIDATION_PERIOD;
        }
        if (postSwitchMonitoringPeriod == null) {
            postSwitchMonitoringPeriod = DEFAULT_POST_SWITCH_MONITORING_PERIOD;
        }
        if (retentionPeriod == null) {
            retentionPeriod = DEFAULT_RETENTION_PERIOD;
        }
        if (validationPeriod.isNegative() || postSwitchMonitoringPeriod.isNegative()) {
            throw new IllegalArgumentException("validationPeriod / postSwitchMonitoringPeriod 不能为负");
        }
        if (thresholds == null) {
            thresholds = HealthThresholds.defaults();
        }
        RolloutStrategy.checkConcurrency(maxConcurrency);
    }

    public static BlueGreenStrategy defaults() {
        return of(DEFAULT_VALIDATION_PERIOD, DEFAULT_POST_SWITCH_MONITORING_PERIOD, HealthThresholds.defaults());
    }

    public static BlueGreenStrategy of(Duration validationPeriod, Duration postSwitchMonitoringPeriod,
                                       HealthThresholds thresholds) {
        return new BlueGreenStrategy(validationPeriod, postSwitchMonitoringPeriod, DEFAULT_RETENTION_PERIOD,
                thresholds, StrategyType.BLUE_GREEN.isDefaultAbortOnAnyTargetFailure(), 0);
    }

    @Override
    public StrategyType type() {
        return StrategyType.BLUE_GREEN;
    }
}
