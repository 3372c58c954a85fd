package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.health.HealthThresholds;

/**
 * 直接发布：一个 Stage 覆盖全部目标
 *
 * @param skipHealthChecks 跳过健康检查（默认 true）；否则在一个短窗口后检查一次
 */
public record DirectStrategy(boolean skipHealthChecks,
                             HealthThresholds thresholds,
                             boolean abortOnAnyTargetFailure,
                             int maxConcurrency) implements RolloutStrategy {

    public DirectStrategy {
        if (thresholds == null) {
            thresholds = HealthThresholds.defaults();
        }
        RolloutStrategy.checkConcurrency(maxConcurrency);
    }

    public static DirectStrategy defaults() {
        return new DirectStrategy(true, HealthThresholds.defaults(),
                StrategyType.DIRECT.isDefaultAbortOnAnyTargetFailure(), 0);
    }

    public static DirectStrategy withHealthCheck(HealthThresholds thresholds) {
        return new DirectStrategy(false, thresholds,
                StrategyType.DIRECT.isDefaultAbortOnAnyTargetFailure(), 0);
    }

    @Override
    public StrategyType type() {
        return StrategyType.DIRECT;
    }
}
