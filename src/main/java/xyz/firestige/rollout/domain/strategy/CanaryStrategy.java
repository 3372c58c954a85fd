package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.health.HealthThresholds;

import java.time.Duration;

/**
 * 金丝雀发布：按分桶顺序逐步扩大覆盖百分比
 *
 * @param initialPercentage   首个 Stage 的百分比 (0, 100]
 * @param incrementPercentage 每个 Stage 递增的百分比 (0, 100]
 * @param evaluationWindow    每个非末尾 Stage 的观察窗口
 */
public record CanaryStrategy(int initialPercentage,
                             int incrementPercentage,
                             Duration evaluationWindow,
                             HealthThresholds thresholds,
                             boolean abortOnAnyTargetFailure,
                             int maxConcurrency) implements RolloutStrategy {

    public static final int DEFAULT_INITIAL_PERCENTAGE = 10;
    public static final int DEFAULT_INCREMENT_PERCENTAGE = 20;
    public static final Duration DEFAULT_EVALUATION_WINDOW = Duration.ofMinutes(15);

    public CanaryStrategy {
        if (initialPercentage <= 0 || initialPercentage > 100) {
            throw new IllegalArgumentException("initialPercentage 必须在 (0, 100] 内: " + initialPercentage);
        }
        if (incrementPercentage <= 0 || incrementPercentage > 100) {
            throw new IllegalArgumentException("incrementPercentage 必须在 (0, 100] 内: " + incrementPercentage);
        }
        if (evaluationWindow == null) {
            evaluationWindow = DEFAULT_EVALUATION_WINDOW;
        }
        if (evaluationWindow.isNegative()) {
            throw new IllegalArgumentException("evaluationWindow 不能为负: " + evaluationWindow);
        }
        if (thresholds == null) {
            thresholds = HealthThresholds.defaults();
        }
        RolloutStrategy.checkConcurrency(maxConcurrency);
    }

    public static CanaryStrategy defaults() {
        return of(DEFAULT_INITIAL_PERCENTAGE, DEFAULT_INCREMENT_PERCENTAGE, DEFAULT_EVALUATION_WINDOW,
                HealthThresholds.defaults());
    }

    public static CanaryStrategy of(int initialPercentage, int incrementPercentage, Duration evaluationWindow,
                                    HealthThresholds thresholds) {
        return new CanaryStrategy(initialPercentage, incrementPercentage, evaluationWindow, thresholds,
                StrategyType.CANARY.isDefaultAbortOnAnyTargetFailure(), 0);
    }

    @Override
    public StrategyType type() {
        return StrategyType.CANARY;
    }
}
