package xyz.firestige.rollout.domain.strategy;

import xyz.firestige.rollout.domain.health.HealthThresholds;

import java.time.Duration;
import java.util.List;

/**
 * 滚动发布：按顺序分批，每批一个 Stage
 *
 * @param order              显式顺序（目标 ID 列表，必须是全部目标的一个排列）；为空时按 (环境, ID) 排序
 * @param batchSize          每批目标数，默认 1
 * @param evaluationWindow   每批部署后的观察窗口
 * @param pauseBetweenStages 批次之间的暂停（最后一批之后不暂停）
 */
public record RollingStrategy(List<String> order,
                              int batchSize,
                              Duration evaluationWindow,
                              Duration pauseBetweenStages,
                              HealthThresholds thresholds,
                              boolean abortOnAnyTargetFailure,
                              int maxConcurrency) implements RolloutStrategy {

    public static final Duration DEFAULT_EVALUATION_WINDOW = Duration.ofSeconds(30);

    public RollingStrategy {
        order = order == null ? List.of() : List.copyOf(order);
        if (batchSize <= 0) {
            batchSize = 1;
        }
        if (evaluationWindow == null) {
            evaluationWindow = DEFAULT_EVALUATION_WINDOW;
        }
        if (pauseBetweenStages == null) {
            pauseBetweenStages = Duration.ZERO;
        }
        if (evaluationWindow.isNegative() || pauseBetweenStages.isNegative()) {
            throw new IllegalArgumentException("evaluationWindow / pauseBetweenStages 不能为负");
        }
        if (thresholds == null) {
            thresholds = HealthThresholds.defaults();
        }
        RolloutStrategy.checkConcurrency(maxConcurrency);
    }

    public static RollingStrategy defaults() {
        return of(List.of(), 1, DEFAULT_EVALUATION_WINDOW, Duration.ZERO, HealthThresholds.defaults());
    }

    public static RollingStrategy of(List<String> order, int batchSize, Duration evaluationWindow,
                                     Duration pauseBetweenStages, HealthThresholds thresholds) {
        return new RollingStrategy(order, batchSize, evaluationWindow, pauseBetweenStages, thresholds,
                StrategyType.ROLLING.isDefaultAbortOnAnyTargetFailure(), 0);
    }

    @Override
    public StrategyType type() {
        return StrategyType.ROLLING;
    }
}
