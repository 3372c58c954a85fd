package xyz.firestige.rollout.domain.strategy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import xyz.firestige.rollout.domain.health.HealthThresholds;

/**
 * 发布策略
 * <p>
 * 四种策略各自携带参数，调用方通过 {@link #type()} 分派。
 * 所有策略共享两项中止/并发参数：
 * <ul>
 *   <li>abortOnAnyTargetFailure：任一目标失败即中止；否则成功比例低于 successRateMin 才中止</li>
 *   <li>maxConcurrency：单个 Stage 内并发上限，0 表示不限制（以 Stage 大小为准）</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DirectStrategy.class, name = "DIRECT"),
        @JsonSubTypes.Type(value = CanaryStrategy.class, name = "CANARY"),
        @JsonSubTypes.Type(value = RollingStrategy.class, name = "ROLLING"),
        @JsonSubTypes.Type(value = BlueGreenStrategy.class, name = "BLUE_GREEN")
})
public interface RolloutStrategy {

    StrategyType type();

    HealthThresholds thresholds();

    boolean abortOnAnyTargetFailure();

    int maxConcurrency();

    /**
     * 计算某个 Stage 的有效并发度
     */
    default int effectiveConcurrency(int stageSize) {
        int limit = maxConcurrency() > 0 ? maxConcurrency() : stageSize;
        return Math.max(1, Math.min(stageSize, limit));
    }

    static void checkConcurrency(int maxConcurrency) {
        if (maxConcurrency < 0) {
            throw new IllegalArgumentException("maxConcurrency 不能为负数: " + maxConcurrency);
        }
    }
}
