package xyz.firestige.rollout.domain.rollout;

import java.util.EnumSet;
import java.util.Set;

/**
 * Rollout 状态枚举
 * <p>
 * 状态转换说明：
 * - PLANNING → DEPLOYING: 获得主体租约，开始执行
 * - DEPLOYING → COMPLETED: 所有 Stage 通过
 * - DEPLOYING → ROLLING_BACK: 健康门禁失败、部署中止、取消或人工回滚
 * - ROLLING_BACK → ROLLED_BACK: 所有已触达目标恢复到旧版本
 * - ROLLING_BACK → FAILED: 有目标未能恢复，需要人工介入
 * <p>
 * 终态（COMPLETED / ROLLED_BACK / FAILED）没有任何出边，Rollout 变为只读
 */
public enum RolloutStatus {

    PLANNING("规划中"),

    DEPLOYING("发布中"),

    ROLLING_BACK("回滚中"),

    COMPLETED("已完成"),

    ROLLED_BACK("已回滚"),

    FAILED("回滚失败");

    private final String description;

    RolloutStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == FAILED;
    }

    /**
     * 是否占用主体（单飞约束范围内）
     */
    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(RolloutStatus next) {
        return allowedNext().contains(next);
    }

    private Set<RolloutStatus> allowedNext() {
        return switch (this) {
            case PLANNING -> EnumSet.of(DEPLOYING);
            case DEPLOYING -> EnumSet.of(COMPLETED, ROLLING_BACK);
            case ROLLING_BACK -> EnumSet.of(ROLLED_BACK, FAILED);
            case COMPLETED, ROLLED_BACK, FAILED -> EnumSet.noneOf(RolloutStatus.class);
        };
    }
}
