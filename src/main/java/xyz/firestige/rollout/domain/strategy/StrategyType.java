package xyz.firestige.rollout.domain.strategy;

/**
 * 发布策略类型
 */
public enum StrategyType {

    DIRECT("直接发布", true),

    CANARY("金丝雀发布", false),

    ROLLING("滚动发布", false),

    BLUE_GREEN("蓝绿发布", true);

    private final String description;
    private final boolean defaultAbortOnAnyTargetFailure;

    StrategyType(String description, boolean defaultAbortOnAnyTargetFailure) {
        this.description = description;
        this.defaultAbortOnAnyTargetFailure = defaultAbortOnAnyTargetFailure;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 未显式配置时，单个目标失败是否立即中止
     */
    public boolean isDefaultAbortOnAnyTargetFailure() {
        return defaultAbortOnAnyTargetFailure;
    }
}
