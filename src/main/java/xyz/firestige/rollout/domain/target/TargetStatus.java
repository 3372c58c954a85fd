package xyz.firestige.rollout.domain.target;

/**
 * 单个目标在一次 Rollout 中的状态
 * <p>
 * 状态转换说明：
 * - PENDING → ACTIVE: 新版本已应用，等待健康检查
 * - PENDING → FAILED: 应用失败（重试耗尽或超时）
 * - ACTIVE → HEALTHY: 所在 Stage 通过健康门禁
 * - ACTIVE/HEALTHY/FAILED → ROLLED_BACK: 已恢复到旧版本
 */
public enum TargetStatus {

    PENDING("待部署"),

    ACTIVE("已部署"),

    HEALTHY("健康"),

    FAILED("失败"),

    ROLLED_BACK("已回滚");

    private final String description;

    TargetStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否已运行新版本（部署成功的目标）
     */
    public boolean isDeployed() {
        return this == ACTIVE || this == HEALTHY;
    }
}
