package xyz.firestige.rollout.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于分类 Rollout 过程中的失败，便于错误处理和监控
 */
public enum ErrorType {

    /**
     * 单个目标部署失败或超时（重试耗尽后按策略的中止规则处理）
     */
    TARGET_DEPLOY_ERROR("目标部署失败"),

    /**
     * 健康快照未达阈值（不重试，直接回滚）
     */
    HEALTH_GATE_FAILURE("健康门禁未通过"),

    /**
     * 回滚失败（唯一需要人工介入的错误）
     */
    ROLLBACK_FAILURE("回滚失败"),

    /**
     * 同一主体已有进行中的 Rollout
     */
    ALREADY_IN_PROGRESS("已有进行中的 Rollout"),

    /**
     * 用户取消
     */
    CANCELLED("已取消"),

    /**
     * 参数校验错误
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否需要人工介入
     */
    public boolean requiresManualIntervention() {
        return this == ROLLBACK_FAILURE;
    }
}
