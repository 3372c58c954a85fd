package xyz.firestige.rollout.application.coordinator;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;

/**
 * Rollout 操作结果
 * 用于单个 Rollout 的取消、回滚、恢复操作
 */
public class RolloutOperationResult {

    private boolean success;
    private String rolloutId;
    private RolloutStatus status;
    private FailureInfo failureInfo;
    private String message;

    public RolloutOperationResult() {
    }

    public static RolloutOperationResult success(String rolloutId, RolloutStatus status, String message) {
        RolloutOperationResult result = new RolloutOperationResult();
        result.success = true;
        result.rolloutId = rolloutId;
        result.status = status;
        result.message = message;
        return result;
    }

    public static RolloutOperationResult failure(String rolloutId, FailureInfo failureInfo) {
        RolloutOperationResult result = new RolloutOperationResult();
        result.success = false;
        result.rolloutId = rolloutId;
        result.failureInfo = failureInfo;
        result.message = failureInfo.getErrorMessage();
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getRolloutId() {
        return rolloutId;
    }

    public RolloutStatus getStatus() {
        return status;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "RolloutOperationResult{" +
                "success=" + success +
                ", rolloutId='" + rolloutId + '\'' +
                ", status=" + status +
                ", message='" + message + '\'' +
                '}';
    }
}
