package xyz.firestige.rollout.facade.exception;

import xyz.firestige.rollout.domain.shared.exception.FailureInfo;

/**
 * Rollout 操作异常
 * 发起、取消、回滚被拒绝时抛出
 */
public class RolloutOperationException extends RuntimeException {

    private final FailureInfo failureInfo;

    public RolloutOperationException(String message, FailureInfo failureInfo) {
        super(message);
        this.failureInfo = failureInfo;
    }

    public RolloutOperationException(String message, FailureInfo failureInfo, Throwable cause) {
        super(message, cause);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
