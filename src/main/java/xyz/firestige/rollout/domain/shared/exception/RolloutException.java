package xyz.firestige.rollout.domain.shared.exception;

/**
 * Rollout 引擎基础异常类
 * <p>
 * 引擎内部错误最终都体现为 Rollout 的终态和 {@link FailureInfo}，
 * 该异常只在引擎内部流转，不要求调用方捕获
 */
public class RolloutException extends RuntimeException {

    private final ErrorType errorType;

    public RolloutException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public RolloutException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo(String failedAt) {
        return FailureInfo.of(errorType, getMessage(), failedAt);
    }
}
