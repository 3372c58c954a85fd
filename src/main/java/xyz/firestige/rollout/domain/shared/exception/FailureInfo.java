package xyz.firestige.rollout.domain.shared.exception;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 失败信息封装类
 * 统一封装 Rollout 过程中的失败信息（不可变）
 */
public final class FailureInfo {

    private final String errorCode;
    private final String errorMessage;
    private final ErrorType errorType;

    /**
     * 失败位置（Stage 名称或目标 ID）
     */
    private final String failedAt;

    private final LocalDateTime timestamp;

    private FailureInfo(String errorCode, String errorMessage, ErrorType errorType, String failedAt,
                        LocalDateTime timestamp) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.failedAt = failedAt;
        this.timestamp = timestamp != null ? timestamp : LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType.name(), errorMessage, errorType, null, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType.name(), errorMessage, errorType, failedAt, null);
    }

    public static FailureInfo fromException(Throwable e, ErrorType errorType, String failedAt) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new FailureInfo(errorType.name(), message, errorType, failedAt, null);
    }

    /**
     * 从持久化数据恢复
     */
    public static FailureInfo restore(String errorCode, String errorMessage, ErrorType errorType,
                                      String failedAt, LocalDateTime timestamp) {
        return new FailureInfo(errorCode, errorMessage, errorType, failedAt, timestamp);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
