package xyz.firestige.rollout.domain.shared.exception;

/**
 * 非法状态转换异常
 * 当尝试执行状态机不允许的转换时抛出
 */
public class IllegalStateTransitionException extends RolloutException {

    private final String fromStatus;
    private final String toStatus;

    public IllegalStateTransitionException(String rolloutId, Enum<?> fromStatus, Enum<?> toStatus) {
        super(ErrorType.SYSTEM_ERROR,
                String.format("非法状态转换: %s -> %s, rolloutId: %s", fromStatus, toStatus, rolloutId));
        this.fromStatus = String.valueOf(fromStatus);
        this.toStatus = String.valueOf(toStatus);
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }
}
