package xyz.firestige.rollout.facade.exception;

/**
 * Rollout 不存在
 */
public class RolloutNotFoundException extends RuntimeException {

    public RolloutNotFoundException(String message) {
        super(message);
    }

    public RolloutNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
