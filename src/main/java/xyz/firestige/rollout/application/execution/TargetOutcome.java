package xyz.firestige.rollout.application.execution;

import xyz.firestige.rollout.domain.target.Target;

/**
 * 单个目标一次派发（含重试）的最终结果
 */
public record TargetOutcome(Target target, boolean success, int attempts, String message) {

    public static TargetOutcome success(Target target, int attempts) {
        return new TargetOutcome(target, true, attempts, null);
    }

    public static TargetOutcome failure(Target target, int attempts, String message) {
        return new TargetOutcome(target, false, attempts, message);
    }
}
