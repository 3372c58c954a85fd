package xyz.firestige.rollout.facade.exception;

import xyz.firestige.rollout.domain.shared.exception.FailureInfo;

/**
 * 同一主体已有进行中的 Rollout，或 Rollout 正由其他协调器实例执行
 */
public class RolloutConflictException extends RolloutOperationException {

    private final String holderRolloutId;

    public RolloutConflictException(String message, FailureInfo failureInfo, String holderRolloutId) {
        super(message, failureInfo);
        this.holderRolloutId = holderRolloutId;
    }

    /**
     * 占用主体的 Rollout ID，可能为 null
     */
    public String getHolderRolloutId() {
        return holderRolloutId;
    }
}
