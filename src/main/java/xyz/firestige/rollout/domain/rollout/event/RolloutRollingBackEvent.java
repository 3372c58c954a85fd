package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

/**
 * 开始回滚事件
 */
public class RolloutRollingBackEvent extends RolloutEvent {

    private final String reason;
    private final int touchedTargets;

    public RolloutRollingBackEvent(RolloutId rolloutId, SubjectId subjectId, String reason,
                                   int touchedTargets, FailureInfo failureInfo) {
        super(rolloutId, subjectId, RolloutStatus.ROLLING_BACK);
        this.reason = reason;
        this.touchedTargets = touchedTargets;
        setFailureInfo(failureInfo);
        setMessage(String.format("开始回滚 %d 个目标，原因: %s", touchedTargets, reason));
    }

    public String getReason() {
        return reason;
    }

    public int getTouchedTargets() {
        return touchedTargets;
    }
}
