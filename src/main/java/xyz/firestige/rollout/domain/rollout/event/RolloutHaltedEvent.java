package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

/**
 * 自动回滚关闭时，失败后挂起等待人工处理的事件
 */
public class RolloutHaltedEvent extends RolloutEvent {

    private final String reason;

    public RolloutHaltedEvent(RolloutId rolloutId, SubjectId subjectId, String reason, FailureInfo failureInfo) {
        super(rolloutId, subjectId, RolloutStatus.DEPLOYING);
        this.reason = reason;
        setFailureInfo(failureInfo);
        setMessage("发布已挂起，等待人工回滚或取消，原因: " + reason);
    }

    public String getReason() {
        return reason;
    }
}
