package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.util.List;

/**
 * 回滚失败事件（需要人工介入）
 */
public class RolloutRollbackFailedEvent extends RolloutEvent {

    /**
     * 未能恢复到旧版本的目标
     */
    private final List<TargetId> unrevertedTargets;

    public RolloutRollbackFailedEvent(RolloutId rolloutId, SubjectId subjectId,
                                      List<TargetId> unrevertedTargets, FailureInfo failureInfo) {
        super(rolloutId, subjectId, RolloutStatus.FAILED);
        this.unrevertedTargets = List.copyOf(unrevertedTargets);
        setFailureInfo(failureInfo);
        setMessage(String.format("回滚失败，%d 个目标未恢复，需要人工介入", unrevertedTargets.size()));
    }

    public List<TargetId> getUnrevertedTargets() {
        return unrevertedTargets;
    }
}
