package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.util.List;

/**
 * 回滚完成事件
 */
public class RolloutRolledBackEvent extends RolloutEvent {

    private final String reason;
    private final List<TargetId> revertedTargets;

    public RolloutRolledBackEvent(RolloutId rolloutId, SubjectId subjectId, String reason,
                                  List<TargetId> revertedTargets) {
        super(rolloutId, subjectId, RolloutStatus.ROLLED_BACK);
        this.reason = reason;
        this.revertedTargets = List.copyOf(revertedTargets);
        setMessage(String.format("回滚完成，恢复 %d 个目标，原因: %s", revertedTargets.size(), reason));
    }

    public String getReason() {
        return reason;
    }

    public List<TargetId> getRevertedTargets() {
        return revertedTargets;
    }
}
