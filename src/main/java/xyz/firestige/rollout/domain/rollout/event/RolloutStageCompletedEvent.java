package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

/**
 * Stage 通过健康门禁事件
 */
public class RolloutStageCompletedEvent extends RolloutEvent {

    private final int stageIndex;
    private final String stageName;
    private final int totalStages;

    public RolloutStageCompletedEvent(RolloutId rolloutId, SubjectId subjectId, int stageIndex,
                                      String stageName, int totalStages) {
        super(rolloutId, subjectId, RolloutStatus.DEPLOYING);
        this.stageIndex = stageIndex;
        this.stageName = stageName;
        this.totalStages = totalStages;
        setMessage(String.format("Stage %s 完成 (%d/%d)", stageName, stageIndex + 1, totalStages));
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getStageName() {
        return stageName;
    }

    public int getTotalStages() {
        return totalStages;
    }
}
