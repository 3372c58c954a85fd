package xyz.firestige.rollout.domain.rollout.event;

import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.strategy.StrategyType;

/**
 * Rollout 开始事件
 */
public class RolloutStartedEvent extends RolloutEvent {

    private final StrategyType strategyType;
    private final int totalStages;
    private final String targetVersion;

    public RolloutStartedEvent(RolloutId rolloutId, SubjectId subjectId, StrategyType strategyType,
                               int totalStages, String targetVersion) {
        super(rolloutId, subjectId, RolloutStatus.DEPLOYING);
        this.strategyType = strategyType;
        this.totalStages = totalStages;
        this.targetVersion = targetVersion;
        setMessage(String.format("开始 %s 发布，共 %d 个 Stage，目标版本 %s",
                strategyType.getDescription(), totalStages, targetVersion));
    }

    public StrategyType getStrategyType() {
        return strategyType;
    }

    public int getTotalStages() {
        return totalStages;
    }

    public String getTargetVersion() {
        return targetVersion;
    }
}
