package xyz.firestige.rollout.facade;

import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.strategy.StrategyType;
import xyz.firestige.rollout.domain.target.TargetStatus;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rollout 状态信息（Facade 层 DTO）
 * 用于查询 Rollout 状态的返回值
 */
public class RolloutStatusInfo {

    private String rolloutId;
    private String subjectId;
    private RolloutStatus status;
    private StrategyType strategyType;
    private String targetVersion;
    private String previousVersion;
    private int currentStageIndex;
    private int activeStageIndex;
    private int totalStages;
    private int exposedPercentage;
    private boolean halted;
    private Map<String, TargetStatus> targetStatuses = new LinkedHashMap<>();
    private List<String> unrevertedTargets = List.of();
    private String rollbackReason;
    private FailureInfo failureInfo;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime rolledBackAt;

    public RolloutStatusInfo() {
    }

    public static RolloutStatusInfo fromSnapshot(RolloutSnapshot snapshot) {
        RolloutStatusInfo info = new RolloutStatusInfo();
        info.rolloutId = snapshot.rolloutId().getValue();
        info.subjectId = snapshot.subjectId().getValue();
        info.status = snapshot.status();
        info.strategyType = snapshot.strategy().type();
        info.targetVersion = snapshot.targetVersion();
        info.previousVersion = snapshot.previousVersion();
        info.currentStageIndex = snapshot.currentStageIndex();
        info.activeStageIndex = snapshot.activeStageIndex();
        info.totalStages = snapshot.stages().size();
        info.exposedPercentage = snapshot.exposedPercentage();
        info.halted = snapshot.halted();
        snapshot.targetStatuses().forEach((id, status) -> info.targetStatuses.put(id.getValue(), status));
        info.unrevertedTargets = snapshot.unrevertedTargets().stream().map(TargetId::getValue).toList();
        info.rollbackReason = snapshot.rollbackReason();
        info.failureInfo = snapshot.failureInfo();
        info.createdAt = snapshot.createdAt();
        info.startedAt = snapshot.startedAt();
        info.completedAt = snapshot.completedAt();
        info.rolledBackAt = snapshot.rolledBackAt();
        return info;
    }

    public String getRolloutId() {
        return rolloutId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public RolloutStatus getStatus() {
        return status;
    }

    public StrategyType getStrategyType() {
        return strategyType;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public String getPreviousVersion() {
        return previousVersion;
    }

    public int getCurrentStageIndex() {
        return currentStageIndex;
    }

    public int getActiveStageIndex() {
        return activeStageIndex;
    }

    public int getTotalStages() {
        return totalStages;
    }

    public int getExposedPercentage() {
        return exposedPercentage;
    }

    public boolean isHalted() {
        return halted;
    }

    public Map<String, TargetStatus> getTargetStatuses() {
        return targetStatuses;
    }

    public List<String> getUnrevertedTargets() {
        return unrevertedTargets;
    }

    public String getRollbackReason() {
        return rollbackReason;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public LocalDateTime getRolledBackAt() {
        return rolledBackAt;
    }

    @Override
    public String toString() {
        return "RolloutStatusInfo{" +
                "rolloutId='" + rolloutId + '\'' +
                ", subjectId='" + subjectId + '\'' +
                ", status=" + status +
                ", stage=" + currentStageIndex + "/" + totalStages +
                ", halted=" + halted +
                '}';
    }
}
