package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.Stage;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.domain.target.TargetStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rollout 只读快照
 * <p>
 * 对外查询、持久化和重启恢复都使用快照，执行中的聚合本身不对外暴露。
 *
 * @param currentStageIndex 已通过健康门禁的 Stage 数；全部回滚后为 -1
 * @param activeStageIndex  正在执行（或最后执行）的 Stage 序号；尚未开始为 -1
 * @param halted            自动回滚关闭时因失败挂起
 */
public record RolloutSnapshot(RolloutId rolloutId,
                              SubjectId subjectId,
                              String targetVersion,
                              String previousVersion,
                              RolloutStrategy strategy,
                              List<Target> targets,
                              List<Stage> stages,
                              RolloutStatus status,
                              int currentStageIndex,
                              int activeStageIndex,
                              Map<TargetId, TargetStatus> targetStatuses,
                              Set<TargetId> touchedTargets,
                              Set<TargetId> unrevertedTargets,
                              boolean autoRollbackEnabled,
                              boolean halted,
                              String rollbackReason,
                              FailureInfo failureInfo,
                              LocalDateTime createdAt,
                              LocalDateTime startedAt,
                              LocalDateTime completedAt,
                              LocalDateTime rolledBackAt) {

    public RolloutSnapshot {
        targets = List.copyOf(targets);
        stages = List.copyOf(stages);
        targetStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(targetStatuses));
        touchedTargets = Collections.unmodifiableSet(new LinkedHashSet<>(touchedTargets));
        unrevertedTargets = unrevertedTargets == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(unrevertedTargets));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public TargetStatus targetStatus(TargetId targetId) {
        return targetStatuses.get(targetId);
    }

    public List<TargetId> targetsIn(TargetStatus targetStatus) {
        return targetStatuses.entrySet().stream()
                .filter(e -> e.getValue() == targetStatus)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * 当前已放量的最高百分比（仅按百分比规划的 Stage 有意义）
     */
    public int exposedPercentage() {
        if (status == RolloutStatus.COMPLETED) {
            return 100;
        }
        if (status != RolloutStatus.DEPLOYING || activeStageIndex < 0) {
            return 0;
        }
        int max = 0;
        for (int i = 0; i <= activeStageIndex && i < stages.size(); i++) {
            Integer percentage = stages.get(i).percentage();
            if (percentage != null) {
                max = Math.max(max, percentage);
            }
        }
        return max;
    }
}
