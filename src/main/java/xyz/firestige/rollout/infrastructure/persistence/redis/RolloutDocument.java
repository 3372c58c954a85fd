package xyz.firestige.rollout.infrastructure.persistence.redis;

import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.Stage;
import xyz.firestige.rollout.domain.stage.StageKind;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.domain.target.TargetEnvironment;
import xyz.firestige.rollout.domain.target.TargetStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rollout 快照的 JSON 存储结构
 * <p>
 * 值对象统一展开为字符串，策略依赖 {@link RolloutStrategy} 上的类型标识多态序列化。
 */
public class RolloutDocument {

    public String rolloutId;
    public String subjectId;
    public String targetVersion;
    public String previousVersion;
    public RolloutStrategy strategy;
    public List<TargetDoc> targets = new ArrayList<>();
    public List<StageDoc> stages = new ArrayList<>();
    public String status;
    public int currentStageIndex;
    public int activeStageIndex;
    public Map<String, String> targetStatuses = new LinkedHashMap<>();
    public List<String> touchedTargets = new ArrayList<>();
    public List<String> unrevertedTargets = new ArrayList<>();
    public boolean autoRollbackEnabled;
    public boolean halted;
    public String rollbackReason;
    public FailureDoc failure;
    public LocalDateTime createdAt;
    public LocalDateTime startedAt;
    public LocalDateTime completedAt;
    public LocalDateTime rolledBackAt;

    public static class TargetDoc {
        public String id;
        public String bucketKey;
        public String environment;
    }

    public static class StageDoc {
        public int index;
        public String name;
        public String kind;
        public Integer percentage;
        public List<String> targets = new ArrayList<>();
        public Duration evaluationWindow;
        public boolean requiresHealthCheck;
        public Duration pauseAfter;
        public HealthThresholds thresholds;
    }

    public static class FailureDoc {
        public String errorCode;
        public String errorMessage;
        public String errorType;
        public String failedAt;
        public LocalDateTime timestamp;
    }

    public static RolloutDocument from(RolloutSnapshot s) {
        RolloutDocument doc = new RolloutDocument();
        doc.rolloutId = s.rolloutId().getValue();
        doc.subjectId = s.subjectId().getValue();
        doc.targetVersion = s.targetVersion();
        doc.previousVersion = s.previousVersion();
        doc.strategy = s.strategy();
        for (Target t : s.targets()) {
            TargetDoc td = new TargetDoc();
            td.id = t.id().getValue();
            td.bucketKey = t.bucketKey();
            td.environment = t.environment().name();
            doc.targets.add(td);
        }
        for (Stage stage : s.stages()) {
            StageDoc sd = new StageDoc();
            sd.index = stage.index();
            sd.name = stage.name();
            sd.kind = stage.kind().name();
            sd.percentage = stage.percentage();
            sd.targets = ids(stage.targets());
            sd.evaluationWindow = stage.evaluationWindow();
            sd.requiresHealthCheck = stage.requiresHealthCheck();
            sd.pauseAfter = stage.pauseAfter();
            sd.thresholds = stage.thresholds();
            doc.stages.add(sd);
        }
        doc.status = s.status().name();
        doc.currentStageIndex = s.currentStageIndex();
        doc.activeStageIndex = s.activeStageIndex();
        s.targetStatuses().forEach((id, status) -> doc.targetStatuses.put(id.getValue(), status.name()));
        doc.touchedTargets = ids(s.touchedTargets());
        doc.unrevertedTargets = ids(s.unrevertedTargets());
        doc.autoRollbackEnabled = s.autoRollbackEnabled();
        doc.halted = s.halted();
        doc.rollbackReason = s.rollbackReason();
        if (s.failureInfo() != null) {
            FailureInfo f = s.failureInfo();
            doc.failure = new FailureDoc();
            doc.failure.errorCode = f.getErrorCode();
            doc.failure.errorMessage = f.getErrorMessage();
            doc.failure.errorType = f.getErrorType().name();
            doc.failure.failedAt = f.getFailedAt();
            doc.failure.timestamp = f.getTimestamp();
        }
        doc.createdAt = s.createdAt();
        doc.startedAt = s.startedAt();
        doc.completedAt = s.completedAt();
        doc.rolledBackAt = s.rolledBackAt();
        return doc;
    }

    public RolloutSnapshot toSnapshot() {
        List<Target> targetList = targets.stream()
                .map(td -> Target.of(td.id, td.bucketKey, TargetEnvironment.valueOf(td.environment)))
                .toList();
        List<Stage> stageList = stages.stream()
                .map(sd -> new Stage(sd.index, sd.name, StageKind.valueOf(sd.kind), sd.percentage,
                        sd.targets.stream().map(TargetId::of).toList(), sd.evaluationWindow,
                        sd.requiresHealthCheck, sd.pauseAfter, sd.thresholds))
                .toList();
        Map<TargetId, TargetStatus> statuses = new LinkedHashMap<>();
        targetStatuses.forEach((id, status) -> statuses.put(TargetId.of(id), TargetStatus.valueOf(status)));
        FailureInfo failureInfo = failure == null ? null : FailureInfo.restore(failure.errorCode,
                failure.errorMessage, ErrorType.valueOf(failure.errorType), failure.failedAt, failure.timestamp);

        return new RolloutSnapshot(RolloutId.of(rolloutId), SubjectId.of(subjectId), targetVersion,
                previousVersion, strategy, targetList, stageList, RolloutStatus.valueOf(status),
                currentStageIndex, activeStageIndex, statuses, toIdSet(touchedTargets),
                toIdSet(unrevertedTargets), autoRollbackEnabled, halted, rollbackReason, failureInfo,
                createdAt, startedAt, completedAt, rolledBackAt);
    }

    private static List<String> ids(Iterable<TargetId> ids) {
        List<String> values = new ArrayList<>();
        ids.forEach(id -> values.add(id.getValue()));
        return values;
    }

    private static Set<TargetId> toIdSet(List<String> values) {
        Set<TargetId> set = new LinkedHashSet<>();
        if (values != null) {
            values.forEach(v -> set.add(TargetId.of(v)));
        }
        return set;
    }
}
