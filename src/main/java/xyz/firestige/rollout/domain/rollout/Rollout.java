package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.rollout.event.RolloutCompletedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutHaltedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRollbackFailedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRolledBackEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRollingBackEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutStageCompletedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutStartedEvent;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.exception.IllegalStateTransitionException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.Stage;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.domain.target.TargetStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rollout 聚合根
 * <p>
 * 职责：
 * 1. 管理发布生命周期和状态转换
 * 2. 保护业务不变式（终态只读、currentStageIndex 单调递增）
 * 3. 记录每个目标的状态和已触达目标集合，作为回滚依据
 * 4. 收集领域事件，由协调器在持久化后发布
 * <p>
 * 同一主体的单飞约束由协调器通过主体租约保证，不在聚合内部。
 * 同一 Stage 内的目标并发回写状态，因此所有可变方法都是同步的。
 */
public class Rollout {

    private final RolloutId rolloutId;
    private final SubjectId subjectId;
    private final String targetVersion;
    private final String previousVersion;
    private final RolloutStrategy strategy;
    private final List<Target> targets;
    private final Map<TargetId, Target> targetsById;
    private final List<Stage> stages;
    private final boolean autoRollbackEnabled;

    private RolloutStatus status;
    private int currentStageIndex;
    private int activeStageIndex;
    private final Map<TargetId, TargetStatus> targetStatuses;
    private final Set<TargetId> touchedTargets;
    private final Set<TargetId> unrevertedTargets;
    private boolean halted;
    private String rollbackReason;
    private FailureInfo failureInfo;

    private final LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime rolledBackAt;

    private final List<RolloutEvent> domainEvents = new ArrayList<>();

    private Rollout(RolloutSnapshot s) {
        this.rolloutId = Objects.requireNonNull(s.rolloutId(), "rolloutId");
        this.subjectId = Objects.requireNonNull(s.subjectId(), "subjectId");
        this.targetVersion = s.targetVersion();
        this.previousVersion = s.previousVersion();
        this.strategy = Objects.requireNonNull(s.strategy(), "strategy");
        this.targets = List.copyOf(s.targets());
        this.targetsById = new LinkedHashMap<>();
        this.targets.forEach(t -> targetsById.put(t.id(), t));
        this.stages = List.copyOf(s.stages());
        this.autoRollbackEnabled = s.autoRollbackEnabled();
        this.status = s.status();
        this.currentStageIndex = s.currentStageIndex();
        this.activeStageIndex = s.activeStageIndex();
        this.targetStatuses = new LinkedHashMap<>(s.targetStatuses());
        this.touchedTargets = new LinkedHashSet<>(s.touchedTargets());
        this.unrevertedTargets = new LinkedHashSet<>(s.unrevertedTargets());
        this.halted = s.halted();
        this.rollbackReason = s.rollbackReason();
        this.failureInfo = s.failureInfo();
        this.createdAt = s.createdAt();
        this.startedAt = s.startedAt();
        this.completedAt = s.completedAt();
        this.rolledBackAt = s.rolledBackAt();
    }

    /**
     * 创建处于 PLANNING 状态的 Rollout，所有目标为 PENDING
     */
    public static Rollout plan(RolloutId rolloutId, RolloutSpec spec, List<Stage> stages) {
        Map<TargetId, TargetStatus> statuses = new LinkedHashMap<>();
        spec.targets().forEach(t -> statuses.put(t.id(), TargetStatus.PENDING));
        return new Rollout(new RolloutSnapshot(rolloutId, spec.subjectId(), spec.targetVersion(),
                spec.previousVersion(), spec.strategy(), spec.targets(), stages, RolloutStatus.PLANNING,
                0, -1, statuses, Set.of(), Set.of(), spec.autoRollbackEnabled(), false,
                null, null, LocalDateTime.now(), null, null, null));
    }

    /**
     * 从快照恢复（重启恢复、人工操作）
     */
    public static Rollout restore(RolloutSnapshot snapshot) {
        return new Rollout(snapshot);
    }

    // ============================================
    // 事件管理
    // ============================================

    public synchronized List<RolloutEvent> getDomainEvents() {
        return List.copyOf(domainEvents);
    }

    public synchronized void clearDomainEvents() {
        domainEvents.clear();
    }

    /**
     * 取出并清空已收集的事件
     */
    public synchronized List<RolloutEvent> drainDomainEvents() {
        List<RolloutEvent> drained = List.copyOf(domainEvents);
        domainEvents.clear();
        return drained;
    }

    private void addDomainEvent(RolloutEvent event) {
        domainEvents.add(event);
    }

    // ============================================
    // 业务行为
    // ============================================

    /**
     * 开始执行
     * 不变式：只有 PLANNING 可以开始
     */
    public synchronized void start() {
        transitionTo(RolloutStatus.DEPLOYING);
        this.startedAt = LocalDateTime.now();
        addDomainEvent(new RolloutStartedEvent(rolloutId, subjectId, strategy.type(), stages.size(),
                targetVersion));
    }

    /**
     * 进入某个 Stage
     * 不变式：只能按顺序进入下一个未通过的 Stage
     */
    public synchronized void beginStage(int index) {
        requireStatus(RolloutStatus.DEPLOYING, "进入 Stage");
        if (index != currentStageIndex) {
            throw new IllegalStateException(String.format(
                    "Stage 必须按顺序执行，期望: %d, 实际: %d, rolloutId: %s",
                    currentStageIndex, index, rolloutId.getValue()));
        }
        this.activeStageIndex = index;
    }

    /**
     * 记录目标已被触达（调用 apply/route 之前），回滚范围以此为准
     */
    public synchronized void markTouched(TargetId targetId) {
        requireStatus(RolloutStatus.DEPLOYING, "触达目标");
        requireTarget(targetId);
        touchedTargets.add(targetId);
    }

    public synchronized void markTargetActive(TargetId targetId) {
        requireStatus(RolloutStatus.DEPLOYING, "标记目标已部署");
        requireTarget(targetId);
        if (targetStatuses.get(targetId) != TargetStatus.HEALTHY) {
            targetStatuses.put(targetId, TargetStatus.ACTIVE);
        }
        touchedTargets.add(targetId);
    }

    public synchronized void markTargetFailed(TargetId targetId) {
        requireStatus(RolloutStatus.DEPLOYING, "标记目标失败");
        requireTarget(targetId);
        targetStatuses.put(targetId, TargetStatus.FAILED);
        touchedTargets.add(targetId);
    }

    /**
     * Stage 通过健康门禁
     * 不变式：只能通过当前 Stage，currentStageIndex 单调递增
     */
    public synchronized void passStage(int index) {
        requireStatus(RolloutStatus.DEPLOYING, "通过 Stage");
        if (index != currentStageIndex) {
            throw new IllegalStateException(String.format(
                    "只能通过当前 Stage，当前: %d, 请求: %d, rolloutId: %s",
                    currentStageIndex, index, rolloutId.getValue()));
        }
        Stage stage = stages.get(index);
        for (TargetId id : stage.targets()) {
            if (targetStatuses.get(id) == TargetStatus.ACTIVE) {
                targetStatuses.put(id, TargetStatus.HEALTHY);
            }
        }
        this.currentStageIndex = index + 1;
        addDomainEvent(new RolloutStageCompletedEvent(rolloutId, subjectId, index, stage.name(), stages.size()));
    }

    /**
     * 完成发布
     * 不变式：所有 Stage 都已通过
     */
    public synchronized void complete() {
        if (currentStageIndex != stages.size()) {
            throw new IllegalStateException(String.format(
                    "仍有未通过的 Stage，已通过: %d/%d, rolloutId: %s",
                    currentStageIndex, stages.size(), rolloutId.getValue()));
        }
        transitionTo(RolloutStatus.COMPLETED);
        this.halted = false;
        this.completedAt = LocalDateTime.now();
        Duration duration = startedAt != null ? Duration.between(startedAt, completedAt) : Duration.ZERO;
        addDomainEvent(new RolloutCompletedEvent(rolloutId, subjectId, duration));
    }

    /**
     * 自动回滚关闭时挂起：状态保持 DEPLOYING，等待人工回滚或取消
     */
    public synchronized void halt(String reason, FailureInfo failureInfo) {
        requireStatus(RolloutStatus.DEPLOYING, "挂起");
        this.halted = true;
        this.rollbackReason = reason;
        this.failureInfo = failureInfo;
        addDomainEvent(new RolloutHaltedEvent(rolloutId, subjectId, reason, failureInfo));
    }

    /**
     * 开始回滚
     * 不变式：只有 DEPLOYING 可以开始回滚
     */
    public synchronized void startRollback(String reason, FailureInfo failureInfo) {
        transitionTo(RolloutStatus.ROLLING_BACK);
        this.halted = false;
        this.rollbackReason = reason;
        if (failureInfo != null) {
            this.failureInfo = failureInfo;
        }
        addDomainEvent(new RolloutRollingBackEvent(rolloutId, subjectId, reason, touchedTargets.size(),
                this.failureInfo));
    }

    /**
     * 结束回滚
     * 全部恢复 → ROLLED_BACK，currentStageIndex 置为 -1；否则 → FAILED 并记录未恢复目标
     */
    public synchronized void finishRollback(Collection<TargetId> reverted, Collection<TargetId> unreverted) {
        requireStatus(RolloutStatus.ROLLING_BACK, "结束回滚");
        for (TargetId id : reverted) {
            requireTarget(id);
            targetStatuses.put(id, TargetStatus.ROLLED_BACK);
        }
        this.rolledBackAt = LocalDateTime.now();
        if (unreverted.isEmpty()) {
            transitionTo(RolloutStatus.ROLLED_BACK);
            this.currentStageIndex = -1;
            addDomainEvent(new RolloutRolledBackEvent(rolloutId, subjectId, rollbackReason, List.copyOf(reverted)));
        } else {
            transitionTo(RolloutStatus.FAILED);
            this.unrevertedTargets.addAll(unreverted);
            this.failureInfo = FailureInfo.of(ErrorType.ROLLBACK_FAILURE,
                    String.format("%d 个目标回滚失败，原因: %s", unreverted.size(), rollbackReason),
                    unreverted.iterator().next().getValue());
            addDomainEvent(new RolloutRollbackFailedEvent(rolloutId, subjectId, List.copyOf(unreverted),
                    failureInfo));
        }
    }

    public synchronized RolloutSnapshot toSnapshot() {
        return new RolloutSnapshot(rolloutId, subjectId, targetVersion, previousVersion, strategy, targets, stages,
                status, currentStageIndex, activeStageIndex, targetStatuses, touchedTargets, unrevertedTargets,
                autoRollbackEnabled, halted, rollbackReason, failureInfo, createdAt, startedAt, completedAt,
                rolledBackAt);
    }

    private void transitionTo(RolloutStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(rolloutId.getValue(), status, next);
        }
        this.status = next;
    }

    private void requireStatus(RolloutStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(String.format(
                    "只有 %s 状态可以%s，当前状态: %s, rolloutId: %s",
                    expected, action, status, rolloutId.getValue()));
        }
    }

    private void requireTarget(TargetId targetId) {
        if (!targetsById.containsKey(targetId)) {
            throw new IllegalArgumentException(String.format(
                    "目标不属于该 Rollout: %s, rolloutId: %s", targetId.getValue(), rolloutId.getValue()));
        }
    }

    // ============================================
    // 查询
    // ============================================

    public RolloutId getRolloutId() {
        return rolloutId;
    }

    public SubjectId getSubjectId() {
        return subjectId;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public String getPreviousVersion() {
        return previousVersion;
    }

    public RolloutStrategy getStrategy() {
        return strategy;
    }

    public List<Target> getTargets() {
        return targets;
    }

    public Target getTarget(TargetId targetId) {
        requireTarget(targetId);
        return targetsById.get(targetId);
    }

    public List<Stage> getStages() {
        return stages;
    }

    public boolean isAutoRollbackEnabled() {
        return autoRollbackEnabled;
    }

    public synchronized RolloutStatus getStatus() {
        return status;
    }

    public synchronized int getCurrentStageIndex() {
        return currentStageIndex;
    }

    public synchronized boolean isHalted() {
        return halted;
    }

    public synchronized String getRollbackReason() {
        return rollbackReason;
    }

    public synchronized FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public synchronized TargetStatus getTargetStatus(TargetId targetId) {
        return targetStatuses.get(targetId);
    }

    /**
     * 已触达目标（按触达顺序）
     */
    public synchronized List<Target> getTouchedTargets() {
        return touchedTargets.stream().map(targetsById::get).toList();
    }

    /**
     * 当前运行新版本的目标
     */
    public synchronized List<Target> getDeployedTargets() {
        List<Target> deployed = new ArrayList<>();
        targetStatuses.forEach((id, s) -> {
            if (s.isDeployed()) {
                deployed.add(targetsById.get(id));
            }
        });
        return Collections.unmodifiableList(deployed);
    }
}
