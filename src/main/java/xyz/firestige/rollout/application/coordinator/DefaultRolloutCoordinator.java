package xyz.firestige.rollout.application.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.execution.ExecutionServices;
import xyz.firestige.rollout.application.execution.RolloutExecution;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.stage.Stage;
import xyz.firestige.rollout.domain.stage.StagePlanner;
import xyz.firestige.rollout.domain.strategy.StrategyType;
import xyz.firestige.rollout.infrastructure.lock.LeaseOwner;
import xyz.firestige.rollout.infrastructure.lock.SubjectLease;
import xyz.firestige.rollout.infrastructure.lock.SubjectLockManager;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rollout 协调器默认实现
 * <p>
 * 职责：
 * 1. 校验入参并规划 Stage
 * 2. 通过主体租约保证单飞，并对照仓储中的活跃 Rollout 复核
 * 3. 为每个 Rollout 创建独立的执行流水线，并登记本实例正在运行的 Rollout
 * 4. 将取消/回滚请求路由到对应流水线
 * <p>
 * 锁持有者是 rolloutId + 本实例 ID。其他实例持有的 Rollout 只有在其租约过期后才能被接管。
 */
public class DefaultRolloutCoordinator implements RolloutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultRolloutCoordinator.class);

    public static final String RESTART_REASON = "Interrupted by coordinator restart";
    public static final String MANUAL_ROLLBACK_REASON = "Manual rollback";

    private final StagePlanner stagePlanner;
    private final SubjectLockManager lockManager;
    private final ExecutionServices services;
    private final Duration lockTtl;
    private final String instanceId;
    private final ConcurrentMap<RolloutId, RolloutExecution> running = new ConcurrentHashMap<>();
    // 本实例已认领（启动中、接管中或运行中）的 Rollout
    private final Set<RolloutId> claimed = ConcurrentHashMap.newKeySet();

    public DefaultRolloutCoordinator(StagePlanner stagePlanner, SubjectLockManager lockManager,
                                     ExecutionServices services, Duration lockTtl) {
        this(stagePlanner, lockManager, services, lockTtl, LeaseOwner.randomInstanceId());
    }

    public DefaultRolloutCoordinator(StagePlanner stagePlanner, SubjectLockManager lockManager,
                                     ExecutionServices services, Duration lockTtl, String instanceId) {
        this.stagePlanner = stagePlanner;
        this.lockManager = lockManager;
        this.services = services;
        this.lockTtl = lockTtl;
        this.instanceId = instanceId;
    }

    @Override
    public StartResult start(RolloutSpec spec) {
        FailureInfo invalid = validate(spec);
        if (invalid != null) {
            log.warn("Rollout 入参校验失败: {}", invalid.getErrorMessage());
            return StartResult.rejected(invalid);
        }
        List<Stage> stages;
        try {
            stages = stagePlanner.plan(spec.strategy(), spec.targets());
        } catch (IllegalArgumentException e) {
            log.warn("Rollout 规划失败: subject={}, reason={}", spec.subjectId().getValue(), e.getMessage());
            return StartResult.rejected(FailureInfo.of(ErrorType.VALIDATION_ERROR, e.getMessage()));
        }

        RolloutId rolloutId = RolloutId.generate();
        claimed.add(rolloutId);
        Optional<SubjectLease> lease = lockManager.acquire(spec.subjectId(), ownerOf(rolloutId), lockTtl);
        if (lease.isEmpty()) {
            claimed.remove(rolloutId);
            RolloutId holder = currentHolder(spec.subjectId());
            log.warn("主体已有进行中的 Rollout: subject={}, holder={}", spec.subjectId().getValue(), holder);
            return StartResult.alreadyInProgress(holder);
        }

        try {
            // 锁可能已随崩溃实例过期，仓储中仍有未结束的 Rollout 时同样视为占用
            Optional<RolloutSnapshot> persisted = services.repository().findActiveBySubject(spec.subjectId())
                    .filter(s -> !s.isTerminal());
            if (persisted.isPresent()) {
                RolloutId holder = persisted.get().rolloutId();
                log.warn("主体在仓储中仍有未结束的 Rollout，拒绝发起: subject={}, holder={}, status={}",
                        spec.subjectId().getValue(), holder.getValue(), persisted.get().status());
                lease.get().close();
                claimed.remove(rolloutId);
                return StartResult.alreadyInProgress(holder);
            }

            Rollout rollout = Rollout.plan(rolloutId, spec, stages);
            services.repository().save(rollout.toSnapshot());
            rollout.start();
            commit(rollout);
            RolloutExecution execution = register(rollout, lease.get());
            services.metrics().incrementCounter(MetricsRegistry.ROLLOUT_STARTED);
            log.info("Rollout 已受理: rolloutId={}, subject={}, strategy={}, stages={}, targets={}",
                    rolloutId.getValue(), spec.subjectId().getValue(), spec.strategy().type(), stages.size(),
                    spec.targets().size());
            return StartResult.accepted(rolloutId, execution.launch());
        } catch (RuntimeException e) {
            log.error("Rollout 启动失败: rolloutId={}", rolloutId.getValue(), e);
            deregister(rolloutId);
            lease.get().close();
            claimed.remove(rolloutId);
            return StartResult.rejected(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, null));
        }
    }

    @Override
    public RolloutOperationResult cancel(RolloutId rolloutId) {
        RolloutExecution execution = running.get(rolloutId);
        if (execution == null) {
            return notRunning(rolloutId, "取消");
        }
        if (!execution.requestCancel()) {
            return RolloutOperationResult.failure(rolloutId.getValue(), FailureInfo.of(ErrorType.VALIDATION_ERROR,
                    "Rollout 当前状态不可取消: " + execution.snapshot().status()));
        }
        return RolloutOperationResult.success(rolloutId.getValue(), execution.snapshot().status(), "已请求取消");
    }

    @Override
    public RolloutOperationResult rollback(RolloutId rolloutId, String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? MANUAL_ROLLBACK_REASON : reason;
        RolloutExecution execution = running.get(rolloutId);
        if (execution != null) {
            if (!execution.requestRollback(effectiveReason, null)) {
                return RolloutOperationResult.failure(rolloutId.getValue(), FailureInfo.of(
                        ErrorType.VALIDATION_ERROR, "Rollout 当前状态不可回滚: " + execution.snapshot().status()));
            }
            return RolloutOperationResult.success(rolloutId.getValue(), execution.snapshot().status(), "已请求回滚");
        }

        Optional<RolloutSnapshot> snapshot = services.repository().findById(rolloutId);
        if (snapshot.isEmpty() || snapshot.get().isTerminal()) {
            return notRunning(rolloutId, "回滚");
        }
        // 本实例未在执行（例如重启后尚未恢复）。其他实例仍持有租约时拒绝，租约已失效才接管回滚
        StartResult result = takeOver(snapshot.get(), effectiveReason, null);
        if (result.getOutcome() == StartResult.Outcome.ALREADY_IN_PROGRESS) {
            return RolloutOperationResult.failure(rolloutId.getValue(), FailureInfo.of(ErrorType.ALREADY_IN_PROGRESS,
                    "Rollout 正由其他协调器实例执行，需在持有租约的实例上回滚: " + rolloutId.getValue()));
        }
        if (!result.isAccepted()) {
            return RolloutOperationResult.failure(rolloutId.getValue(), result.getFailureInfo());
        }
        return RolloutOperationResult.success(rolloutId.getValue(), snapshot.get().status(), "已接管并开始回滚");
    }

    @Override
    public Optional<RolloutSnapshot> status(RolloutId rolloutId) {
        if (rolloutId == null) {
            return Optional.empty();
        }
        RolloutExecution execution = running.get(rolloutId);
        if (execution != null) {
            return Optional.of(execution.snapshot());
        }
        return services.repository().findById(rolloutId);
    }

    @Override
    public StartResult recover(RolloutSnapshot snapshot) {
        return takeOver(snapshot, RESTART_REASON, FailureInfo.of(ErrorType.SYSTEM_ERROR, RESTART_REASON));
    }

    /**
     * 续期本实例所有运行中 Rollout 的主体租约
     */
    public void renewLeases() {
        running.values().forEach(execution -> {
            if (!execution.renewLease()) {
                log.warn("主体租约续期失败: rolloutId={}", execution.getRolloutId().getValue());
            }
        });
    }

    public Set<RolloutId> getRunningRolloutIds() {
        return Set.copyOf(running.keySet());
    }

    public String getInstanceId() {
        return instanceId;
    }

    private StartResult takeOver(RolloutSnapshot snapshot, String reason, FailureInfo failureInfo) {
        if (snapshot.isTerminal()) {
            return StartResult.rejected(FailureInfo.of(ErrorType.VALIDATION_ERROR,
                    "终态 Rollout 无需恢复: " + snapshot.status()));
        }
        RolloutId rolloutId = snapshot.rolloutId();
        if (!claimed.add(rolloutId)) {
            return StartResult.alreadyInProgress(rolloutId);
        }
        Optional<SubjectLease> lease = lockManager.acquire(snapshot.subjectId(), ownerOf(rolloutId), lockTtl);
        if (lease.isEmpty()) {
            claimed.remove(rolloutId);
            Optional<LeaseOwner> holder = lockManager.holder(snapshot.subjectId());
            log.info("Rollout 的主体租约仍被持有，不接管: rolloutId={}, holder={}", rolloutId.getValue(),
                    holder.map(LeaseOwner::token).orElse(null));
            return StartResult.alreadyInProgress(holder.map(LeaseOwner::rolloutId).orElse(rolloutId));
        }

        try {
            Rollout rollout = Rollout.restore(snapshot);
            RolloutExecution execution = register(rollout, lease.get());
            log.warn("接管 Rollout 并回滚: rolloutId={}, status={}, reason={}", rolloutId.getValue(),
                    snapshot.status(), reason);
            if (snapshot.status() == RolloutStatus.PLANNING) {
                rollout.start();
                commit(rollout);
            }
            CompletableFuture<RolloutSnapshot> completion = snapshot.status() == RolloutStatus.ROLLING_BACK
                    ? execution.resumeRollback()
                    : execution.launchRollback(reason, failureInfo);
            return StartResult.accepted(rolloutId, completion);
        } catch (RuntimeException e) {
            log.error("Rollout 接管失败: rolloutId={}", rolloutId.getValue(), e);
            deregister(rolloutId);
            lease.get().close();
            claimed.remove(rolloutId);
            return StartResult.rejected(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, null));
        }
    }

    private FailureInfo validate(RolloutSpec spec) {
        if (spec == null) {
            return FailureInfo.of(ErrorType.VALIDATION_ERROR, "RolloutSpec 不能为空");
        }
        if (spec.subjectId() == null) {
            return FailureInfo.of(ErrorType.VALIDATION_ERROR, "subjectId 不能为空");
        }
        if (spec.targetVersion() == null || spec.targetVersion().isBlank()) {
            return FailureInfo.of(ErrorType.VALIDATION_ERROR, "targetVersion 不能为空");
        }
        if (spec.previousVersion() == null) {
            return FailureInfo.of(ErrorType.VALIDATION_ERROR, "previousVersion 不能为空（回滚需要）");
        }
        if (spec.strategy() == null) {
            return FailureInfo.of(ErrorType.VALIDATION_ERROR, "strategy 不能为空");
        }
        if (spec.strategy().type() == StrategyType.BLUE_GREEN && services.trafficSwitcher() == null) {
            return FailureInfo.of(ErrorType.VALIDATION_ERROR, "蓝绿发布需要配置 TrafficSwitcher");
        }
        return null;
    }

    private LeaseOwner ownerOf(RolloutId rolloutId) {
        return LeaseOwner.of(rolloutId, instanceId);
    }

    private RolloutId currentHolder(SubjectId subjectId) {
        return lockManager.holder(subjectId)
                .map(LeaseOwner::rolloutId)
                .orElseGet(() -> services.repository().findActiveBySubject(subjectId)
                        .map(RolloutSnapshot::rolloutId)
                        .orElse(null));
    }

    private RolloutOperationResult notRunning(RolloutId rolloutId, String action) {
        Optional<RolloutSnapshot> snapshot = services.repository().findById(rolloutId);
        String message = snapshot
                .map(s -> String.format("Rollout 已处于 %s，无法%s", s.status(), action))
                .orElse("Rollout 不存在: " + rolloutId.getValue());
        return RolloutOperationResult.failure(rolloutId.getValue(),
                FailureInfo.of(ErrorType.VALIDATION_ERROR, message));
    }

    private RolloutExecution register(Rollout rollout, SubjectLease lease) {
        RolloutExecution execution = new RolloutExecution(rollout, lease, services, this::onFinished);
        running.put(rollout.getRolloutId(), execution);
        services.metrics().setGauge(MetricsRegistry.ROLLOUT_ACTIVE, running.size());
        return execution;
    }

    private void onFinished(RolloutExecution execution) {
        running.remove(execution.getRolloutId(), execution);
        claimed.remove(execution.getRolloutId());
        services.metrics().setGauge(MetricsRegistry.ROLLOUT_ACTIVE, running.size());
    }

    private void deregister(RolloutId rolloutId) {
        running.remove(rolloutId);
        services.metrics().setGauge(MetricsRegistry.ROLLOUT_ACTIVE, running.size());
    }

    private void commit(Rollout rollout) {
        services.repository().save(rollout.toSnapshot());
        services.eventPublisher().publishAll(rollout.drainDomainEvents());
    }
}
