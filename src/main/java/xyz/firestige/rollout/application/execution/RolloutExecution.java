package xyz.firestige.rollout.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.health.HealthGate;
import xyz.firestige.rollout.domain.health.HealthVerdict;
import xyz.firestige.rollout.domain.port.TrafficSlot;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.Stage;
import xyz.firestige.rollout.domain.stage.StageKind;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.domain.target.TargetStatus;
import xyz.firestige.rollout.infrastructure.lock.SubjectLease;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 单个 Rollout 的异步执行流水线
 * <p>
 * 流程：逐个 Stage 派发目标 → 可取消的观察窗口 → 健康快照 → 健康门禁 → 推进或回滚。
 * 每次状态转换后先持久化快照，再发布聚合收集的领域事件。
 * <p>
 * 取消检查点：每个目标派发前、Stage 派发结束后、每次等待结束后。
 * 主体租约在所有退出路径上恰好释放一次。
 * <p>
 * 流水线步骤（含持久化）都在定时器的流水线执行器上运行，外部调用线程只负责调用本身。
 */
public class RolloutExecution {

    private static final Logger log = LoggerFactory.getLogger(RolloutExecution.class);

    public static final String CANCELLED_REASON = "Cancelled";

    private final Rollout rollout;
    private final SubjectLease lease;
    private final ExecutionServices services;
    private final Consumer<RolloutExecution> onFinish;
    private final RolloutCancellation cancellation = new RolloutCancellation();
    private final TargetCallSequencer sequencer;
    private final CompletableFuture<RolloutSnapshot> completion = new CompletableFuture<>();
    private final AtomicBoolean launched = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);

    public RolloutExecution(Rollout rollout, SubjectLease lease, ExecutionServices services,
                            Consumer<RolloutExecution> onFinish) {
        this.rollout = rollout;
        this.lease = lease;
        this.services = services;
        this.onFinish = onFinish;
        this.sequencer = new TargetCallSequencer(services.timer());
    }

    // ============================================
    // 入口
    // ============================================

    /**
     * 从当前 Stage 开始正向执行（Rollout 必须已处于 DEPLOYING）
     */
    public CompletableFuture<RolloutSnapshot> launch() {
        return drive(() -> runStage(rollout.getCurrentStageIndex()));
    }

    /**
     * 直接进入回滚（重启恢复 DEPLOYING 状态的 Rollout）
     */
    public CompletableFuture<RolloutSnapshot> launchRollback(String reason, FailureInfo failureInfo) {
        return drive(() -> rollback(reason, failureInfo));
    }

    /**
     * 继续未完成的回滚（重启恢复 ROLLING_BACK 状态的 Rollout）
     */
    public CompletableFuture<RolloutSnapshot> resumeRollback() {
        return drive(this::revertTouched);
    }

    /**
     * 请求回滚（取消或人工回滚），在下一个检查点生效
     *
     * @return false=Rollout 已不在发布阶段或已有请求
     */
    public boolean requestRollback(String reason, FailureInfo failureInfo) {
        if (rollout.getStatus() != RolloutStatus.DEPLOYING) {
            return false;
        }
        boolean accepted = cancellation.request(reason, failureInfo);
        if (accepted) {
            try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
                log.info("收到回滚请求: {}", reason);
            }
        }
        return accepted;
    }

    public boolean requestCancel() {
        return requestRollback(CANCELLED_REASON, FailureInfo.of(ErrorType.CANCELLED, CANCELLED_REASON));
    }

    public RolloutId getRolloutId() {
        return rollout.getRolloutId();
    }

    public RolloutSnapshot snapshot() {
        return rollout.toSnapshot();
    }

    public CompletableFuture<RolloutSnapshot> completion() {
        return completion;
    }

    public boolean isFinished() {
        return finished.get();
    }

    /**
     * 续期主体租约
     */
    public boolean renewLease() {
        return !finished.get() && lease.renew();
    }

    private CompletableFuture<RolloutSnapshot> drive(Supplier<CompletableFuture<Void>> entry) {
        if (!launched.compareAndSet(false, true)) {
            throw new IllegalStateException("执行流水线只能启动一次: " + rollout.getRolloutId().getValue());
        }
        CompletableFuture.supplyAsync(entry, services.timer().executor())
                .thenCompose(Function.identity())
                .handle((v, ex) -> ex == null ? CompletableFuture.<Void>completedFuture(null) : recoverFrom(unwrap(ex)))
                .thenCompose(Function.identity())
                .whenComplete((v, ex) -> {
                    if (ex != null) {
                        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
                            log.error("Rollout 异常处理失败", unwrap(ex));
                        }
                    }
                    finish();
                });
        return completion;
    }

    // ============================================
    // 正向执行
    // ============================================

    private CompletableFuture<Void> runStage(int index) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            List<Stage> stages = rollout.getStages();
            if (index >= stages.size()) {
                return completeRollout();
            }
            if (cancellation.isRequested()) {
                return rollbackOnRequest();
            }
            Stage stage = stages.get(index);
            rollout.beginStage(index);
            commit();

            List<Target> dispatchTargets = stage.targets().stream()
                    .map(rollout::getTarget)
                    .filter(t -> stage.kind() == StageKind.SWITCH || !rollout.getTargetStatus(t.id()).isDeployed())
                    .toList();
            log.info("开始 Stage {}/{}: {}，派发 {} 个目标", index + 1, stages.size(), stage.name(),
                    dispatchTargets.size());

            TargetDispatcher.DispatchOptions options = new TargetDispatcher.DispatchOptions(
                    stage.kind() == StageKind.SWITCH ? "流量切换" : "部署",
                    rollout.getStrategy().effectiveConcurrency(dispatchTargets.size()),
                    stage.kind() == StageKind.SWITCH ? 1 : 1 + services.deployRetryAttempts(),
                    services.deployTimeout(),
                    rollout.getStrategy().abortOnAnyTargetFailure(),
                    cancellation::isRequested);
            return services.dispatcher()
                    .dispatch(dispatchTargets, actionFor(stage), options, new ForwardListener(), sequencer)
                    .thenComposeAsync(report -> afterDispatch(stage, report), services.timer().executor());
        }
    }

    private TargetDispatcher.TargetAction actionFor(Stage stage) {
        if (stage.kind() == StageKind.SWITCH) {
            return target -> services.trafficSwitcher().route(target, TrafficSlot.GREEN);
        }
        String version = rollout.getTargetVersion();
        return target -> services.deployer().apply(target, version);
    }

    private CompletableFuture<Void> afterDispatch(Stage stage, StageDeployReport report) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            commit();
            if (cancellation.isRequested()) {
                return rollbackOnRequest();
            }
            String abortReason = abortReason(stage, report);
            if (abortReason != null) {
                log.warn("Stage {} 部署中止: {}", stage.name(), abortReason);
                return fail(FailureInfo.of(ErrorType.TARGET_DEPLOY_ERROR, abortReason, stage.name()), abortReason);
            }
            if (!stage.requiresHealthCheck()) {
                return passStage(stage);
            }
            log.info("Stage {} 部署完成，观察 {} 后评估健康", stage.name(), stage.evaluationWindow());
            return services.timer().delay(stage.evaluationWindow(), cancellation)
                    .thenCompose(elapsed -> elapsed ? evaluateHealth(stage) : rollbackOnRequest());
        }
    }

    private String abortReason(Stage stage, StageDeployReport report) {
        if (!report.hasFailures()) {
            return null;
        }
        if (rollout.getStrategy().abortOnAnyTargetFailure()) {
            return "目标部署失败: " + ids(report.failed().keySet());
        }
        double ratio = report.successRatio();
        if (ratio < stage.thresholds().successRateMin()) {
            return String.format("部署成功率 %.2f 低于阈值 %.2f，失败目标: %s", ratio,
                    stage.thresholds().successRateMin(), ids(report.failed().keySet()));
        }
        log.warn("Stage {} 有 {} 个目标失败，成功率 {} 仍满足阈值，继续执行", stage.name(),
                report.failed().size(), String.format("%.2f", ratio));
        return null;
    }

    private CompletableFuture<Void> evaluateHealth(Stage stage) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            if (cancellation.isRequested()) {
                return rollbackOnRequest();
            }
            List<Target> active = rollout.getDeployedTargets();
            return services.callExecutor()
                    .call("健康评估[" + stage.name() + "]", () -> services.healthEvaluator().snapshot(active),
                            services.healthEvaluationTimeout())
                    .handle((snapshot, ex) -> ex != null
                            ? HealthVerdict.fail("健康评估失败: " + TargetDispatcher.describe(ex))
                            : HealthGate.evaluate(snapshot, stage.thresholds()))
                    .thenComposeAsync(verdict -> onVerdict(stage, verdict), services.timer().executor());
        }
    }

    private CompletableFuture<Void> onVerdict(Stage stage, HealthVerdict verdict) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            if (cancellation.isRequested()) {
                return rollbackOnRequest();
            }
            if (verdict.passed()) {
                return passStage(stage);
            }
            services.metrics().incrementCounter(MetricsRegistry.HEALTH_GATE_FAILED);
            log.warn("Stage {} 健康门禁未通过: {}", stage.name(), verdict.reason());
            return fail(FailureInfo.of(ErrorType.HEALTH_GATE_FAILURE, verdict.reason(), stage.name()),
                    verdict.reason());
        }
    }

    private CompletableFuture<Void> passStage(Stage stage) {
        rollout.passStage(stage.index());
        commit();
        log.info("Stage {} 通过 ({}/{})", stage.name(), stage.index() + 1, rollout.getStages().size());
        int next = stage.index() + 1;
        if (stage.hasPause() && next < rollout.getStages().size()) {
            log.info("Stage 间暂停 {}", stage.pauseAfter());
            return services.timer().delay(stage.pauseAfter(), cancellation)
                    .thenCompose(elapsed -> elapsed ? runStage(next) : rollbackOnRequest());
        }
        return runStage(next);
    }

    private CompletableFuture<Void> completeRollout() {
        rollout.complete();
        commit();
        services.metrics().incrementCounter(MetricsRegistry.ROLLOUT_COMPLETED);
        List<TargetId> failed = rollout.toSnapshot().targetsIn(TargetStatus.FAILED);
        if (failed.isEmpty()) {
            log.info("Rollout 完成，目标版本 {}", rollout.getTargetVersion());
        } else {
            log.warn("Rollout 完成，目标版本 {}，容忍失败的目标: {}", rollout.getTargetVersion(), ids(failed));
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 失败处理：自动回滚开启时直接回滚；否则挂起，等待人工回滚或取消
     */
    private CompletableFuture<Void> fail(FailureInfo failureInfo, String reason) {
        if (rollout.isAutoRollbackEnabled()) {
            return rollback(reason, failureInfo);
        }
        rollout.halt(reason, failureInfo);
        commit();
        log.warn("自动回滚已关闭，Rollout 挂起等待人工处理: {}", reason);
        return cancellation.signal()
                .thenComposeAsync(request -> rollback(request.reason(), request.failureInfo()),
                        services.timer().executor());
    }

    // ============================================
    // 回滚
    // ============================================

    private CompletableFuture<Void> rollbackOnRequest() {
        RolloutCancellation.Request request = cancellation.getRequest();
        return rollback(request.reason(), request.failureInfo());
    }

    private CompletableFuture<Void> rollback(String reason, FailureInfo failureInfo) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            rollout.startRollback(reason, failureInfo);
            commit();
            log.warn("开始回滚，原因: {}", reason);
            return revertTouched();
        }
    }

    private CompletableFuture<Void> revertTouched() {
        List<Target> touched = rollout.getTouchedTargets().stream()
                .filter(t -> rollout.getTargetStatus(t.id()) != TargetStatus.ROLLED_BACK)
                .toList();
        return services.rollbackController().revert(rollout, touched, sequencer)
                .thenAcceptAsync(this::onReverted, services.timer().executor());
    }

    private void onReverted(RevertReport report) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            rollout.finishRollback(report.reverted(), report.unreverted().keySet());
            commit();
            if (rollout.getStatus() == RolloutStatus.ROLLED_BACK) {
                services.metrics().incrementCounter(MetricsRegistry.ROLLOUT_ROLLED_BACK);
                log.info("回滚完成，{} 个目标恢复到 {}", report.reverted().size(), rollout.getPreviousVersion());
            } else {
                services.metrics().incrementCounter(MetricsRegistry.ROLLOUT_ROLLBACK_FAILED);
                log.error("回滚失败，需要人工介入，未恢复目标: {}", report.unreverted());
            }
        }
    }

    // ============================================
    // 异常与收尾
    // ============================================

    private CompletableFuture<Void> recoverFrom(Throwable ex) {
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            log.error("Rollout 执行异常，状态: {}", rollout.getStatus(), ex);
            RolloutStatus status = rollout.getStatus();
            if (status == RolloutStatus.DEPLOYING) {
                FailureInfo failureInfo = FailureInfo.fromException(ex, ErrorType.SYSTEM_ERROR, currentStageName());
                try {
                    return rollback("系统异常: " + failureInfo.getErrorMessage(), failureInfo)
                            .exceptionally(e -> {
                                forceFail(unwrap(e));
                                return null;
                            });
                } catch (RuntimeException e) {
                    forceFail(e);
                    return CompletableFuture.completedFuture(null);
                }
            }
            if (status == RolloutStatus.ROLLING_BACK) {
                forceFail(ex);
            }
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * 回滚过程本身异常：未恢复的目标全部记为未回滚，Rollout 进入 FAILED
     */
    private void forceFail(Throwable ex) {
        log.error("回滚过程异常，Rollout 标记为失败", ex);
        if (rollout.getStatus() != RolloutStatus.ROLLING_BACK) {
            return;
        }
        List<TargetId> unreverted = rollout.getTouchedTargets().stream()
                .map(Target::id)
                .filter(id -> rollout.getTargetStatus(id) != TargetStatus.ROLLED_BACK)
                .toList();
        rollout.finishRollback(List.of(), unreverted);
        services.metrics().incrementCounter(unreverted.isEmpty()
                ? MetricsRegistry.ROLLOUT_ROLLED_BACK
                : MetricsRegistry.ROLLOUT_ROLLBACK_FAILED);
        try {
            commit();
        } catch (RuntimeException e) {
            log.error("回滚失败状态持久化失败", e);
        }
    }

    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try (RolloutMdc ignored = RolloutMdc.of(rollout)) {
            lease.close();
            onFinish.accept(this);
            RolloutSnapshot snapshot = rollout.toSnapshot();
            log.info("Rollout 结束，状态: {}", snapshot.status());
            completion.complete(snapshot);
        } catch (RuntimeException e) {
            log.error("Rollout 收尾失败", e);
            completion.complete(rollout.toSnapshot());
        }
    }

    /**
     * 持久化快照并发布事件
     */
    private void commit() {
        services.repository().save(rollout.toSnapshot());
        services.eventPublisher().publishAll(rollout.drainDomainEvents());
    }

    private String currentStageName() {
        int index = rollout.toSnapshot().activeStageIndex();
        return index >= 0 && index < rollout.getStages().size() ? rollout.getStages().get(index).name() : null;
    }

    private static String ids(Collection<TargetId> ids) {
        return ids.stream().map(TargetId::getValue).collect(Collectors.joining(","));
    }

    private static Throwable unwrap(Throwable ex) {
        if ((ex instanceof CompletionException || ex instanceof ExecutionException) && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }

    /**
     * 正向派发时回写目标状态
     */
    private class ForwardListener implements TargetDispatcher.DispatchListener {

        @Override
        public void beforeDispatch(Target target) {
            rollout.markTouched(target.id());
        }

        @Override
        public void onSuccess(Target target) {
            rollout.markTargetActive(target.id());
        }

        @Override
        public void onFailure(Target target, String reason) {
            rollout.markTargetFailed(target.id());
            services.metrics().incrementCounter(MetricsRegistry.TARGET_DEPLOY_FAILED);
        }
    }
}
