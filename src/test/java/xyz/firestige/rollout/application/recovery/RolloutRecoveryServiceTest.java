package xyz.firestige.rollout.application.recovery;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.application.coordinator.DefaultRolloutCoordinator;
import xyz.firestige.rollout.application.coordinator.StartResult;
import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.rollout.RolloutStatus;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.StagePlanner;
import xyz.firestige.rollout.infrastructure.lock.LeaseOwner;
import xyz.firestige.rollout.domain.strategy.CanaryStrategy;
import xyz.firestige.rollout.testutil.RolloutTestHarness;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 重启恢复测试：模拟上一个进程遗留在仓储中的 Rollout
 */
@Tag("integration")
@DisplayName("RolloutRecoveryService 测试")
class RolloutRecoveryServiceTest {

    private RolloutTestHarness harness;
    private RolloutRecoveryService recoveryService;
    private ScheduledExecutorService scanScheduler;

    @BeforeEach
    void setUp() {
        harness = new RolloutTestHarness();
        recoveryService = new RolloutRecoveryService(harness.repository, harness.coordinator);
        scanScheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scanScheduler.shutdownNow();
        harness.close();
    }

    private Rollout leftover(String rolloutId, String subject) {
        RolloutSpec spec = RolloutSpec.of(subject, "v2", "v1",
                CanaryStrategy.of(50, 50, Duration.ZERO, HealthThresholds.defaults()),
                RolloutTestHarness.targets(4));
        Rollout rollout = Rollout.plan(RolloutId.of(rolloutId), spec,
                new StagePlanner(Duration.ZERO).plan(spec.strategy(), spec.targets()));
        rollout.start();
        rollout.beginStage(0);
        for (TargetId id : rollout.getStages().get(0).targets()) {
            rollout.markTouched(id);
            rollout.markTargetActive(id);
        }
        return rollout;
    }

    @Test
    @DisplayName("场景: 部署中断的 Rollout 在重启后全部回滚")
    void deployingRolloutIsRolledBack() throws Exception {
        // Given: 上一个进程在第一个 Stage 部署完成后退出
        Rollout rollout = leftover("r-deploying", "operator-a");
        List<TargetId> touched = rollout.getStages().get(0).targets();
        harness.repository.save(rollout.toSnapshot());

        // When
        List<StartResult> results = recoveryService.recoverAll();

        // Then
        assertEquals(1, results.size());
        RolloutSnapshot result = results.get(0).getCompletion().get(10, TimeUnit.SECONDS);
        assertThat(result.status()).isEqualTo(RolloutStatus.ROLLED_BACK);
        assertThat(result.rollbackReason()).isEqualTo(DefaultRolloutCoordinator.RESTART_REASON);
        assertThat(harness.deployer.targetsDeployedWith("v1"))
                .containsExactlyInAnyOrderElementsOf(touched.stream().map(TargetId::getValue).toList());
        assertThat(harness.deployer.targetsDeployedWith("v2")).isEmpty();
        assertThat(harness.lockManager.holder(SubjectId.of("operator-a"))).isEmpty();
    }

    @Test
    @DisplayName("场景: 回滚中断的 Rollout 继续回滚并保留原回滚原因")
    void rollingBackRolloutResumes() throws Exception {
        // Given
        Rollout rollout = leftover("r-rolling-back", "operator-b");
        rollout.startRollback("operator requested", null);
        harness.repository.save(rollout.toSnapshot());

        // When
        List<StartResult> results = recoveryService.recoverAll();

        // Then
        assertEquals(1, results.size());
        RolloutSnapshot result = results.get(0).getCompletion().get(10, TimeUnit.SECONDS);
        assertThat(result.status()).isEqualTo(RolloutStatus.ROLLED_BACK);
        assertThat(result.rollbackReason()).isEqualTo("operator requested");
        assertThat(result.currentStageIndex()).isEqualTo(-1);
    }

    @Test
    @DisplayName("场景: 没有未结束的 Rollout 时不做任何事")
    void nothingToRecover() {
        assertTrue(recoveryService.recoverAll().isEmpty());
        assertThat(harness.deployer.getCalls()).isEmpty();
    }

    @Test
    @DisplayName("场景: 主体已被其他 Rollout 占用时跳过恢复")
    void skipsWhenSubjectHeldByAnother() {
        // Given
        Rollout rollout = leftover("r-blocked", "operator-c");
        harness.repository.save(rollout.toSnapshot());
        harness.lockManager.tryAcquire(SubjectId.of("operator-c"),
                LeaseOwner.of(RolloutId.of("r-other"), "node-other"), Duration.ofMinutes(1));

        // When
        List<StartResult> results = recoveryService.recoverAll();

        // Then
        assertThat(results).isEmpty();
        assertThat(harness.repository.findById(RolloutId.of("r-blocked"))).get()
                .extracting(RolloutSnapshot::status).isEqualTo(RolloutStatus.DEPLOYING);
    }

    @Test
    @DisplayName("场景: 同一 Rollout 的租约仍被其他实例持有时不接管")
    void skipsRolloutLeasedByAnotherInstance() {
        // Given: 另一个实例仍在执行 r-live 并持有未过期的租约
        Rollout rollout = leftover("r-live", "operator-d");
        harness.repository.save(rollout.toSnapshot());
        LeaseOwner liveOwner = LeaseOwner.of(RolloutId.of("r-live"), "node-other");
        assertTrue(harness.lockManager.tryAcquire(SubjectId.of("operator-d"), liveOwner, Duration.ofMinutes(1)));

        // When
        List<StartResult> results = recoveryService.recoverAll();

        // Then: 不回滚、不改写状态、租约仍归原实例
        assertThat(results).isEmpty();
        assertThat(harness.deployer.getCalls()).isEmpty();
        assertThat(harness.lockManager.holder(SubjectId.of("operator-d"))).contains(liveOwner);
        assertEquals(RolloutStatus.DEPLOYING,
                harness.repository.findById(RolloutId.of("r-live")).orElseThrow().status());
    }

    @Test
    @DisplayName("场景: 持有者崩溃后租约过期，周期扫描接管并回滚")
    void periodicScanRecoversAfterLeaseExpiry() {
        // Given: 崩溃实例留下一个 300ms 后过期的租约
        Rollout rollout = leftover("r-orphan", "operator-e");
        List<TargetId> touched = rollout.getStages().get(0).targets();
        harness.repository.save(rollout.toSnapshot());
        harness.lockManager.tryAcquire(SubjectId.of("operator-e"),
                LeaseOwner.of(RolloutId.of("r-orphan"), "node-crashed"), Duration.ofMillis(300));
        RolloutRecoveryService periodic = new RolloutRecoveryService(harness.repository, harness.coordinator,
                scanScheduler, Duration.ofMillis(100));

        // When: 启动时租约仍有效，只能跳过
        assertThat(periodic.recoverAll()).isEmpty();
        periodic.startPeriodicScan();

        // Then
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> harness.repository
                .findById(RolloutId.of("r-orphan")).map(RolloutSnapshot::status)
                .orElse(null) == RolloutStatus.ROLLED_BACK);
        assertThat(harness.deployer.targetsDeployedWith("v1"))
                .containsExactlyInAnyOrderElementsOf(touched.stream().map(TargetId::getValue).toList());
        periodic.stop();
    }

    @Test
    @DisplayName("场景: 未配置扫描间隔时不启动周期任务")
    void periodicScanDisabledWithoutInterval() {
        RolloutRecoveryService once = new RolloutRecoveryService(harness.repository, harness.coordinator,
                scanScheduler, Duration.ZERO);

        once.startPeriodicScan();
        once.stop();

        assertThat(harness.deployer.getCalls()).isEmpty();
    }
}
