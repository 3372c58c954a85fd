package xyz.firestige.rollout.domain.rollout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.rollout.event.RolloutCompletedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRollbackFailedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRolledBackEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutRollingBackEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutStageCompletedEvent;
import xyz.firestige.rollout.domain.rollout.event.RolloutStartedEvent;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.FailureInfo;
import xyz.firestige.rollout.domain.shared.exception.IllegalStateTransitionException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.Stage;
import xyz.firestige.rollout.domain.stage.StagePlanner;
import xyz.firestige.rollout.domain.strategy.CanaryStrategy;
import xyz.firestige.rollout.domain.target.Target;
import xyz.firestige.rollout.domain.target.TargetStatus;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@DisplayName("Rollout 聚合单元测试")
class RolloutTest {

    private static final TargetId T1 = TargetId.of("t1");
    private static final TargetId T2 = TargetId.of("t2");

    private Rollout rollout;

    @BeforeEach
    void setUp() {
        List<Target> targets = List.of(Target.of("t1"), Target.of("t2"));
        CanaryStrategy canary = CanaryStrategy.of(50, 50, Duration.ZERO, HealthThresholds.defaults());
        List<Stage> stages = new StagePlanner().plan(canary, targets);
        RolloutSpec spec = RolloutSpec.of("operator-x", "v2", "v1", canary, targets);
        rollout = Rollout.plan(RolloutId.of("r-1"), spec, stages);
    }

    @Test
    @DisplayName("场景: 新建 Rollout 处于 PLANNING，所有目标 PENDING")
    void planCreatesPendingRollout() {
        RolloutSnapshot snapshot = rollout.toSnapshot();

        assertThat(snapshot.status()).isEqualTo(RolloutStatus.PLANNING);
        assertThat(snapshot.currentStageIndex()).isZero();
        assertThat(snapshot.targetStatuses()).containsValues(TargetStatus.PENDING).hasSize(2);
        assertThat(snapshot.touchedTargets()).isEmpty();
        assertThat(rollout.getDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("场景: 正向执行完成，事件按顺序收集")
    void happyPath() {
        rollout.start();
        runStage(0);
        runStage(1);
        rollout.complete();

        RolloutSnapshot snapshot = rollout.toSnapshot();
        assertThat(snapshot.status()).isEqualTo(RolloutStatus.COMPLETED);
        assertThat(snapshot.currentStageIndex()).isEqualTo(2);
        assertThat(snapshot.targetStatuses()).containsValues(TargetStatus.HEALTHY);
        assertThat(snapshot.completedAt()).isNotNull();

        List<RolloutEvent> events = rollout.drainDomainEvents();
        assertThat(events).extracting(e -> e.getClass().getSimpleName()).containsExactly(
                RolloutStartedEvent.class.getSimpleName(),
                RolloutStageCompletedEvent.class.getSimpleName(),
                RolloutStageCompletedEvent.class.getSimpleName(),
                RolloutCompletedEvent.class.getSimpleName());
        assertThat(rollout.drainDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("场景: Stage 必须按顺序执行")
    void stagesMustRunInOrder() {
        rollout.start();
        assertThatThrownBy(() -> rollout.beginStage(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> rollout.passStage(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("场景: 未通过全部 Stage 不能完成")
    void cannotCompleteEarly() {
        rollout.start();
        runStage(0);
        assertThatThrownBy(() -> rollout.complete()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("场景: 非法状态转换")
    void illegalTransitions() {
        assertThatThrownBy(() -> rollout.startRollback("x", null))
                .isInstanceOf(IllegalStateTransitionException.class);
        rollout.start();
        assertThatThrownBy(() -> rollout.start()).isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    @DisplayName("场景: 全部回滚成功后 currentStageIndex 为 -1")
    void rollbackSucceeds() {
        rollout.start();
        runStage(0);
        rollout.beginStage(1);
        rollout.markTouched(T2);
        rollout.markTargetFailed(T2);
        FailureInfo failure = FailureInfo.of(ErrorType.HEALTH_GATE_FAILURE, "gate", "canary-100%");
        rollout.startRollback("gate", failure);

        assertThat(rollout.getStatus()).isEqualTo(RolloutStatus.ROLLING_BACK);
        rollout.finishRollback(List.of(T1, T2), List.of());

        RolloutSnapshot snapshot = rollout.toSnapshot();
        assertThat(snapshot.status()).isEqualTo(RolloutStatus.ROLLED_BACK);
        assertThat(snapshot.currentStageIndex()).isEqualTo(-1);
        assertThat(snapshot.targetStatuses()).containsValues(TargetStatus.ROLLED_BACK);
        assertThat(snapshot.failureInfo().getErrorType()).isEqualTo(ErrorType.HEALTH_GATE_FAILURE);
        assertThat(rollout.drainDomainEvents())
                .anyMatch(e -> e instanceof RolloutRollingBackEvent)
                .anyMatch(e -> e instanceof RolloutRolledBackEvent);
    }

    @Test
    @DisplayName("场景: 有目标未能回滚时进入 FAILED 并记录")
    void rollbackFails() {
        rollout.start();
        runStage(0);
        rollout.startRollback("manual", null);
        rollout.finishRollback(List.of(), List.of(T1));

        RolloutSnapshot snapshot = rollout.toSnapshot();
        assertThat(snapshot.status()).isEqualTo(RolloutStatus.FAILED);
        assertThat(snapshot.unrevertedTargets()).containsExactly(T1);
        assertThat(snapshot.failureInfo().getErrorType()).isEqualTo(ErrorType.ROLLBACK_FAILURE);
        assertThat(rollout.drainDomainEvents()).anyMatch(e -> e instanceof RolloutRollbackFailedEvent);
    }

    @Test
    @DisplayName("场景: 终态后不能再变更")
    void terminalIsReadOnly() {
        rollout.start();
        runStage(0);
        runStage(1);
        rollout.complete();

        assertThatThrownBy(() -> rollout.startRollback("late", null))
                .isInstanceOf(IllegalStateTransitionException.class);
        assertThatThrownBy(() -> rollout.markTargetActive(T1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("场景: 挂起时保持 DEPLOYING")
    void haltKeepsDeploying() {
        rollout.start();
        rollout.halt("gate", FailureInfo.of(ErrorType.HEALTH_GATE_FAILURE, "gate"));

        RolloutSnapshot snapshot = rollout.toSnapshot();
        assertThat(snapshot.status()).isEqualTo(RolloutStatus.DEPLOYING);
        assertThat(snapshot.halted()).isTrue();
    }

    @Test
    @DisplayName("场景: 快照恢复后状态一致")
    void restoreFromSnapshot() {
        rollout.start();
        runStage(0);

        Rollout restored = Rollout.restore(rollout.toSnapshot());

        assertThat(restored.toSnapshot()).isEqualTo(rollout.toSnapshot());
        assertThat(restored.getDomainEvents()).isEmpty();
    }

    @Test
    @DisplayName("场景: 不属于 Rollout 的目标被拒绝")
    void rejectsForeignTarget() {
        rollout.start();
        assertThatThrownBy(() -> rollout.markTouched(TargetId.of("other")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void runStage(int index) {
        rollout.beginStage(index);
        for (TargetId id : rollout.getStages().get(index).targets()) {
            rollout.markTouched(id);
            rollout.markTargetActive(id);
        }
        rollout.passStage(index);
    }
}
