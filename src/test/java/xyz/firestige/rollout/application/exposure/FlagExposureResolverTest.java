package xyz.firestige.rollout.application.exposure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.bucketing.TargetBucketing;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.stage.StagePlanner;
import xyz.firestige.rollout.domain.strategy.CanaryStrategy;
import xyz.firestige.rollout.domain.target.Target;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@DisplayName("FlagExposureResolver 单元测试")
class FlagExposureResolverTest {

    private final FlagExposureResolver resolver = new FlagExposureResolver();

    private Rollout newFlagRollout() {
        List<Target> targets = IntStream.rangeClosed(1, 10)
                .mapToObj(i -> Target.of("segment-" + i))
                .collect(Collectors.toList());
        CanaryStrategy canary = CanaryStrategy.of(10, 30, Duration.ZERO, null);
        RolloutSpec spec = RolloutSpec.of("flag:new-checkout", "true", "false", canary, targets);
        return Rollout.plan(RolloutId.of("flag-rollout"), spec, new StagePlanner().plan(canary, targets));
    }

    @Test
    @DisplayName("场景: 规划中所有上下文看到旧值")
    void planningServesPreviousValue() {
        Rollout rollout = newFlagRollout();
        assertThat(resolver.resolve(rollout.toSnapshot(), "user-1")).isEqualTo("false");
    }

    @Test
    @DisplayName("场景: 发布中按已放量百分比和桶号决定")
    void deployingUsesExposedPercentage() {
        Rollout rollout = newFlagRollout();
        rollout.start();
        rollout.beginStage(0);

        int exposed = rollout.toSnapshot().exposedPercentage();
        assertThat(exposed).isEqualTo(10);
        for (int i = 0; i < 200; i++) {
            String key = "user-" + i;
            String expected = TargetBucketing.bucket(key) < exposed ? "true" : "false";
            assertThat(resolver.resolve(rollout.toSnapshot(), key)).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("场景: 上下文本身是目标时按目标状态决定")
    void targetContextFollowsTargetStatus() {
        Rollout rollout = newFlagRollout();
        rollout.start();
        rollout.beginStage(0);
        TargetId first = rollout.getStages().get(0).targets().get(0);
        TargetId notYet = rollout.getStages().get(1).targets().get(0);

        assertThat(resolver.resolve(rollout.toSnapshot(), first.getValue())).isEqualTo("false");
        rollout.markTargetActive(first);
        assertThat(resolver.isExposed(rollout.toSnapshot(), first.getValue())).isTrue();
        assertThat(resolver.isExposed(rollout.toSnapshot(), notYet.getValue())).isFalse();
    }

    @Test
    @DisplayName("场景: 已完成看到新值，已回滚看到旧值")
    void terminalStates() {
        Rollout completed = newFlagRollout();
        completed.start();
        for (int i = 0; i < completed.getStages().size(); i++) {
            completed.beginStage(i);
            completed.passStage(i);
        }
        completed.complete();
        assertThat(resolver.resolve(completed.toSnapshot(), "anyone")).isEqualTo("true");

        Rollout rolledBack = newFlagRollout();
        rolledBack.start();
        rolledBack.startRollback("manual", null);
        rolledBack.finishRollback(List.of(), List.of());
        assertThat(resolver.resolve(rolledBack.toSnapshot(), "anyone")).isEqualTo("false");
    }

    @Test
    @DisplayName("场景: 回滚失败时未恢复的目标仍看到新值")
    void failedRollbackKeepsUnrevertedTargetsOnNewValue() {
        // Given: 两个目标已部署，回滚时只恢复了其中一个
        Rollout rollout = newFlagRollout();
        rollout.start();
        rollout.beginStage(0);
        TargetId reverted = rollout.getStages().get(0).targets().get(0);
        TargetId stuck = rollout.getStages().get(1).targets().get(0);
        rollout.markTouched(reverted);
        rollout.markTargetActive(reverted);
        rollout.markTouched(stuck);
        rollout.markTargetActive(stuck);
        rollout.startRollback("health gate", null);

        // When
        rollout.finishRollback(List.of(reverted), List.of(stuck));

        // Then
        assertThat(resolver.resolve(rollout.toSnapshot(), stuck.getValue())).isEqualTo("true");
        assertThat(resolver.resolve(rollout.toSnapshot(), reverted.getValue())).isEqualTo("false");
        assertThat(resolver.resolve(rollout.toSnapshot(), "user-1")).isEqualTo("false");
    }

    @Test
    @DisplayName("场景: 空上下文键被拒绝")
    void rejectsBlankContext() {
        assertThatThrownBy(() -> resolver.resolve(newFlagRollout().toSnapshot(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
