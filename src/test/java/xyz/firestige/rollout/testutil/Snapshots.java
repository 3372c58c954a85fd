package xyz.firestige.rollout.testutil;

import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.stage.StagePlanner;
import xyz.firestige.rollout.domain.strategy.CanaryStrategy;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;

import java.time.Duration;
import java.util.List;

/**
 * 构造各状态的快照
 */
public final class Snapshots {

    private Snapshots() {
    }

    public static Rollout planned(String rolloutId, String subject, RolloutStrategy strategy, int targets) {
        RolloutSpec spec = RolloutSpec.of(subject, "v2", "v1", strategy, RolloutTestHarness.targets(targets));
        return Rollout.plan(RolloutId.of(rolloutId), spec,
                new StagePlanner(Duration.ZERO).plan(spec.strategy(), spec.targets()));
    }

    public static Rollout deploying(String rolloutId, String subject) {
        Rollout rollout = planned(rolloutId, subject,
                CanaryStrategy.of(50, 50, Duration.ofMinutes(1), HealthThresholds.defaults()), 4);
        rollout.start();
        rollout.beginStage(0);
        rollout.getStages().get(0).targets().forEach(id -> {
            rollout.markTouched(id);
            rollout.markTargetActive(id);
        });
        return rollout;
    }

    public static RolloutSnapshot rolledBack(String rolloutId, String subject) {
        Rollout rollout = deploying(rolloutId, subject);
        rollout.startRollback("test", null);
        rollout.finishRollback(rollout.getStages().get(0).targets(), List.of());
        return rollout.toSnapshot();
    }
}
