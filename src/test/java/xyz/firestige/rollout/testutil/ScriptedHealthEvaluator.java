package xyz.firestige.rollout.testutil;

import xyz.firestige.rollout.domain.health.HealthSnapshot;
import xyz.firestige.rollout.domain.port.HealthEvaluator;
import xyz.firestige.rollout.domain.target.Target;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 按脚本返回健康快照的 HealthEvaluator；脚本耗尽后返回默认快照（默认健康）
 */
public class ScriptedHealthEvaluator implements HealthEvaluator {

    private final Queue<HealthSnapshot> script = new ConcurrentLinkedQueue<>();
    private final List<List<String>> observed = new ArrayList<>();
    private volatile HealthSnapshot fallback = HealthSnapshot.of(1.0);
    private volatile boolean throwing;

    public ScriptedHealthEvaluator then(HealthSnapshot snapshot) {
        script.add(snapshot);
        return this;
    }

    public ScriptedHealthEvaluator thenHealthy() {
        return then(HealthSnapshot.of(1.0));
    }

    public ScriptedHealthEvaluator thenUnhealthy() {
        return then(HealthSnapshot.of(0.5));
    }

    public ScriptedHealthEvaluator otherwise(HealthSnapshot snapshot) {
        this.fallback = snapshot;
        return this;
    }

    public ScriptedHealthEvaluator alwaysThrow() {
        this.throwing = true;
        return this;
    }

    @Override
    public HealthSnapshot snapshot(List<Target> activeTargets) {
        synchronized (observed) {
            observed.add(activeTargets.stream().map(t -> t.id().getValue()).toList());
        }
        if (throwing) {
            throw new IllegalStateException("遥测不可用");
        }
        HealthSnapshot next = script.poll();
        return next != null ? next : fallback;
    }

    /**
     * 每次评估时的活跃目标
     */
    public List<List<String>> getObserved() {
        synchronized (observed) {
            return List.copyOf(observed);
        }
    }
}
