package xyz.firestige.rollout.infrastructure.metrics;

/**
 * 指标注册抽象
 */
public interface MetricsRegistry {

    String ROLLOUT_STARTED = "rollout_started";
    String ROLLOUT_COMPLETED = "rollout_completed";
    String ROLLOUT_ROLLED_BACK = "rollout_rolled_back";
    String ROLLOUT_ROLLBACK_FAILED = "rollout_rollback_failed";
    String TARGET_DEPLOY_FAILED = "target_deploy_failed";
    String HEALTH_GATE_FAILED = "health_gate_failed";
    String ROLLOUT_ACTIVE = "rollout_active";

    void incrementCounter(String name);

    void setGauge(String name, double value);
}
