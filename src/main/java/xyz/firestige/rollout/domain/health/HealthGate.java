package xyz.firestige.rollout.domain.health;

import java.util.Map;

/**
 * 健康门禁（纯函数）
 * <p>
 * 判定规则：
 * 1. successRate 低于 successRateMin 不通过
 * 2. 任一配置的指标超过上限不通过
 * 3. 配置的指标在快照中缺失，按不通过处理（fail-closed）
 */
public final class HealthGate {

    private HealthGate() {
    }

    public static HealthVerdict evaluate(HealthSnapshot snapshot, HealthThresholds thresholds) {
        if (snapshot == null) {
            return HealthVerdict.fail("健康快照缺失");
        }
        if (Double.isNaN(snapshot.successRate()) || snapshot.successRate() < thresholds.successRateMin()) {
            return HealthVerdict.fail(String.format("成功率 %.4f 低于阈值 %.4f",
                    snapshot.successRate(), thresholds.successRateMin()));
        }
        for (Map.Entry<String, Double> max : thresholds.metricMaxima().entrySet()) {
            Double actual = snapshot.metrics().get(max.getKey());
            if (actual == null || actual.isNaN()) {
                return HealthVerdict.fail("指标缺失: " + max.getKey());
            }
            if (actual > max.getValue()) {
                return HealthVerdict.fail(String.format("指标 %s=%s 超过上限 %s",
                        max.getKey(), actual, max.getValue()));
            }
        }
        return HealthVerdict.pass();
    }
}
