package xyz.firestige.rollout.domain.stage;

import xyz.firestige.rollout.domain.health.HealthThresholds;
import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 发布计划中的一个 Stage（规划后不可变）
 *
 * @param index               Stage 序号（从 0 开始）
 * @param name                Stage 名称
 * @param kind                Stage 类型
 * @param percentage          覆盖百分比，仅金丝雀/直接发布有意义，其余为 null
 * @param targets             本 Stage 新纳入的目标（已解析为显式列表）
 * @param evaluationWindow    部署完成到健康检查之间的观察窗口
 * @param requiresHealthCheck 是否需要健康检查
 * @param pauseAfter          通过后进入下一 Stage 前的暂停
 * @param thresholds          健康门禁阈值
 */
public record Stage(int index,
                    String name,
                    StageKind kind,
                    Integer percentage,
                    List<TargetId> targets,
                    Duration evaluationWindow,
                    boolean requiresHealthCheck,
                    Duration pauseAfter,
                    HealthThresholds thresholds) {

    public Stage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        targets = List.copyOf(targets);
        evaluationWindow = evaluationWindow == null ? Duration.ZERO : evaluationWindow;
        pauseAfter = pauseAfter == null ? Duration.ZERO : pauseAfter;
        thresholds = thresholds == null ? HealthThresholds.defaults() : thresholds;
    }

    public int size() {
        return targets.size();
    }

    public boolean hasPause() {
        return !pauseAfter.isZero();
    }
}
