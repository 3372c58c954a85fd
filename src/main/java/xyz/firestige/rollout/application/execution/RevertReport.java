package xyz.firestige.rollout.application.execution;

import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 回滚结果
 *
 * @param reverted   已恢复到旧版本的目标
 * @param unreverted 未能恢复的目标及原因
 */
public record RevertReport(List<TargetId> reverted, Map<TargetId, String> unreverted) {

    public RevertReport {
        reverted = List.copyOf(reverted);
        unreverted = Collections.unmodifiableMap(new LinkedHashMap<>(unreverted));
    }

    public static RevertReport empty() {
        return new RevertReport(List.of(), Map.of());
    }

    static RevertReport from(StageDeployReport report) {
        Map<TargetId, String> unreverted = new LinkedHashMap<>(report.failed());
        report.skipped().forEach(id -> unreverted.put(id, "未执行回滚"));
        return new RevertReport(report.succeeded(), unreverted);
    }

    public boolean isComplete() {
        return unreverted.isEmpty();
    }
}
