package xyz.firestige.rollout.application.execution;

import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一批目标的派发结果
 *
 * @param succeeded 成功的目标
 * @param failed    失败的目标及原因
 * @param skipped   因取消或失败中止而未派发的目标
 */
public record StageDeployReport(List<TargetId> succeeded, Map<TargetId, String> failed, List<TargetId> skipped) {

    public StageDeployReport {
        succeeded = List.copyOf(succeeded);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        skipped = List.copyOf(skipped);
    }

    public static StageDeployReport empty() {
        return new StageDeployReport(List.of(), Map.of(), List.of());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /**
     * 已派发目标中的成功比例；没有派发任何目标时为 1
     */
    public double successRatio() {
        int attempted = succeeded.size() + failed.size();
        return attempted == 0 ? 1.0 : (double) succeeded.size() / attempted;
    }

    /**
     * 线程安全的结果收集器
     */
    static final class Collector {

        private final List<TargetId> succeeded = new ArrayList<>();
        private final Map<TargetId, String> failed = new LinkedHashMap<>();

        synchronized void record(TargetOutcome outcome) {
            if (outcome.success()) {
                succeeded.add(outcome.target().id());
            } else {
                failed.put(outcome.target().id(), outcome.message());
            }
        }

        synchronized boolean hasFailures() {
            return !failed.isEmpty();
        }

        synchronized StageDeployReport build(List<TargetId> skipped) {
            return new StageDeployReport(succeeded, failed, skipped);
        }
    }
}
