package xyz.firestige.rollout.domain.stage;

import xyz.firestige.rollout.domain.bucketing.TargetBucketing;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.strategy.BlueGreenStrategy;
import xyz.firestige.rollout.domain.strategy.CanaryStrategy;
import xyz.firestige.rollout.domain.strategy.DirectStrategy;
import xyz.firestige.rollout.domain.strategy.RollingStrategy;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;
import xyz.firestige.rollout.domain.target.Target;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Stage 规划器
 * <p>
 * 根据策略和目标列表计算有序的 Stage 列表。纯函数，不访问任何外部资源。
 * <ul>
 *   <li>直接发布：一个 Stage 覆盖全部目标</li>
 *   <li>金丝雀：按 (桶号, ID) 排序，每个 Stage 取累计 ceil(N*p/100) 个目标中尚未覆盖的部分</li>
 *   <li>滚动：按 (环境, ID) 或显式顺序，每 batchSize 个目标一个 Stage</li>
 *   <li>蓝绿：部署绿色侧 + 切换流量两个 Stage</li>
 * </ul>
 */
public class StagePlanner {

    public static final Duration DEFAULT_DIRECT_HEALTH_CHECK_WINDOW = Duration.ofSeconds(30);

    private final Duration directHealthCheckWindow;

    public StagePlanner() {
        this(DEFAULT_DIRECT_HEALTH_CHECK_WINDOW);
    }

    public StagePlanner(Duration directHealthCheckWindow) {
        this.directHealthCheckWindow = Objects.requireNonNull(directHealthCheckWindow, "directHealthCheckWindow");
    }

    public List<Stage> plan(RolloutStrategy strategy, List<Target> targets) {
        Objects.requireNonNull(strategy, "strategy");
        validateTargets(targets);
        return switch (strategy.type()) {
            case DIRECT -> planDirect((DirectStrategy) strategy, targets);
            case CANARY -> planCanary((CanaryStrategy) strategy, targets);
            case ROLLING -> planRolling((RollingStrategy) strategy, targets);
            case BLUE_GREEN -> planBlueGreen((BlueGreenStrategy) strategy, targets);
        };
    }

    private List<Stage> planDirect(DirectStrategy strategy, List<Target> targets) {
        boolean check = !strategy.skipHealthChecks();
        return List.of(new Stage(0, "direct", StageKind.DEPLOY, 100, ids(targets),
                check ? directHealthCheckWindow : Duration.ZERO, check, Duration.ZERO, strategy.thresholds()));
    }

    private List<Stage> planCanary(CanaryStrategy strategy, List<Target> targets) {
        List<Target> ordered = new ArrayList<>(targets);
        ordered.sort(Comparator.comparingInt((Target t) -> TargetBucketing.bucket(t.bucketKey()))
                .thenComparing(Target::id));

        int total = ordered.size();
        int covered = 0;
        int percentage = strategy.initialPercentage();
        List<Stage> stages = new ArrayList<>();
        while (covered < total) {
            int cumulative = Math.min(total, (total * percentage + 99) / 100);
            boolean terminal = percentage >= 100 || cumulative >= total;
            if (cumulative > covered) {
                List<TargetId> stageTargets = ids(ordered.subList(covered, cumulative));
                // 覆盖全部目标的 Stage 即末尾 Stage，按 100% 记录且不再做健康检查
                int stagePercentage = terminal ? 100 : percentage;
                stages.add(new Stage(stages.size(), "canary-" + stagePercentage + "%", StageKind.DEPLOY,
                        stagePercentage, stageTargets,
                        terminal ? Duration.ZERO : strategy.evaluationWindow(),
                        !terminal, Duration.ZERO, strategy.thresholds()));
                covered = cumulative;
            }
            percentage = Math.min(percentage + strategy.incrementPercentage(), 100);
        }
        return stages;
    }

    private List<Stage> planRolling(RollingStrategy strategy, List<Target> targets) {
        List<Target> ordered = strategy.order().isEmpty()
                ? defaultRollingOrder(targets)
                : explicitOrder(strategy.order(), targets);

        List<Stage> stages = new ArrayList<>();
        int batches = (ordered.size() + strategy.batchSize() - 1) / strategy.batchSize();
        for (int i = 0; i < batches; i++) {
            int from = i * strategy.batchSize();
            int to = Math.min(ordered.size(), from + strategy.batchSize());
            boolean last = i == batches - 1;
            stages.add(new Stage(i, "batch-" + (i + 1), StageKind.DEPLOY, null, ids(ordered.subList(from, to)),
                    strategy.evaluationWindow(), true,
                    last ? Duration.ZERO : strategy.pauseBetweenStages(), strategy.thresholds()));
        }
        return stages;
    }

    private List<Stage> planBlueGreen(BlueGreenStrategy strategy, List<Target> targets) {
        List<TargetId> all = ids(targets);
        return List.of(
                new Stage(0, "green-deploy", StageKind.DEPLOY, null, all,
                        strategy.validationPeriod(), true, Duration.ZERO, strategy.thresholds()),
                new Stage(1, "traffic-switch", StageKind.SWITCH, null, all,
                        strategy.postSwitchMonitoringPeriod(), true, Duration.ZERO, strategy.thresholds()));
    }

    private List<Target> defaultRollingOrder(List<Target> targets) {
        List<Target> ordered = new ArrayList<>(targets);
        ordered.sort(Comparator.comparing(Target::environment).thenComparing(Target::id));
        return ordered;
    }

    private List<Target> explicitOrder(List<String> order, List<Target> targets) {
        Map<String, Target> byId = new HashMap<>();
        targets.forEach(t -> byId.put(t.id().getValue(), t));
        if (order.size() != targets.size() || !new HashSet<>(order).equals(byId.keySet())) {
            throw new IllegalArgumentException("滚动发布的显式顺序必须是全部目标 ID 的一个排列: " + order);
        }
        return order.stream().map(byId::get).toList();
    }

    private void validateTargets(List<Target> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("目标列表不能为空");
        }
        Set<TargetId> seen = new HashSet<>();
        for (Target target : targets) {
            if (!seen.add(target.id())) {
                throw new IllegalArgumentException("目标 ID 重复: " + target.id().getValue());
            }
        }
    }

    private static List<TargetId> ids(List<Target> targets) {
        return targets.stream().map(Target::id).toList();
    }
}
