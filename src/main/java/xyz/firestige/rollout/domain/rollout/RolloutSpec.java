package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.domain.strategy.RolloutStrategy;
import xyz.firestige.rollout.domain.target.Target;

import java.util.List;

/**
 * 发起一次 Rollout 的入参
 *
 * @param subjectId           被变更的主体（Operator 或 Feature Flag）
 * @param targetVersion       新版本或新开关值
 * @param previousVersion     旧版本或旧开关值，回滚时使用
 * @param strategy            发布策略
 * @param targets             目标列表
 * @param autoRollbackEnabled 失败时是否自动回滚；关闭时 Rollout 挂起等待人工处理
 */
public record RolloutSpec(SubjectId subjectId,
                          String targetVersion,
                          String previousVersion,
                          RolloutStrategy strategy,
                          List<Target> targets,
                          boolean autoRollbackEnabled) {

    public RolloutSpec {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static RolloutSpec of(String subjectId, String targetVersion, String previousVersion,
                                 RolloutStrategy strategy, List<Target> targets) {
        return new RolloutSpec(SubjectId.of(subjectId), targetVersion, previousVersion, strategy, targets, true);
    }

    public RolloutSpec withAutoRollback(boolean enabled) {
        return new RolloutSpec(subjectId, targetVersion, previousVersion, strategy, targets, enabled);
    }
}
