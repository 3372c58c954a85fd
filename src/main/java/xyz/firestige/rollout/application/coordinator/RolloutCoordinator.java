package xyz.firestige.rollout.application.coordinator;

import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutSpec;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.util.Optional;

/**
 * Rollout 协调器
 * <p>
 * 引擎对外的唯一入口。所有失败都体现在返回值和 Rollout 的终态中，调用方无需捕获异常。
 */
public interface RolloutCoordinator {

    /**
     * 发起 Rollout：获取主体租约、规划 Stage，并异步执行
     */
    StartResult start(RolloutSpec spec);

    /**
     * 取消：在下一个检查点以 "Cancelled" 为原因回滚
     */
    RolloutOperationResult cancel(RolloutId rolloutId);

    /**
     * 人工回滚（包括自动回滚关闭后挂起的 Rollout）
     * <p>
     * 其他实例正在驱动的 Rollout 返回 ALREADY_IN_PROGRESS 失败结果。
     */
    RolloutOperationResult rollback(RolloutId rolloutId, String reason);

    Optional<RolloutSnapshot> status(RolloutId rolloutId);

    /**
     * 重启恢复：回滚上次未结束的 Rollout
     * <p>
     * 仅当该 Rollout 的主体租约已失效（或由本实例以相同身份持有）时才接管，
     * 否则返回 ALREADY_IN_PROGRESS，不做任何变更。
     */
    StartResult recover(RolloutSnapshot snapshot);
}
