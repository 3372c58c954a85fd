package xyz.firestige.rollout.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.port.Deployer;
import xyz.firestige.rollout.domain.port.TrafficSlot;
import xyz.firestige.rollout.domain.port.TrafficSwitcher;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.strategy.StrategyType;
import xyz.firestige.rollout.domain.target.Target;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 回滚控制器
 * <p>
 * 将已触达的目标恢复到旧版本：
 * - 蓝绿发布：流量路由回蓝色侧，不重新部署
 * - 其余策略：对目标重新应用 previousVersion
 * <p>
 * 并发度与正向发布一致，每个目标最多尝试 maxAttempts 次，回滚不可取消。
 * 目标的正向调用尚未真正返回时先等待其返回再回滚；始终等不到的目标记为未恢复。
 */
public class RollbackController {

    private static final Logger log = LoggerFactory.getLogger(RollbackController.class);

    private final TargetDispatcher dispatcher;
    private final Deployer deployer;
    private final TrafficSwitcher trafficSwitcher;
    private final int maxAttempts;
    private final Duration timeout;

    public RollbackController(TargetDispatcher dispatcher, Deployer deployer, TrafficSwitcher trafficSwitcher,
                              int maxAttempts, Duration timeout) {
        this.dispatcher = dispatcher;
        this.deployer = deployer;
        this.trafficSwitcher = trafficSwitcher;
        this.maxAttempts = maxAttempts;
        this.timeout = timeout;
    }

    public CompletableFuture<RevertReport> revert(Rollout rollout, List<Target> touched) {
        return revert(rollout, touched, null);
    }

    /**
     * @param sequencer 正向执行使用的串行器，null 表示没有在途调用（例如重启恢复）
     */
    public CompletableFuture<RevertReport> revert(Rollout rollout, List<Target> touched,
                                                  TargetCallSequencer sequencer) {
        if (touched.isEmpty()) {
            log.info("没有已触达的目标，无需回滚");
            return CompletableFuture.completedFuture(RevertReport.empty());
        }
        TargetDispatcher.TargetAction action = revertAction(rollout);
        TargetDispatcher.DispatchOptions options = new TargetDispatcher.DispatchOptions("回滚",
                rollout.getStrategy().effectiveConcurrency(touched.size()), maxAttempts, timeout, false, null);
        log.info("回滚 {} 个目标，并发度 {}", touched.size(), options.concurrency());
        return dispatcher.dispatch(touched, action, options, TargetDispatcher.DispatchListener.NONE, sequencer)
                .thenApply(RevertReport::from);
    }

    private TargetDispatcher.TargetAction revertAction(Rollout rollout) {
        if (rollout.getStrategy().type() == StrategyType.BLUE_GREEN) {
            if (trafficSwitcher == null) {
                throw new IllegalStateException("蓝绿发布回滚需要 TrafficSwitcher");
            }
            return target -> trafficSwitcher.route(target, TrafficSlot.BLUE);
        }
        String previousVersion = rollout.getPreviousVersion();
        return target -> deployer.apply(target, previousVersion);
    }
}
