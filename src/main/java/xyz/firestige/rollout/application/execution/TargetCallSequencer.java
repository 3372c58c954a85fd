package xyz.firestige.rollout.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 单个 Rollout 内按目标串行化外部调用
 * <p>
 * 超时的 apply 可能仍在执行线程里运行。同一目标的下一次调用（重试或回滚）必须等上一次真正返回，
 * 否则旧调用可能在回滚之后才落地，把目标留在新版本上。
 * 等待超过上限仍未返回时，本次调用放弃执行，由调用方按失败处理。
 */
public class TargetCallSequencer {

    private static final Logger log = LoggerFactory.getLogger(TargetCallSequencer.class);

    private final RolloutTimer timer;
    private final ConcurrentMap<TargetId, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    public TargetCallSequencer(RolloutTimer timer) {
        this.timer = timer;
    }

    /**
     * 等待目标上一次调用返回
     *
     * @return true=目标空闲，false=等待 maxWait 后仍未返回
     */
    public CompletableFuture<Boolean> awaitIdle(TargetId targetId, Duration maxWait) {
        CompletableFuture<Void> previous = inFlight.get(targetId);
        if (previous == null || previous.isDone()) {
            return CompletableFuture.completedFuture(true);
        }
        log.info("目标 {} 上一次调用尚未返回，等待至多 {}", targetId.getValue(), maxWait);
        CompletableFuture<Boolean> idle = new CompletableFuture<>();
        ScheduledFuture<?> expiry = timer.schedule(() -> idle.complete(false), maxWait);
        previous.whenComplete((v, ex) -> timer.executor().execute(() -> {
            if (idle.complete(true)) {
                expiry.cancel(false);
            }
        }));
        return idle;
    }

    /**
     * 登记一次新调用，返回的 Future 需在外部调用真正返回时完成
     */
    public CompletableFuture<Void> begin(TargetId targetId) {
        CompletableFuture<Void> settled = new CompletableFuture<>();
        inFlight.put(targetId, settled);
        settled.whenComplete((v, ex) -> inFlight.remove(targetId, settled));
        return settled;
    }

    public boolean isIdle(TargetId targetId) {
        CompletableFuture<Void> previous = inFlight.get(targetId);
        return previous == null || previous.isDone();
    }
}
