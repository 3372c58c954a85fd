package xyz.firestige.rollout.application.execution;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Rollout 定时器
 * <p>
 * 观察窗口、Stage 间暂停和重试退避都以定时续体实现，不占用线程等待。
 * 定时线程只负责到期触发，续体交给流水线执行器运行：持久化等阻塞步骤不会拖慢其他 Rollout 的定时。
 * 续体也不会跑在发起取消的调用方线程上。
 */
public class RolloutTimer {

    private final ScheduledExecutorService scheduler;
    private final Executor pipelineExecutor;

    /**
     * 定时线程兼做流水线执行器（测试或轻量场景）
     */
    public RolloutTimer(ScheduledExecutorService scheduler) {
        this(scheduler, scheduler);
    }

    public RolloutTimer(ScheduledExecutorService scheduler, Executor pipelineExecutor) {
        this.scheduler = scheduler;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * 等待指定时长
     */
    public CompletableFuture<Void> delay(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        schedule(() -> future.complete(null), duration);
        return future;
    }

    /**
     * 可取消的等待
     *
     * @return true=等待到期，false=被取消请求提前唤醒
     */
    public CompletableFuture<Boolean> delay(Duration duration, RolloutCancellation cancellation) {
        if (cancellation.isRequested()) {
            return CompletableFuture.completedFuture(false);
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(true);
        }
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        ScheduledFuture<?> task = schedule(() -> future.complete(true), duration);
        cancellation.signal().thenRun(() -> pipelineExecutor.execute(() -> {
            if (future.complete(false)) {
                task.cancel(false);
            }
        }));
        return future;
    }

    /**
     * 在 delay 后于流水线执行器上执行任务
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return scheduler.schedule(() -> pipelineExecutor.execute(task), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 流水线续体使用的执行器
     */
    public Executor executor() {
        return pipelineExecutor;
    }
}
