package xyz.firestige.rollout.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;

/**
 * 外部调用执行器
 * <p>
 * 所有 Rollout 的 apply / route / snapshot 调用共享同一个有界线程池，池大小即全局并发上限。
 * 每次调用从真正开始执行时计时，超时即失败并中断执行线程。
 * <p>
 * 超时只结束等待，不保证外部调用已经返回（实现可能忽略中断）。需要感知调用真正结束的调用方
 * 传入 settled，它在执行线程离开外部调用时完成。
 */
public class ExternalCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final ExecutorService ioPool;
    private final RolloutTimer timer;

    public ExternalCallExecutor(ExecutorService ioPool, RolloutTimer timer) {
        this.ioPool = ioPool;
        this.timer = timer;
    }

    public <T> CompletableFuture<T> call(String description, Callable<T> callable, Duration timeout) {
        return call(description, callable, timeout, null);
    }

    /**
     * @param settled 外部调用真正返回时完成（可为 null）
     */
    public <T> CompletableFuture<T> call(String description, Callable<T> callable, Duration timeout,
                                         CompletableFuture<Void> settled) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            ioPool.execute(() -> runWithTimeout(description, callable, timeout, result, settled));
        } catch (RejectedExecutionException e) {
            log.warn("外部调用被拒绝（线程池已关闭?）: {}", description);
            result.completeExceptionally(e);
            if (settled != null) {
                settled.complete(null);
            }
        }
        return result;
    }

    private <T> void runWithTimeout(String description, Callable<T> callable, Duration timeout,
                                    CompletableFuture<T> result, CompletableFuture<Void> settled) {
        Thread worker = Thread.currentThread();
        Object guard = new Object();
        boolean[] running = {true};
        ScheduledFuture<?> timeoutTask = timer.schedule(() -> {
            if (result.completeExceptionally(new TimeoutException(description + " 超时 (" + timeout + ")"))) {
                synchronized (guard) {
                    if (running[0]) {
                        worker.interrupt();
                    }
                }
            }
        }, timeout);
        try {
            result.complete(callable.call());
        } catch (Throwable e) {
            result.completeExceptionally(e);
        } finally {
            timeoutTask.cancel(false);
            synchronized (guard) {
                running[0] = false;
            }
            // 清除超时中断留下的标记，线程归还线程池后不能带着中断状态
            Thread.interrupted();
            if (settled != null) {
                settled.complete(null);
            }
        }
    }
}
