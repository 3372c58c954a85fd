package xyz.firestige.rollout.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.port.DeployResult;
import xyz.firestige.rollout.domain.shared.vo.TargetId;
import xyz.firestige.rollout.domain.target.Target;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * 目标派发器
 * <p>
 * 以固定数量的工作续体消费目标队列，实现 Stage 内的有界并发；
 * 每个目标失败后按退避重试，直到成功或达到最大尝试次数。
 * 每次取出目标前检查停止条件（取消请求、失败即中止），已开始的目标不会被打断。
 * 传入 {@link TargetCallSequencer} 时，同一目标的每次调用都等上一次调用真正返回后才发起。
 */
public class TargetDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TargetDispatcher.class);

    /**
     * 对单个目标执行的动作（apply 或 route）
     */
    @FunctionalInterface
    public interface TargetAction {
        DeployResult execute(Target target) throws Exception;
    }

    /**
     * 派发过程回调
     */
    public interface DispatchListener {

        DispatchListener NONE = new DispatchListener() {
        };

        /**
         * 首次调用目标之前
         */
        default void beforeDispatch(Target target) {
        }

        default void onSuccess(Target target) {
        }

        default void onFailure(Target target, String reason) {
        }
    }

    /**
     * 派发参数
     *
     * @param operation     操作名称（日志使用）
     * @param concurrency   并发度
     * @param maxAttempts   每个目标的最大尝试次数
     * @param timeout       单次调用超时
     * @param stopOnFailure 任一目标失败后不再派发新目标
     * @param stopRequested 额外的停止条件（取消请求）
     */
    public record DispatchOptions(String operation,
                                  int concurrency,
                                  int maxAttempts,
                                  Duration timeout,
                                  boolean stopOnFailure,
                                  BooleanSupplier stopRequested) {

        public DispatchOptions {
            concurrency = Math.max(1, concurrency);
            maxAttempts = Math.max(1, maxAttempts);
            if (stopRequested == null) {
                stopRequested = () -> false;
            }
        }
    }

    private final ExternalCallExecutor callExecutor;
    private final RolloutTimer timer;
    private final Duration retryBackoff;

    public TargetDispatcher(ExternalCallExecutor callExecutor, RolloutTimer timer, Duration retryBackoff) {
        this.callExecutor = callExecutor;
        this.timer = timer;
        this.retryBackoff = retryBackoff;
    }

    public CompletableFuture<StageDeployReport> dispatch(List<Target> targets, TargetAction action,
                                                         DispatchOptions options, DispatchListener listener) {
        return dispatch(targets, action, options, listener, null);
    }

    public CompletableFuture<StageDeployReport> dispatch(List<Target> targets, TargetAction action,
                                                         DispatchOptions options, DispatchListener listener,
                                                         TargetCallSequencer sequencer) {
        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(StageDeployReport.empty());
        }
        Queue<Target> queue = new ConcurrentLinkedQueue<>(targets);
        StageDeployReport.Collector collector = new StageDeployReport.Collector();

        int workers = Math.min(options.concurrency(), targets.size());
        CompletableFuture<?>[] running = new CompletableFuture<?>[workers];
        for (int i = 0; i < workers; i++) {
            running[i] = work(queue, action, options, listener, collector, sequencer);
        }
        return CompletableFuture.allOf(running).thenApply(v -> {
            List<TargetId> skipped = new ArrayList<>();
            Target left;
            while ((left = queue.poll()) != null) {
                skipped.add(left.id());
            }
            if (!skipped.isEmpty()) {
                log.info("{} 提前停止，{} 个目标未派发", options.operation(), skipped.size());
            }
            return collector.build(skipped);
        });
    }

    private CompletableFuture<Void> work(Queue<Target> queue, TargetAction action, DispatchOptions options,
                                         DispatchListener listener, StageDeployReport.Collector collector,
                                         TargetCallSequencer sequencer) {
        if (shouldStop(options, collector)) {
            return CompletableFuture.completedFuture(null);
        }
        Target target = queue.poll();
        if (target == null) {
            return CompletableFuture.completedFuture(null);
        }
        listener.beforeDispatch(target);
        return attempt(target, 1, action, options, sequencer).thenCompose(outcome -> {
            collector.record(outcome);
            if (outcome.success()) {
                listener.onSuccess(target);
            } else {
                log.warn("{} 失败: target={}, attempts={}, reason={}", options.operation(),
                        target.id().getValue(), outcome.attempts(), outcome.message());
                listener.onFailure(target, outcome.message());
            }
            return work(queue, action, options, listener, collector, sequencer);
        });
    }

    private CompletableFuture<TargetOutcome> attempt(Target target, int attempt, TargetAction action,
                                                     DispatchOptions options, TargetCallSequencer sequencer) {
        String description = options.operation() + "[" + target.id().getValue() + "]";
        CompletableFuture<TargetOutcome> called;
        if (sequencer == null) {
            called = invoke(target, attempt, action, options, description, null);
        } else {
            called = sequencer.awaitIdle(target.id(), options.timeout()).thenCompose(idle -> idle
                    ? invoke(target, attempt, action, options, description, sequencer.begin(target.id()))
                    : CompletableFuture.completedFuture(TargetOutcome.failure(target, attempt,
                            "上一次调用在 " + options.timeout() + " 内仍未返回，放弃本次" + options.operation())));
        }
        return called.thenCompose(outcome -> {
            if (outcome.success() || attempt >= options.maxAttempts() || options.stopRequested().getAsBoolean()) {
                return CompletableFuture.completedFuture(outcome);
            }
            log.debug("{} 第 {} 次失败，{} 后重试: {}", description, attempt, retryBackoff, outcome.message());
            return timer.delay(retryBackoff)
                    .thenCompose(v -> attempt(target, attempt + 1, action, options, sequencer));
        });
    }

    private CompletableFuture<TargetOutcome> invoke(Target target, int attempt, TargetAction action,
                                                    DispatchOptions options, String description,
                                                    CompletableFuture<Void> settled) {
        return callExecutor.call(description, () -> action.execute(target), options.timeout(), settled)
                .handle((result, ex) -> {
                    if (ex != null) {
                        return TargetOutcome.failure(target, attempt, describe(ex));
                    }
                    if (result == null || !result.successful()) {
                        String message = result == null ? "返回结果为空" : result.message();
                        return TargetOutcome.failure(target, attempt, message);
                    }
                    return TargetOutcome.success(target, attempt);
                });
    }

    private boolean shouldStop(DispatchOptions options, StageDeployReport.Collector collector) {
        return options.stopRequested().getAsBoolean() || (options.stopOnFailure() && collector.hasFailures());
    }

    static String describe(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return cause.getMessage();
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
