package xyz.firestige.rollout.application.execution;

import xyz.firestige.rollout.domain.shared.exception.FailureInfo;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单个 Rollout 的取消/回滚请求令牌
 * <p>
 * 外部的取消和人工回滚都通过它传递给执行流水线。流水线在检查点读取令牌；
 * 等待中的观察窗口和暂停通过 {@link #signal()} 被提前唤醒。只有第一次请求生效。
 */
public class RolloutCancellation {

    /**
     * 回滚请求
     *
     * @param reason      回滚原因
     * @param failureInfo 失败信息，人工回滚时可为 null
     */
    public record Request(String reason, FailureInfo failureInfo) {
    }

    private final AtomicReference<Request> request = new AtomicReference<>();
    private final CompletableFuture<Request> signal = new CompletableFuture<>();

    /**
     * 提交请求
     *
     * @return true=本次请求生效，false=已有请求
     */
    public boolean request(String reason, FailureInfo failureInfo) {
        Request r = new Request(reason, failureInfo);
        if (request.compareAndSet(null, r)) {
            signal.complete(r);
            return true;
        }
        return false;
    }

    public boolean isRequested() {
        return request.get() != null;
    }

    public Request getRequest() {
        return request.get();
    }

    /**
     * 请求到达时完成的 Future
     */
    public CompletableFuture<Request> signal() {
        return signal;
    }
}
