package xyz.firestige.rollout.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 主体租约
 * <p>
 * 一次 Rollout 从获取到释放主体锁的凭证。{@link #close()} 只会真正释放一次，
 * 完成、回滚、异常等所有退出路径都可以放心调用。
 */
public final class SubjectLease implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubjectLease.class);

    private final SubjectLockManager lockManager;
    private final SubjectId subjectId;
    private final LeaseOwner holder;
    private final Duration ttl;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SubjectLease(SubjectLockManager lockManager, SubjectId subjectId, LeaseOwner holder, Duration ttl) {
        this.lockManager = lockManager;
        this.subjectId = subjectId;
        this.holder = holder;
        this.ttl = ttl;
    }

    public SubjectId getSubjectId() {
        return subjectId;
    }

    public LeaseOwner getHolder() {
        return holder;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * 续期，已释放的租约不再续期
     */
    public boolean renew() {
        return !released.get() && lockManager.renew(subjectId, holder, ttl);
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            boolean removed = lockManager.release(subjectId, holder);
            if (!removed) {
                log.warn("[SubjectLease] 释放时锁已不属于当前持有者: subject={}, holder={}",
                        subjectId.getValue(), holder.token());
            } else {
                log.debug("[SubjectLease] 已释放: subject={}, holder={}", subjectId.getValue(), holder.token());
            }
        }
    }
}
