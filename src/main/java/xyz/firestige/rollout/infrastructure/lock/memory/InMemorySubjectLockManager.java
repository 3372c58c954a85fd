package xyz.firestige.rollout.infrastructure.lock.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.infrastructure.lock.LeaseOwner;
import xyz.firestige.rollout.infrastructure.lock.SubjectLockManager;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 主体锁内存实现（单实例部署）
 * <p>
 * 基于 ConcurrentHashMap 的原子操作，TTL 到期的锁视为不存在。
 */
public class InMemorySubjectLockManager implements SubjectLockManager {

    private static final Logger log = LoggerFactory.getLogger(InMemorySubjectLockManager.class);

    private record Entry(LeaseOwner owner, long expiresAtNanos) {

        boolean expired(long now) {
            return now - expiresAtNanos >= 0;
        }
    }

    private final ConcurrentMap<SubjectId, Entry> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(SubjectId subjectId, LeaseOwner owner, Duration ttl) {
        if (subjectId == null || owner == null || ttl == null) {
            return false;
        }
        AtomicBoolean acquired = new AtomicBoolean(false);
        locks.compute(subjectId, (key, existing) -> {
            long now = System.nanoTime();
            if (existing != null && !existing.expired(now)) {
                log.debug("主体锁已被占用: subject={}, holder={}", key.getValue(), existing.owner().token());
                return existing;
            }
            acquired.set(true);
            return new Entry(owner, now + ttl.toNanos());
        });
        return acquired.get();
    }

    @Override
    public boolean release(SubjectId subjectId, LeaseOwner owner) {
        if (subjectId == null || owner == null) {
            return false;
        }
        AtomicBoolean removed = new AtomicBoolean(false);
        locks.computeIfPresent(subjectId, (key, existing) -> {
            if (!existing.owner().equals(owner)) {
                return existing;
            }
            removed.set(!existing.expired(System.nanoTime()));
            return null;
        });
        return removed.get();
    }

    @Override
    public boolean renew(SubjectId subjectId, LeaseOwner owner, Duration ttl) {
        if (subjectId == null || owner == null || ttl == null) {
            return false;
        }
        AtomicBoolean renewed = new AtomicBoolean(false);
        locks.computeIfPresent(subjectId, (key, existing) -> {
            long now = System.nanoTime();
            if (!existing.owner().equals(owner) || existing.expired(now)) {
                return existing;
            }
            renewed.set(true);
            return new Entry(owner, now + ttl.toNanos());
        });
        return renewed.get();
    }

    @Override
    public Optional<LeaseOwner> holder(SubjectId subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        Entry entry = locks.get(subjectId);
        if (entry == null || entry.expired(System.nanoTime())) {
            return Optional.empty();
        }
        return Optional.of(entry.owner());
    }

    public int getLockedCount() {
        long now = System.nanoTime();
        return (int) locks.values().stream().filter(e -> !e.expired(now)).count();
    }
}
