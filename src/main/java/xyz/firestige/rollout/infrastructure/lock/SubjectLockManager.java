package xyz.firestige.rollout.infrastructure.lock;

import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.time.Duration;
import java.util.Optional;

/**
 * 主体单飞锁管理器
 * <p>
 * 保证同一主体同一时刻最多只有一个活跃 Rollout。
 * 持有者为 {@link LeaseOwner}（rolloutId + 协调器实例），释放和续期时校验持有者，
 * 避免误删或误续其他实例的锁。
 * <p>
 * 实现：
 * - InMemorySubjectLockManager: 单实例部署
 * - RedisSubjectLockManager: 多实例部署（SET NX + TTL）
 */
public interface SubjectLockManager {

    /**
     * 尝试获取锁
     *
     * @param subjectId 主体 ID
     * @param owner     持有者
     * @param ttl       锁的存活时间
     * @return true=获取成功，false=已被占用
     */
    boolean tryAcquire(SubjectId subjectId, LeaseOwner owner, Duration ttl);

    /**
     * 释放锁（仅当持有者匹配时）
     *
     * @return true=已释放，false=锁不存在或持有者不匹配
     */
    boolean release(SubjectId subjectId, LeaseOwner owner);

    /**
     * 续期
     */
    boolean renew(SubjectId subjectId, LeaseOwner owner, Duration ttl);

    /**
     * 查询当前持有者
     */
    Optional<LeaseOwner> holder(SubjectId subjectId);

    /**
     * 获取租约，失败时返回 empty
     * <p>
     * 锁已由完全相同的持有者占有时（配置了固定实例 ID 的实例重启后）直接接管并续期；
     * 同一 Rollout 但实例不同视为被占用。
     */
    default Optional<SubjectLease> acquire(SubjectId subjectId, LeaseOwner owner, Duration ttl) {
        if (!tryAcquire(subjectId, owner, ttl)) {
            if (!owner.equals(holder(subjectId).orElse(null)) || !renew(subjectId, owner, ttl)) {
                return Optional.empty();
            }
        }
        return Optional.of(new SubjectLease(this, subjectId, owner, ttl));
    }
}
