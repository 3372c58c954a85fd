package xyz.firestige.rollout.infrastructure.lock.redis;

import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.infrastructure.lock.LeaseOwner;
import xyz.firestige.rollout.infrastructure.lock.SubjectLockManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 主体锁 Redis 实现（分布式锁）
 * <p>
 * 使用 Redis SET NX 原子获取锁，TTL 自动释放，防止进程崩溃后泄漏。
 * 锁值为 {@link LeaseOwner#token()}，释放和续期通过 Lua 脚本校验持有者。
 */
public class RedisSubjectLockManager implements SubjectLockManager {

    private static final String DEFAULT_NAMESPACE = "rollout";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;

    public RedisSubjectLockManager(RedisTemplate<String, String> redisTemplate) {
        this(redisTemplate, DEFAULT_NAMESPACE);
    }

    public RedisSubjectLockManager(RedisTemplate<String, String> redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = namespace + ":lock:subject:";
    }

    @Override
    public boolean tryAcquire(SubjectId subjectId, LeaseOwner owner, Duration ttl) {
        if (subjectId == null || owner == null || ttl == null) {
            return false;
        }
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key(subjectId), owner.token(), ttl);
        return Boolean.TRUE.equals(success);
    }

    @Override
    public boolean release(SubjectId subjectId, LeaseOwner owner) {
        if (subjectId == null || owner == null) {
            return false;
        }
        Long removed = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(subjectId)), owner.token());
        return removed != null && removed > 0;
    }

    @Override
    public boolean renew(SubjectId subjectId, LeaseOwner owner, Duration ttl) {
        if (subjectId == null || owner == null || ttl == null) {
            return false;
        }
        Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(key(subjectId)),
                owner.token(), String.valueOf(ttl.toMillis()));
        return renewed != null && renewed > 0;
    }

    @Override
    public Optional<LeaseOwner> holder(SubjectId subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        String value = redisTemplate.opsForValue().get(key(subjectId));
        return Optional.ofNullable(value).map(LeaseOwner::parse);
    }

    private String key(SubjectId subjectId) {
        return keyPrefix + subjectId.getValue();
    }
}
