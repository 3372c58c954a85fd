package xyz.firestige.rollout.infrastructure.lock.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;
import xyz.firestige.rollout.infrastructure.lock.LeaseOwner;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@DisplayName("RedisSubjectLockManager 测试")
class RedisSubjectLockManagerTest {

    private static final SubjectId SUBJECT = SubjectId.of("operator-a");
    private static final String KEY = "test:lock:subject:operator-a";

    private static final LeaseOwner R1 = LeaseOwner.of(RolloutId.of("r1"), "node-1");
    private static final LeaseOwner R2 = LeaseOwner.of(RolloutId.of("r2"), "node-1");

    private RedisTemplate<String, String> redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisSubjectLockManager lockManager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lockManager = new RedisSubjectLockManager(redisTemplate, "test");
    }

    @Test
    @DisplayName("场景: 获取锁使用 SET NX 并带 TTL")
    void acquireUsesSetIfAbsent() {
        when(valueOps.setIfAbsent(KEY, "r1@node-1", Duration.ofMinutes(5))).thenReturn(true);
        when(valueOps.setIfAbsent(KEY, "r2@node-1", Duration.ofMinutes(5))).thenReturn(false);

        assertTrue(lockManager.tryAcquire(SUBJECT, R1, Duration.ofMinutes(5)));
        assertFalse(lockManager.tryAcquire(SUBJECT, R2, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("场景: Redis 返回 null 视为获取失败")
    void nullReplyIsFailure() {
        when(valueOps.setIfAbsent(any(), any(), any(Duration.class))).thenReturn(null);

        assertFalse(lockManager.tryAcquire(SUBJECT, R1, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("场景: 释放通过脚本校验持有者")
    @SuppressWarnings("unchecked")
    void releaseRunsHolderCheckedScript() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("r1@node-1"))).thenReturn(1L);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("r2@node-1"))).thenReturn(0L);

        assertTrue(lockManager.release(SUBJECT, R1));
        assertFalse(lockManager.release(SUBJECT, R2));
        verify(redisTemplate).execute(any(RedisScript.class), eq(List.of(KEY)), eq("r1@node-1"));
    }

    @Test
    @DisplayName("场景: 续期传入毫秒 TTL")
    @SuppressWarnings("unchecked")
    void renewPassesTtlInMillis() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("r1@node-1"), eq("30000"))).thenReturn(1L);

        assertTrue(lockManager.renew(SUBJECT, R1, Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("场景: 查询当前持有者")
    void holderReadsKey() {
        when(valueOps.get(KEY)).thenReturn("r1@node-1");

        assertThat(lockManager.holder(SUBJECT)).contains(R1);
        assertThat(lockManager.holder(SubjectId.of("other"))).isEmpty();
    }

    @Test
    @DisplayName("场景: 同一 Rollout 被其他实例持有时不能重入")
    void sameRolloutOtherInstanceCannotReenter() {
        // Given: 锁由 node-2 上的 r1 持有
        when(valueOps.setIfAbsent(any(), any(), any(Duration.class))).thenReturn(false);
        when(valueOps.get(KEY)).thenReturn("r1@node-2");

        // When / Then
        assertThat(lockManager.acquire(SUBJECT, R1, Duration.ofMinutes(5))).isEmpty();
        assertThat(lockManager.holder(SUBJECT)).get()
                .extracting(LeaseOwner::instanceId).isEqualTo("node-2");
    }

    @Test
    @DisplayName("场景: 旧格式锁值解析为未知实例")
    void legacyValueParsesAsUnknownInstance() {
        when(valueOps.get(KEY)).thenReturn("r1");

        LeaseOwner holder = lockManager.holder(SUBJECT).orElseThrow();
        assertThat(holder.rolloutId()).isEqualTo(RolloutId.of("r1"));
        assertThat(holder).isNotEqualTo(R1);
    }
}
