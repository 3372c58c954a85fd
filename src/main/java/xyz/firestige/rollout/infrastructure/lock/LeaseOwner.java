package xyz.firestige.rollout.infrastructure.lock;

import xyz.firestige.rollout.domain.shared.vo.RolloutId;

import java.util.Objects;
import java.util.UUID;

/**
 * 主体锁持有者：Rollout ID + 协调器实例 ID
 * <p>
 * 同一个 Rollout 只能由获取锁的那个协调器实例驱动。其他实例即使从共享仓储读到同一个 Rollout，
 * 也无法以相同身份重入锁。
 * <p>
 * 锁值格式：{rolloutId}@{instanceId}
 */
public final class LeaseOwner {

    private static final char SEPARATOR = '@';
    private static final String UNKNOWN_INSTANCE = "unknown";

    private final RolloutId rolloutId;
    private final String instanceId;

    private LeaseOwner(RolloutId rolloutId, String instanceId) {
        if (rolloutId == null) {
            throw new IllegalArgumentException("rolloutId 不能为空");
        }
        if (instanceId == null || instanceId.isBlank() || instanceId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("instanceId 不能为空且不能包含 '@': " + instanceId);
        }
        this.rolloutId = rolloutId;
        this.instanceId = instanceId;
    }

    public static LeaseOwner of(RolloutId rolloutId, String instanceId) {
        return new LeaseOwner(rolloutId, instanceId);
    }

    /**
     * 解析锁值，没有实例部分的旧格式视为未知实例
     */
    public static LeaseOwner parse(String token) {
        int idx = token.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == token.length() - 1) {
            return new LeaseOwner(RolloutId.of(token), UNKNOWN_INSTANCE);
        }
        return new LeaseOwner(RolloutId.of(token.substring(0, idx)), token.substring(idx + 1));
    }

    /**
     * 进程级随机实例 ID
     */
    public static String randomInstanceId() {
        return "coordinator-" + UUID.randomUUID();
    }

    public RolloutId rolloutId() {
        return rolloutId;
    }

    public String instanceId() {
        return instanceId;
    }

    public String token() {
        return rolloutId.getValue() + SEPARATOR + instanceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LeaseOwner that = (LeaseOwner) o;
        return Objects.equals(rolloutId, that.rolloutId) && Objects.equals(instanceId, that.instanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rolloutId, instanceId);
    }

    @Override
    public String toString() {
        return "LeaseOwner[" + token() + "]";
    }
}
