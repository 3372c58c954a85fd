package xyz.firestige.rollout.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * Rollout ID 值对象
 * <p>
 * 不可变对象，线程安全；类型安全（无法与其他 ID 或 String 混淆）
 * <p>
 * 格式建议：rollout-{uuid}
 */
public final class RolloutId {

    private final String value;

    private RolloutId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("rolloutId 不能为空");
        }
        this.value = value;
    }

    public static RolloutId of(String value) {
        return new RolloutId(value);
    }

    /**
     * 生成新的 RolloutId
     */
    public static RolloutId generate() {
        return new RolloutId("rollout-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RolloutId that = (RolloutId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "RolloutId[" + value + "]";
    }
}
