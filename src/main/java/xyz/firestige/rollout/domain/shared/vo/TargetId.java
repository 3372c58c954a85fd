package xyz.firestige.rollout.domain.shared.vo;

import java.util.Objects;

/**
 * 目标 ID 值对象（集群名称或用户/请求上下文标识）
 * <p>
 * 不可变对象，线程安全；类型安全（无法与其他 ID 或 String 混淆）
 * <p>
 * Rolling 策略的默认排序使用该值的字典序
 */
public final class TargetId implements Comparable<TargetId> {

    private final String value;

    private TargetId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("targetId 不能为空");
        }
        this.value = value;
    }

    public static TargetId of(String value) {
        return new TargetId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetId that = (TargetId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public int compareTo(TargetId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return "TargetId[" + value + "]";
    }
}
