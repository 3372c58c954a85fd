package xyz.firestige.rollout.domain.shared.vo;

import java.util.Objects;

/**
 * 变更主体 ID 值对象（Operator 名称或 Feature Flag 名称）
 * <p>
 * 不可变对象，线程安全；类型安全（无法与其他 ID 或 String 混淆）
 * <p>
 * 单飞锁（single-flight）按 SubjectId 维度加锁
 */
public final class SubjectId {

    private final String value;

    private SubjectId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("subjectId 不能为空");
        }
        this.value = value;
    }

    public static SubjectId of(String value) {
        return new SubjectId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubjectId that = (SubjectId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "SubjectId[" + value + "]";
    }
}
