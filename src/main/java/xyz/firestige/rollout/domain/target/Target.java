package xyz.firestige.rollout.domain.target;

import xyz.firestige.rollout.domain.shared.vo.TargetId;

import java.util.Objects;

/**
 * 发布目标（集群节点或用户/请求上下文）
 *
 * @param id          目标 ID
 * @param bucketKey   稳定分桶键，金丝雀按其哈希值排序
 * @param environment 目标环境
 */
public record Target(TargetId id, String bucketKey, TargetEnvironment environment) {

    public Target {
        Objects.requireNonNull(id, "id");
        if (bucketKey == null || bucketKey.isBlank()) {
            throw new IllegalArgumentException("bucketKey 不能为空, target: " + id.getValue());
        }
        if (environment == null) {
            environment = TargetEnvironment.PRODUCTION;
        }
    }

    public static Target of(String id, String bucketKey, TargetEnvironment environment) {
        return new Target(TargetId.of(id), bucketKey, environment);
    }

    /**
     * 以 ID 作为分桶键的生产环境目标
     */
    public static Target of(String id) {
        return new Target(TargetId.of(id), id, TargetEnvironment.PRODUCTION);
    }
}
