package xyz.firestige.rollout.facade.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 目标（外部 DTO）
 */
public class TargetRequest {

    @NotBlank(message = "目标 ID 不能为空")
    private String id;

    /**
     * 分桶键，为空时使用目标 ID
     */
    private String bucketKey;

    /**
     * DEVELOPMENT / STAGING / PRODUCTION，为空时为 PRODUCTION
     */
    private String environment;

    public TargetRequest() {
    }

    public TargetRequest(String id, String bucketKey, String environment) {
        this.id = id;
        this.bucketKey = bucketKey;
        this.environment = environment;
    }

    public static TargetRequest of(String id) {
        return new TargetRequest(id, null, null);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getBucketKey() {
        return bucketKey;
    }

    public void setBucketKey(String bucketKey) {
        this.bucketKey = bucketKey;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }
}
