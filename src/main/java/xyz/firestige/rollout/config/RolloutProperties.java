package xyz.firestige.rollout.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Rollout 引擎配置
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * rollout:
 *   instance-id: deployer-node-1       # 协调器实例 ID，锁值的一部分；不配置则每个进程随机生成
 *   global-concurrency-ceiling: 16     # 所有 Rollout 共享的外部调用并发上限
 *   pipeline-threads: 4                # 流水线步骤（状态推进、持久化）线程数
 *   deploy-timeout: 5m                 # 单次 apply/route 超时
 *   health-evaluation-timeout: 1m      # 单次健康快照超时
 *   deploy-retry-attempts: 1           # apply 失败后的本地重试次数
 *   rollback-retry-attempts: 3         # 回滚时每个目标的最大尝试次数
 *   retry-backoff: 2s
 *   direct-health-check-window: 30s
 *   lock-ttl: 6h
 *   recovery:
 *     enabled: true                    # 启动时回滚租约已失效的未结束 Rollout
 *     scan-interval: 1m                # 周期重新扫描，0 表示只在启动时扫描
 *   persistence:
 *     store-type: memory               # memory 或 redis
 *     namespace: rollout               # Redis Key 前缀
 *     retention: 7d                    # 终态 Rollout 保留时长
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "rollout")
public class RolloutProperties {

    /**
     * 固定实例 ID 可以让重启后的实例立即接管自己遗留的租约
     */
    private String instanceId;

    @Min(1)
    private int globalConcurrencyCeiling = 16;

    @Min(1)
    private int pipelineThreads = 4;

    @NotNull
    private Duration deployTimeout = Duration.ofMinutes(5);

    @NotNull
    private Duration healthEvaluationTimeout = Duration.ofMinutes(1);

    @Min(0)
    private int deployRetryAttempts = 1;

    @Min(1)
    private int rollbackRetryAttempts = 3;

    @NotNull
    private Duration retryBackoff = Duration.ofSeconds(2);

    @NotNull
    private Duration directHealthCheckWindow = Duration.ofSeconds(30);

    @NotNull
    private Duration lockTtl = Duration.ofHours(6);

    @Valid
    private final Recovery recovery = new Recovery();

    @Valid
    private final Persistence persistence = new Persistence();

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public int getPipelineThreads() {
        return pipelineThreads;
    }

    public void setPipelineThreads(int pipelineThreads) {
        this.pipelineThreads = pipelineThreads;
    }

    public int getGlobalConcurrencyCeiling() {
        return globalConcurrencyCeiling;
    }

    public void setGlobalConcurrencyCeiling(int globalConcurrencyCeiling) {
        this.globalConcurrencyCeiling = globalConcurrencyCeiling;
    }

    public Duration getDeployTimeout() {
        return deployTimeout;
    }

    public void setDeployTimeout(Duration deployTimeout) {
        this.deployTimeout = deployTimeout;
    }

    public Duration getHealthEvaluationTimeout() {
        return healthEvaluationTimeout;
    }

    public void setHealthEvaluationTimeout(Duration healthEvaluationTimeout) {
        this.healthEvaluationTimeout = healthEvaluationTimeout;
    }

    public int getDeployRetryAttempts() {
        return deployRetryAttempts;
    }

    public void setDeployRetryAttempts(int deployRetryAttempts) {
        this.deployRetryAttempts = deployRetryAttempts;
    }

    public int getRollbackRetryAttempts() {
        return rollbackRetryAttempts;
    }

    public void setRollbackRetryAttempts(int rollbackRetryAttempts) {
        this.rollbackRetryAttempts = rollbackRetryAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Duration getDirectHealthCheckWindow() {
        return directHealthCheckWindow;
    }

    public void setDirectHealthCheckWindow(Duration directHealthCheckWindow) {
        this.directHealthCheckWindow = directHealthCheckWindow;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public static class Recovery {

        private boolean enabled = true;

        @NotNull
        private Duration scanInterval = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getScanInterval() {
            return scanInterval;
        }

        public void setScanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
        }
    }

    public static class Persistence {

        /**
         * memory 或 redis
         */
        @NotBlank
        private String storeType = "memory";

        @NotBlank
        private String namespace = "rollout";

        @NotNull
        private Duration retention = Duration.ofDays(7);

        public String getStoreType() {
            return storeType;
        }

        public void setStoreType(String storeType) {
            this.storeType = storeType;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }
}
