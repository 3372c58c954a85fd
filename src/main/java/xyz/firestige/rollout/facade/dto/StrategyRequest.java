package xyz.firestige.rollout.facade.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import xyz.firestige.rollout.domain.strategy.StrategyType;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 发布策略（外部 DTO）
 * <p>
 * 按 type 读取对应字段，未设置的字段使用策略默认值
 */
public class StrategyRequest {

    @NotNull(message = "策略类型不能为空")
    private StrategyType type;

    // 通用
    @DecimalMin(value = "0.0", message = "successRateMin 不能小于 0")
    @DecimalMax(value = "1.0", message = "successRateMin 不能大于 1")
    private Double successRateMin;
    private Map<String, Double> metricMaxima;
    private Boolean abortOnAnyTargetFailure;
    @Min(value = 0, message = "maxConcurrency 不能为负数")
    private Integer maxConcurrency;

    // 直接发布
    private Boolean skipHealthChecks;

    // 金丝雀
    @Min(value = 1, message = "initialPercentage 必须在 1-100 之间")
    @Max(value = 100, message = "initialPercentage 必须在 1-100 之间")
    private Integer initialPercentage;
    @Min(value = 1, message = "incrementPercentage 必须在 1-100 之间")
    @Max(value = 100, message = "incrementPercentage 必须在 1-100 之间")
    private Integer incrementPercentage;
    private Duration evaluationWindow;

    // 滚动
    private List<String> order;
    @Min(value = 1, message = "batchSize 至少为 1")
    private Integer batchSize;
    private Duration pauseBetweenStages;

    // 蓝绿
    private Duration validationPeriod;
    private Duration postSwitchMonitoringPeriod;
    private Duration retentionPeriod;

    public StrategyRequest() {
    }

    public StrategyRequest(StrategyType type) {
        this.type = type;
    }

    public StrategyType getType() {
        return type;
    }

    public void setType(StrategyType type) {
        this.type = type;
    }

    public Double getSuccessRateMin() {
        return successRateMin;
    }

    public void setSuccessRateMin(Double successRateMin) {
        this.successRateMin = successRateMin;
    }

    public Map<String, Double> getMetricMaxima() {
        return metricMaxima;
    }

    public void setMetricMaxima(Map<String, Double> metricMaxima) {
        this.metricMaxima = metricMaxima;
    }

    public Boolean getAbortOnAnyTargetFailure() {
        return abortOnAnyTargetFailure;
    }

    public void setAbortOnAnyTargetFailure(Boolean abortOnAnyTargetFailure) {
        this.abortOnAnyTargetFailure = abortOnAnyTargetFailure;
    }

    public Integer getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(Integer maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Boolean getSkipHealthChecks() {
        return skipHealthChecks;
    }

    public void setSkipHealthChecks(Boolean skipHealthChecks) {
        this.skipHealthChecks = skipHealthChecks;
    }

    public Integer getInitialPercentage() {
        return initialPercentage;
    }

    public void setInitialPercentage(Integer initialPercentage) {
        this.initialPercentage = initialPercentage;
    }

    public Integer getIncrementPercentage() {
        return incrementPercentage;
    }

    public void setIncrementPercentage(Integer incrementPercentage) {
        this.incrementPercentage = incrementPercentage;
    }

    public Duration getEvaluationWindow() {
        return evaluationWindow;
    }

    public void setEvaluationWindow(Duration evaluationWindow) {
        this.evaluationWindow = evaluationWindow;
    }

    public List<String> getOrder() {
        return order;
    }

    public void setOrder(List<String> order) {
        this.order = order;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getPauseBetweenStages() {
        return pauseBetweenStages;
    }

    public void setPauseBetweenStages(Duration pauseBetweenStages) {
        this.pauseBetweenStages = pauseBetweenStages;
    }

    public Duration getValidationPeriod() {
        return validationPeriod;
    }

    public void setValidationPeriod(Duration validationPeriod) {
        this.validationPeriod = validationPeriod;
    }

    public Duration getPostSwitchMonitoringPeriod() {
        return postSwitchMonitoringPeriod;
    }

    public void setPostSwitchMonitoringPeriod(Duration postSwitchMonitoringPeriod) {
        this.postSwitchMonitoringPeriod = postSwitchMonitoringPeriod;
    }

    public Duration getRetentionPeriod() {
        return retentionPeriod;
    }

    public void setRetentionPeriod(Duration retentionPeriod) {
        this.retentionPeriod = retentionPeriod;
    }
}
