package xyz.firestige.rollout.facade.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * 发起 Rollout 请求（外部 DTO）
 */
public class RolloutRequest {

    @NotBlank(message = "subjectId 不能为空")
    private String subjectId;

    @NotBlank(message = "targetVersion 不能为空")
    private String targetVersion;

    @NotNull(message = "previousVersion 不能为空")
    private String previousVersion;

    @NotNull(message = "策略不能为空")
    @Valid
    private StrategyRequest strategy;

    @NotEmpty(message = "目标列表不能为空")
    @Valid
    private List<TargetRequest> targets = new ArrayList<>();

    private boolean autoRollbackEnabled = true;

    public RolloutRequest() {
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public void setTargetVersion(String targetVersion) {
        this.targetVersion = targetVersion;
    }

    public String getPreviousVersion() {
        return previousVersion;
    }

    public void setPreviousVersion(String previousVersion) {
        this.previousVersion = previousVersion;
    }

    public StrategyRequest getStrategy() {
        return strategy;
    }

    public void setStrategy(StrategyRequest strategy) {
        this.strategy = strategy;
    }

    public List<TargetRequest> getTargets() {
        return targets;
    }

    public void setTargets(List<TargetRequest> targets) {
        this.targets = targets;
    }

    public boolean isAutoRollbackEnabled() {
        return autoRollbackEnabled;
    }

    public void setAutoRollbackEnabled(boolean autoRollbackEnabled) {
        this.autoRollbackEnabled = autoRollbackEnabled;
    }
}
