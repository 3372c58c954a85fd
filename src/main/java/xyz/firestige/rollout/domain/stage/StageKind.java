package xyz.firestige.rollout.domain.stage;

/**
 * Stage 类型
 */
public enum StageKind {

    /**
     * 向 Stage 内目标应用新版本
     */
    DEPLOY,

    /**
     * 蓝绿切换：将 Stage 内目标的流量切到绿色侧
     */
    SWITCH
}
