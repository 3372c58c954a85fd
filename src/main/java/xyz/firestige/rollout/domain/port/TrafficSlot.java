package xyz.firestige.rollout.domain.port;

/**
 * 蓝绿发布的流量槽位
 */
public enum TrafficSlot {

    /**
     * 旧版本
     */
    BLUE,

    /**
     * 新版本
     */
    GREEN
}
