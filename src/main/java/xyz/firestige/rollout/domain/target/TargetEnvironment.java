package xyz.firestige.rollout.domain.target;

/**
 * 目标环境，声明顺序即滚动发布的默认顺序
 */
public enum TargetEnvironment {

    DEVELOPMENT("开发"),

    STAGING("预发"),

    PRODUCTION("生产");

    private final String description;

    TargetEnvironment(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
