package xyz.firestige.rollout.domain.port;

/**
 * 单个目标的应用/切换结果
 *
 * @param successful 是否成功
 * @param message    失败原因或附加信息
 */
public record DeployResult(boolean successful, String message) {

    private static final DeployResult OK = new DeployResult(true, null);

    public static DeployResult success() {
        return OK;
    }

    public static DeployResult failure(String message) {
        return new DeployResult(false, message);
    }
}
