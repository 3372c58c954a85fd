package xyz.firestige.rollout.domain.health;

/**
 * 健康门禁判定结果
 */
public record HealthVerdict(boolean passed, String reason) {

    private static final HealthVerdict PASS = new HealthVerdict(true, null);

    public static HealthVerdict pass() {
        return PASS;
    }

    public static HealthVerdict fail(String reason) {
        return new HealthVerdict(false, reason);
    }
}
