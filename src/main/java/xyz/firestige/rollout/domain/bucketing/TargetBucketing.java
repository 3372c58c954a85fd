package xyz.firestige.rollout.domain.bucketing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 目标分桶
 * <p>
 * 将稳定键映射到 [0, 100) 的桶号：SHA-256 摘要的前 4 字节按大端无符号整数取模 100。
 * 结果只依赖键本身，跨进程、跨 JVM 一致。
 */
public final class TargetBucketing {

    public static final int BUCKET_COUNT = 100;

    private TargetBucketing() {
    }

    /**
     * 计算桶号
     *
     * @param key 稳定分桶键
     * @return [0, 100) 内的桶号
     */
    public static int bucket(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("分桶键不能为空");
        }
        byte[] digest = sha256().digest(key.getBytes(StandardCharsets.UTF_8));
        long value = ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);
        return (int) (value % BUCKET_COUNT);
    }

    /**
     * 键是否落在给定百分比内：bucket(key) < percentage
     */
    public static boolean isIncluded(String key, int percentage) {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("百分比必须在 [0, 100] 内: " + percentage);
        }
        return bucket(key) < percentage;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // 所有 JDK 实现都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
