package xyz.firestige.rollout.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.rollout.config.RolloutProperties;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.infrastructure.lock.SubjectLockManager;
import xyz.firestige.rollout.infrastructure.lock.memory.InMemorySubjectLockManager;
import xyz.firestige.rollout.infrastructure.lock.redis.RedisSubjectLockManager;
import xyz.firestige.rollout.infrastructure.persistence.memory.InMemoryRolloutRepository;
import xyz.firestige.rollout.infrastructure.persistence.redis.RedisRolloutRepository;

/**
 * Rollout 持久化自动配置
 * <p>
 * 职责：
 * - 根据 rollout.persistence.store-type 装配 Redis 或 InMemory 实现
 * - 提供 Rollout 仓储和主体锁的 Bean
 * - 支持条件注入，允许用户自定义实现
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * rollout:
 *   persistence:
 *     store-type: redis  # redis 或 memory，默认 memory
 *     namespace: rollout  # Redis Key 前缀
 *     retention: 7d  # 终态 Rollout 保留时长
 * </pre>
 */
@AutoConfiguration(after = {RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(RolloutProperties.class)
public class RolloutPersistenceAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RolloutPersistenceAutoConfiguration.class);

    // ========== Redis Infrastructure ==========

    @Bean(name = "rolloutRedisTemplate")
    @ConditionalOnClass(RedisConnectionFactory.class)
    @ConditionalOnMissingBean(name = "rolloutRedisTemplate")
    @ConditionalOnProperty(prefix = "rollout.persistence", name = "store-type", havingValue = "redis")
    public RedisTemplate<String, String> rolloutRedisTemplate(RedisConnectionFactory factory) {
        logger.info("[AutoConfig] 创建 Redis Template for Rollout");
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(factory);
        template.afterPropertiesSet();
        return template;
    }

    // ========== Rollout Repository ==========

    @Bean
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnMissingBean(RolloutRepository.class)
    @ConditionalOnProperty(prefix = "rollout.persistence", name = "store-type", havingValue = "redis")
    public RolloutRepository redisRolloutRepository(RedisTemplate<String, String> rolloutRedisTemplate,
                                                    ObjectProvider<ObjectMapper> objectMapperProvider,
                                                    RolloutProperties properties) {
        RolloutProperties.Persistence persistence = properties.getPersistence();
        logger.info("[AutoConfig] 装配 Redis Rollout 仓储, namespace={}, retention={}",
                persistence.getNamespace(), persistence.getRetention());
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(
                () -> new ObjectMapper().findAndRegisterModules());
        return new RedisRolloutRepository(rolloutRedisTemplate, objectMapper, persistence.getNamespace(),
                persistence.getRetention());
    }

    /**
     * 内存 Rollout 仓储（Fallback，重启后无法恢复）
     */
    @Bean
    @ConditionalOnMissingBean(RolloutRepository.class)
    public RolloutRepository inMemoryRolloutRepository() {
        logger.warn("[AutoConfig] 装配 InMemory Rollout 仓储（Fallback）");
        return new InMemoryRolloutRepository();
    }

    // ========== Subject Lock Manager ==========

    /**
     * Redis 主体锁管理器（分布式锁）
     */
    @Bean
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnMissingBean(SubjectLockManager.class)
    @ConditionalOnProperty(prefix = "rollout.persistence", name = "store-type", havingValue = "redis")
    public SubjectLockManager redisSubjectLockManager(RedisTemplate<String, String> rolloutRedisTemplate,
                                                      RolloutProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 主体锁管理器（分布式锁）");
        return new RedisSubjectLockManager(rolloutRedisTemplate, properties.getPersistence().getNamespace());
    }

    /**
     * 内存主体锁管理器（Fallback，仅支持单实例）
     */
    @Bean
    @ConditionalOnMissingBean(SubjectLockManager.class)
    public SubjectLockManager inMemorySubjectLockManager() {
        logger.warn("[AutoConfig] 装配 InMemory 主体锁管理器（Fallback，仅支持单实例）");
        return new InMemorySubjectLockManager();
    }
}
