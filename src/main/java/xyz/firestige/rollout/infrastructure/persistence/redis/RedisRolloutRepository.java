package xyz.firestige.rollout.infrastructure.persistence.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutSnapshot;
import xyz.firestige.rollout.domain.shared.exception.ErrorType;
import xyz.firestige.rollout.domain.shared.exception.RolloutException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.shared.vo.SubjectId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rollout 仓储 Redis 实现
 * <p>
 * Key 布局：
 * <pre>
 * {namespace}:rollout:{rolloutId}          → 快照 JSON（终态后设置保留期 TTL）
 * {namespace}:index:subject:{subjectId}    → 活跃 rolloutId
 * {namespace}:active                       → 活跃 rolloutId 集合（重启恢复使用）
 * </pre>
 */
public class RedisRolloutRepository implements RolloutRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisRolloutRepository.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final Duration retention;

    public RedisRolloutRepository(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper,
                                  String namespace, Duration retention) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        this.retention = retention;
    }

    @Override
    public void save(RolloutSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        String id = snapshot.rolloutId().getValue();
        String json = write(snapshot);
        String indexKey = subjectKey(snapshot.subjectId());

        if (snapshot.isTerminal()) {
            redisTemplate.opsForValue().set(rolloutKey(id), json, retention);
            redisTemplate.opsForSet().remove(activeKey(), id);
            if (id.equals(redisTemplate.opsForValue().get(indexKey))) {
                redisTemplate.delete(indexKey);
            }
        } else {
            redisTemplate.opsForValue().set(rolloutKey(id), json);
            redisTemplate.opsForSet().add(activeKey(), id);
            redisTemplate.opsForValue().set(indexKey, id);
        }
    }

    @Override
    public Optional<RolloutSnapshot> findById(RolloutId rolloutId) {
        if (rolloutId == null) {
            return Optional.empty();
        }
        String json = redisTemplate.opsForValue().get(rolloutKey(rolloutId.getValue()));
        return Optional.ofNullable(json).map(this::read);
    }

    @Override
    public Optional<RolloutSnapshot> findActiveBySubject(SubjectId subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        String id = redisTemplate.opsForValue().get(subjectKey(subjectId));
        if (id == null) {
            return Optional.empty();
        }
        return findById(RolloutId.of(id)).filter(s -> !s.isTerminal());
    }

    @Override
    public List<RolloutSnapshot> findAllActive() {
        Set<String> ids = redisTemplate.opsForSet().members(activeKey());
        List<RolloutSnapshot> result = new ArrayList<>();
        if (ids == null) {
            return result;
        }
        for (String id : ids) {
            Optional<RolloutSnapshot> snapshot = findById(RolloutId.of(id));
            if (snapshot.isPresent() && !snapshot.get().isTerminal()) {
                result.add(snapshot.get());
            } else {
                log.warn("活跃索引中的 Rollout 已不存在或已结束，清理索引: {}", id);
                redisTemplate.opsForSet().remove(activeKey(), id);
            }
        }
        return result;
    }

    @Override
    public void remove(RolloutId rolloutId) {
        if (rolloutId == null) {
            return;
        }
        findById(rolloutId).ifPresent(s -> {
            String indexKey = subjectKey(s.subjectId());
            if (rolloutId.getValue().equals(redisTemplate.opsForValue().get(indexKey))) {
                redisTemplate.delete(indexKey);
            }
        });
        redisTemplate.opsForSet().remove(activeKey(), rolloutId.getValue());
        redisTemplate.delete(rolloutKey(rolloutId.getValue()));
    }

    private String write(RolloutSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(RolloutDocument.from(snapshot));
        } catch (JsonProcessingException e) {
            throw new RolloutException(ErrorType.SYSTEM_ERROR,
                    "Rollout 序列化失败: " + snapshot.rolloutId().getValue(), e);
        }
    }

    private RolloutSnapshot read(String json) {
        try {
            return objectMapper.readValue(json, RolloutDocument.class).toSnapshot();
        } catch (JsonProcessingException e) {
            throw new RolloutException(ErrorType.SYSTEM_ERROR, "Rollout 反序列化失败", e);
        }
    }

    private String rolloutKey(String rolloutId) {
        return namespace + ":rollout:" + rolloutId;
    }

    private String subjectKey(SubjectId subjectId) {
        return namespace + ":index:subject:" + subjectId.getValue();
    }

    private String activeKey() {
        return namespace + ":active";
    }
}
