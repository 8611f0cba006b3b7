package personal.runqueue.engine.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.application.port.out.RunQueueRepository;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.RateLimitSettings;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis Run Queue 어댑터
 *
 * 구조:
 * - 메시지 본문: STRING (JSON)
 * - 큐 / 환경 ready: ZSET (member=messageId, score=사용 가능 시각)
 * - 데드 레터: ZSET (score=데드 레터 시각)
 * - 마스터 큐: ZSET (member=큐 키, score=큐의 가장 오래된 메시지 시각)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisRunQueueAdapter implements RunQueueRepository {

    private final RedisTemplate<String, String> redisTemplate;
    private final KeyProducer keyProducer;
    private final RedisLuaScriptExecutor luaScriptExecutor;
    private final RedisMessageConverter messageConverter;

    @Override
    public void enqueue(QueueMessage message, long score, List<String> activeSetKeys) {
        luaScriptExecutor.executeEnqueue(
                keyProducer.messageKey(message.orgId(), message.messageId()),
                keyProducer.queueKey(message.queueDescriptor()),
                keyProducer.envQueueKey(message.orgId(), message.environmentId()),
                deadLetterKeyOf(message),
                activeSetKeys,
                masterQueueKeysOf(message),
                message.messageId(),
                messageConverter.toJson(message),
                score);
    }

    @Override
    public Map<String, Long> peekReady(String queueKey, long maxScore, int limit) {
        Set<ZSetOperations.TypedTuple<String>> tuples = redisTemplate.opsForZSet()
                .rangeByScoreWithScores(queueKey, Double.NEGATIVE_INFINITY, maxScore, 0, limit);

        Map<String, Long> ready = new LinkedHashMap<>();
        if (tuples == null) {
            return ready;
        }
        for (ZSetOperations.TypedTuple<String> tuple : tuples) {
            ready.put(tuple.getValue(), tuple.getScore() != null ? tuple.getScore().longValue() : 0L);
        }
        return ready;
    }

    @Override
    public Optional<QueueMessage> readMessage(String orgId, String messageId) {
        var messageKey = keyProducer.messageKey(orgId, messageId);
        var json = redisTemplate.opsForValue().get(messageKey);

        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(messageConverter.toMessage(messageKey, json));
    }

    @Override
    public void acknowledge(QueueMessage message, List<String> activeSetKeys) {
        luaScriptExecutor.executeAcknowledge(
                keyProducer.messageKey(message.orgId(), message.messageId()),
                keyProducer.queueKey(message.queueDescriptor()),
                keyProducer.envQueueKey(message.orgId(), message.environmentId()),
                deadLetterKeyOf(message),
                activeSetKeys,
                masterQueueKeysOf(message),
                message.messageId());
    }

    @Override
    public boolean requeue(QueueMessage message, long retryAt, List<String> activeSetKeys) {
        return luaScriptExecutor.executeNack(
                keyProducer.messageKey(message.orgId(), message.messageId()),
                keyProducer.queueKey(message.queueDescriptor()),
                keyProducer.envQueueKey(message.orgId(), message.environmentId()),
                activeSetKeys,
                masterQueueKeysOf(message),
                message.messageId(),
                messageConverter.toJson(message),
                retryAt);
    }

    @Override
    public boolean moveToDeadLetter(QueueMessage message, List<String> activeSetKeys) {
        return luaScriptExecutor.executeMoveToDeadLetter(
                keyProducer.messageKey(message.orgId(), message.messageId()),
                keyProducer.queueKey(message.queueDescriptor()),
                keyProducer.envQueueKey(message.orgId(), message.environmentId()),
                deadLetterKeyOf(message),
                activeSetKeys,
                masterQueueKeysOf(message),
                message.messageId(),
                messageConverter.toJson(message),
                message.deadLetteredAt());
    }

    @Override
    public void rebalanceMasterQueues(QueueMessage message) {
        luaScriptExecutor.executeRebalanceMasterQueues(
                keyProducer.queueKey(message.queueDescriptor()),
                masterQueueKeysOf(message));
    }

    @Override
    public void rebalanceMasterQueue(String queueKey, String masterQueue) {
        luaScriptExecutor.executeRebalanceMasterQueues(queueKey, List.of(keyProducer.masterQueueKey(masterQueue)));
    }

    @Override
    public long lengthOfQueue(QueueDescriptor descriptor) {
        return zcard(keyProducer.queueKey(descriptor));
    }

    @Override
    public long lengthOfEnvQueue(String orgId, String envId) {
        return zcard(keyProducer.envQueueKey(orgId, envId));
    }

    @Override
    public long lengthOfDeadLetterQueue(String orgId, String projectId, String envId) {
        return zcard(keyProducer.deadLetterQueueKey(orgId, projectId, envId));
    }

    @Override
    public Optional<Long> oldestMessageScore(QueueDescriptor descriptor) {
        Set<ZSetOperations.TypedTuple<String>> oldest = redisTemplate.opsForZSet()
                .rangeWithScores(keyProducer.queueKey(descriptor), 0, 0);

        if (oldest == null || oldest.isEmpty()) {
            return Optional.empty();
        }
        Double score = oldest.iterator().next().getScore();
        return Optional.ofNullable(score).map(Double::longValue);
    }

    @Override
    public boolean isInDeadLetterQueue(QueueMessage message) {
        Double score = redisTemplate.opsForZSet().score(deadLetterKeyOf(message), message.messageId());
        return score != null;
    }

    @Override
    public Optional<RateLimitSettings> getQueueRateLimit(QueueDescriptor descriptor) {
        var configKey = keyProducer.queueRateLimitConfigKey(descriptor);
        Map<Object, Object> hash = redisTemplate.opsForHash().entries(configKey);

        if (hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(messageConverter.toRateLimitSettings(configKey, hash));
    }

    @Override
    public void setQueueRateLimit(QueueDescriptor descriptor, RateLimitSettings settings) {
        var configKey = keyProducer.queueRateLimitConfigKey(descriptor);
        redisTemplate.opsForHash().putAll(configKey, messageConverter.toHash(settings));

        log.debug("Queue rate limit stored: configKey={}, settings={}", configKey, settings);
    }

    @Override
    public void removeQueueRateLimit(QueueDescriptor descriptor) {
        redisTemplate.delete(keyProducer.queueRateLimitConfigKey(descriptor));
    }

    private long zcard(String key) {
        Long size = redisTemplate.opsForZSet().zCard(key);
        return size != null ? size : 0L;
    }

    private String deadLetterKeyOf(QueueMessage message) {
        return keyProducer.deadLetterQueueKey(message.orgId(), message.projectId(), message.environmentId());
    }

    private List<String> masterQueueKeysOf(QueueMessage message) {
        return message.masterQueues().stream()
                .map(keyProducer::masterQueueKey)
                .toList();
    }
}
