package personal.runqueue.engine.adapter.out.redis;

import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.config.RunQueueProperties;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.domain.exception.InvalidQueueKeyException;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.QueueDescriptor;

/**
 * Redis Key 생성기
 *
 * Convention: {prefix}:{kind}:{ids...}
 * - 모든 키는 설정된 prefix로 시작하여 여러 배포가 하나의 Redis를 공유할 수 있음
 * - clusterHashTag가 켜지면 prefix 자체가 Hash Tag가 되어 모든 키가 같은 슬롯에 저장됨
 *   (멀티 키 Lua Script가 Redis Cluster에서도 동작)
 *
 * 키 종류:
 * - org:{orgId}:proj:{projectId}:env:{envId}:queue:{queue}   큐 ready 집합
 * - org:{orgId}:proj:{projectId}:env:{envId}:deadLetter      데드 레터 집합
 * - org:{orgId}:env:{envId}                                  환경 ready 집합
 * - org:{orgId}:message:{messageId}                          메시지 본문
 * - masterQueue:{name} / masterQueuePass:{name}
 * - concurrency:{group}:{groupId}:current / :limit
 * - ratelimit:{limiter}:{identifier}
 * - queueRateLimit:{queue key 본문}
 * - workerQueue:{workerId}
 */
@Component
public class RedisKeyProducer implements KeyProducer {

    private static final String SEPARATOR = ":";

    private static final String QUEUE_FORMAT = "org:%s:proj:%s:env:%s:queue:%s";
    private static final String DEAD_LETTER_FORMAT = "org:%s:proj:%s:env:%s:deadLetter";
    private static final String ENV_QUEUE_FORMAT = "org:%s:env:%s";
    private static final String MESSAGE_FORMAT = "org:%s:message:%s";
    private static final String MASTER_QUEUE_FORMAT = "masterQueue:%s";
    private static final String PASS_FORMAT = "masterQueuePass:%s";
    private static final String CONCURRENCY_SET_FORMAT = "concurrency:%s:%s:current";
    private static final String CONCURRENCY_LIMIT_FORMAT = "concurrency:%s:%s:limit";
    private static final String RATE_LIMIT_FORMAT = "ratelimit:%s:%s";
    private static final String QUEUE_RATE_LIMIT_FORMAT = "queueRateLimit:%s";
    private static final String WORKER_QUEUE_FORMAT = "workerQueue:%s";

    private static final int QUEUE_KEY_SEGMENTS = 8;

    private final String prefix;

    public RedisKeyProducer(RunQueueProperties properties) {
        this(properties.keyPrefix(), properties.clusterHashTag());
    }

    public RedisKeyProducer(String keyPrefix, boolean clusterHashTag) {
        String namespace = requireName("keyPrefix", keyPrefix);
        this.prefix = clusterHashTag ? "{" + namespace + "}" + SEPARATOR : namespace + SEPARATOR;
    }

    @Override
    public String queueKey(QueueDescriptor descriptor) {
        return key(String.format(QUEUE_FORMAT,
                requireSegment("orgId", descriptor.orgId()),
                requireSegment("projectId", descriptor.projectId()),
                requireSegment("envId", descriptor.envId()),
                requireSegment("queue", descriptor.queue())));
    }

    @Override
    public String envQueueKey(String orgId, String envId) {
        return key(String.format(ENV_QUEUE_FORMAT,
                requireSegment("orgId", orgId),
                requireSegment("envId", envId)));
    }

    @Override
    public String messageKey(String orgId, String messageId) {
        return key(String.format(MESSAGE_FORMAT,
                requireSegment("orgId", orgId),
                requireSegment("messageId", messageId)));
    }

    @Override
    public String deadLetterQueueKey(String orgId, String projectId, String envId) {
        return key(String.format(DEAD_LETTER_FORMAT,
                requireSegment("orgId", orgId),
                requireSegment("projectId", projectId),
                requireSegment("envId", envId)));
    }

    @Override
    public String masterQueueKey(String masterQueue) {
        return key(String.format(MASTER_QUEUE_FORMAT, requireName("masterQueue", masterQueue)));
    }

    @Override
    public String passKey(String masterQueue) {
        return key(String.format(PASS_FORMAT, requireName("masterQueue", masterQueue)));
    }

    @Override
    public String concurrencySetKey(ConcurrencyGroup group, String groupId) {
        return key(String.format(CONCURRENCY_SET_FORMAT, group.groupName(), requireName("groupId", groupId)));
    }

    @Override
    public String concurrencyLimitKey(ConcurrencyGroup group, String groupId) {
        return key(String.format(CONCURRENCY_LIMIT_FORMAT, group.groupName(), requireName("groupId", groupId)));
    }

    @Override
    public String rateLimitKey(String limiterName, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidQueueKeyException("identifier", identifier);
        }
        return key(String.format(RATE_LIMIT_FORMAT, requireSegment("limiterName", limiterName), identifier));
    }

    @Override
    public String queueRateLimitConfigKey(QueueDescriptor descriptor) {
        return key(String.format(QUEUE_RATE_LIMIT_FORMAT, unprefixed(queueKey(descriptor))));
    }

    @Override
    public String workerQueueKey(String workerId) {
        return key(String.format(WORKER_QUEUE_FORMAT, requireName("workerId", workerId)));
    }

    @Override
    public QueueDescriptor descriptorFromQueueKey(String queueKey) {
        if (queueKey == null || !queueKey.startsWith(prefix)) {
            throw new InvalidQueueKeyException(queueKey);
        }

        String[] parts = unprefixed(queueKey).split(SEPARATOR, -1);
        if (parts.length != QUEUE_KEY_SEGMENTS
                || !"org".equals(parts[0])
                || !"proj".equals(parts[2])
                || !"env".equals(parts[4])
                || !"queue".equals(parts[6])) {
            throw new InvalidQueueKeyException(queueKey);
        }

        return new QueueDescriptor(parts[1], parts[3], parts[5], parts[7]);
    }

    private String key(String body) {
        return prefix + body;
    }

    private String unprefixed(String key) {
        return key.substring(prefix.length());
    }

    /**
     * 파싱되는 키 구간: 구분자와 Hash Tag 문자, 공백을 허용하지 않음
     */
    private static String requireSegment(String component, String value) {
        requireName(component, value);
        if (value.contains(SEPARATOR)) {
            throw new InvalidQueueKeyException(component, value);
        }
        return value;
    }

    /**
     * 키의 마지막 구간: 구분자는 허용, Hash Tag 문자와 공백은 불가
     */
    private static String requireName(String component, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidQueueKeyException(component, value);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '{' || c == '}' || Character.isWhitespace(c)) {
                throw new InvalidQueueKeyException(component, value);
            }
        }
        return value;
    }
}
