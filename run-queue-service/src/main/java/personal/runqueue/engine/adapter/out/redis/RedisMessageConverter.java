package personal.runqueue.engine.adapter.out.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.domain.exception.QueueDataCorruptionException;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.RateLimitSettings;
import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis 데이터와 도메인 객체 간의 변환을 담당하는 컨버터
 * - 메시지 JSON ↔ QueueMessage
 * - 큐 속도 제한 Hash ↔ RateLimitSettings
 * - Lua 스크립트의 JSON 결과 → 도메인 값
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisMessageConverter {

    private static final String FIELD_EMISSION_INTERVAL = "emission_interval";
    private static final String FIELD_BURST_TOLERANCE = "burst_tolerance";
    private static final String FIELD_KEY_EXPIRATION = "key_expiration";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException 직렬화할 수 없는 메시지
     */
    public String toJson(QueueMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize message: messageId=" + message.messageId(), e);
        }
    }

    /**
     * 메시지 JSON을 QueueMessage 도메인 객체로 변환합니다.
     *
     * @param messageKey 로그용 메시지 키
     * @param json       저장된 JSON
     * @throws QueueDataCorruptionException JSON 파싱에 실패한 경우
     */
    public QueueMessage toMessage(String messageKey, String json) {
        try {
            return objectMapper.readValue(json, QueueMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Queue message data corruption detected: messageKey={}", messageKey);
            throw new QueueDataCorruptionException(messageKey, e);
        }
    }

    public Map<String, String> toHash(RateLimitSettings settings) {
        return Map.of(
                FIELD_EMISSION_INTERVAL, String.valueOf(settings.emissionIntervalMs()),
                FIELD_BURST_TOLERANCE, String.valueOf(settings.burstToleranceMs()),
                FIELD_KEY_EXPIRATION, String.valueOf(settings.keyExpirationMs()));
    }

    /**
     * @throws QueueDataCorruptionException 숫자로 해석할 수 없는 필드
     */
    public RateLimitSettings toRateLimitSettings(String configKey, Map<Object, Object> hash) {
        try {
            return new RateLimitSettings(
                    Long.parseLong((String) hash.get(FIELD_EMISSION_INTERVAL)),
                    Long.parseLong((String) hash.get(FIELD_BURST_TOLERANCE)),
                    Long.parseLong((String) hash.get(FIELD_KEY_EXPIRATION)));
        } catch (RuntimeException e) {
            log.error("Queue rate limit config corruption detected: configKey={}", configKey);
            throw new QueueDataCorruptionException(configKey, e);
        }
    }

    /**
     * stride pass 동기화 결과 [tenantId, pass, ...]를 순서를 유지한 Map으로 변환합니다.
     *
     * @throws QueueDataCorruptionException JSON 파싱에 실패한 경우
     */
    public Map<String, Double> toPasses(String passKey, String json) {
        Map<String, Double> passes = new LinkedHashMap<>();
        if (json == null) {
            return passes;
        }
        try {
            List<String> flat = objectMapper.readValue(json, STRING_LIST);
            for (int i = 0; i + 1 < flat.size(); i += 2) {
                passes.put(flat.get(i), Double.parseDouble(flat.get(i + 1)));
            }
            return passes;
        } catch (JsonProcessingException | NumberFormatException e) {
            log.error("Stride pass result corruption detected: passKey={}", passKey);
            throw new QueueDataCorruptionException(passKey, e);
        }
    }

    /**
     * @throws QueueDataCorruptionException JSON 파싱에 실패한 경우
     */
    public WorkerQueuePopResult toWorkerQueuePopResult(String workerQueueKey, String json) {
        try {
            return objectMapper.readValue(json, WorkerQueuePopResult.class);
        } catch (JsonProcessingException e) {
            log.error("Worker queue pop result corruption detected: workerQueueKey={}", workerQueueKey);
            throw new QueueDataCorruptionException(workerQueueKey, e);
        }
    }
}
