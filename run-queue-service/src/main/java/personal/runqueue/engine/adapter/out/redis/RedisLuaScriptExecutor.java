package personal.runqueue.engine.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.domain.model.RateLimitResult;
import personal.runqueue.engine.domain.model.RateLimitSettings;
import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis Lua 스크립트 실행을 캡슐화하는 실행자
 * 공유 상태를 바꾸는 모든 작업은 하나의 Lua 스크립트로 원자적으로 처리합니다.
 *
 * 저장소 오류(DataAccessException)는 잡지 않고 호출자에게 전파합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisLuaScriptExecutor {

    /** reserve 스크립트 결과: 성공 */
    public static final long RESERVED = 1L;
    /** reserve 스크립트 결과: ready 상태가 아님 (claim 모드) */
    public static final long NOT_AVAILABLE = 0L;

    private static final String PLAIN_RESERVATION = "";

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisMessageConverter messageConverter;
    private final RedisScript<Long> gcraCheckScript;
    private final RedisScript<Long> reserveConcurrencyScript;
    private final RedisScript<Long> releaseConcurrencyScript;
    private final RedisScript<Long> enqueueMessageScript;
    private final RedisScript<Long> acknowledgeMessageScript;
    private final RedisScript<Long> nackMessageScript;
    private final RedisScript<Long> moveToDeadLetterScript;
    private final RedisScript<Long> rebalanceMasterQueuesScript;
    private final RedisScript<String> strideSyncPassesScript;
    private final RedisScript<Long> strideAdvancePassScript;
    private final RedisScript<String> workerQueuePopScript;

    /**
     * GCRA 검사를 수행합니다 (원자적 작업).
     *
     * @param rateLimitKey TAT 키
     * @param nowMs 현재 시각 (epoch ms)
     * @param settings GCRA 설정
     * @return 허용 여부와 재시도 대기 시간
     */
    public RateLimitResult executeGcraCheck(String rateLimitKey, long nowMs, RateLimitSettings settings) {
        Long retryAfter = redisTemplate.execute(
                gcraCheckScript,
                List.of(rateLimitKey),
                String.valueOf(nowMs),
                String.valueOf(settings.emissionIntervalMs()),
                String.valueOf(settings.burstToleranceMs()),
                String.valueOf(settings.keyExpirationMs())
        );

        if (retryAfter == null) {
            throw new IllegalStateException("GCRA script returned no result: key=" + rateLimitKey);
        }

        if (retryAfter == 0L) {
            return RateLimitResult.allow();
        }

        log.debug("Executed gcraCheck script (denied): key={}, retryAfterMs={}", rateLimitKey, retryAfter);
        return RateLimitResult.deny(retryAfter);
    }

    /**
     * 모든 그룹에 메시지를 예약합니다 (원자적 작업).
     *
     * @param activeSetKeys 그룹 active set 키
     * @param limitKeys 그룹 제한값 override 키 (activeSetKeys와 같은 순서)
     * @param defaultLimits override가 없을 때 적용할 제한값
     * @param messageId 메시지 ID
     * @param readyKeys claim 모드에서 제거할 ready 집합 (일반 예약이면 빈 리스트)
     * @param maxScore claim 모드에서 점유 가능한 최대 점수 (일반 예약이면 null)
     * @return 1: 성공, 0: ready 상태가 아님, -i: i번째 그룹이 가득 참
     */
    public long executeReserve(
            List<String> activeSetKeys,
            List<String> limitKeys,
            List<Long> defaultLimits,
            String messageId,
            List<String> readyKeys,
            Long maxScore) {

        List<String> keys = new ArrayList<>(activeSetKeys);
        keys.addAll(limitKeys);
        keys.addAll(readyKeys);

        List<String> args = new ArrayList<>();
        args.add(messageId);
        args.add(String.valueOf(activeSetKeys.size()));
        defaultLimits.forEach(limit -> args.add(String.valueOf(limit)));
        args.add(maxScore == null ? PLAIN_RESERVATION : String.valueOf(maxScore));

        Long result = redisTemplate.execute(reserveConcurrencyScript, keys, args.toArray());

        if (result == null) {
            throw new IllegalStateException("Reserve script returned no result: messageId=" + messageId);
        }

        log.debug("Executed reserveConcurrency script: messageId={}, result={}", messageId, result);
        return result;
    }

    /**
     * 모든 그룹에서 예약을 해제합니다 (원자적 작업, 멱등).
     *
     * @return 제거된 항목 수
     */
    public long executeRelease(List<String> activeSetKeys, String messageId) {
        Long removed = redisTemplate.execute(releaseConcurrencyScript, activeSetKeys, messageId);

        log.debug("Executed releaseConcurrency script: messageId={}, removed={}", messageId, removed);
        return removed != null ? removed : 0L;
    }

    /**
     * 메시지를 저장하고 ready 구조와 마스터 큐에 등록합니다 (원자적 작업).
     *
     * @param messageKey 메시지 키
     * @param queueKey 큐 ready 집합
     * @param envQueueKey 환경 ready 집합
     * @param deadLetterKey 데드 레터 집합
     * @param activeSetKeys 그룹 active set 키
     * @param masterQueueKeys 마스터 큐 키
     * @param messageId 메시지 ID
     * @param messageData 메시지 JSON
     * @param score ready 점수
     */
    public void executeEnqueue(
            String messageKey,
            String queueKey,
            String envQueueKey,
            String deadLetterKey,
            List<String> activeSetKeys,
            List<String> masterQueueKeys,
            String messageId,
            String messageData,
            long score) {

        List<String> keys = new ArrayList<>(List.of(messageKey, queueKey, envQueueKey, deadLetterKey));
        keys.addAll(activeSetKeys);
        keys.addAll(masterQueueKeys);

        redisTemplate.execute(
                enqueueMessageScript,
                keys,
                messageId,
                messageData,
                String.valueOf(score),
                String.valueOf(activeSetKeys.size())
        );

        log.debug("Executed enqueueMessage script: messageId={}, queueKey={}, score={}", messageId, queueKey, score);
    }

    /**
     * 메시지를 모든 구조에서 삭제하고 예약을 해제합니다 (원자적 작업).
     */
    public void executeAcknowledge(
            String messageKey,
            String queueKey,
            String envQueueKey,
            String deadLetterKey,
            List<String> activeSetKeys,
            List<String> masterQueueKeys,
            String messageId) {

        List<String> keys = new ArrayList<>(List.of(messageKey, queueKey, envQueueKey, deadLetterKey));
        keys.addAll(activeSetKeys);
        keys.addAll(masterQueueKeys);

        redisTemplate.execute(
                acknowledgeMessageScript,
                keys,
                messageId,
                String.valueOf(activeSetKeys.size())
        );

        log.debug("Executed acknowledgeMessage script: messageId={}, queueKey={}", messageId, queueKey);
    }

    /**
     * 예약을 해제하고 retryAt 점수로 ready에 재등록합니다 (원자적 작업).
     *
     * @return 성공 여부 (false: 그 사이 메시지가 삭제됨)
     */
    public boolean executeNack(
            String messageKey,
            String queueKey,
            String envQueueKey,
            List<String> activeSetKeys,
            List<String> masterQueueKeys,
            String messageId,
            String messageData,
            long retryAt) {

        List<String> keys = new ArrayList<>(List.of(messageKey, queueKey, envQueueKey));
        keys.addAll(activeSetKeys);
        keys.addAll(masterQueueKeys);

        Long result = redisTemplate.execute(
                nackMessageScript,
                keys,
                messageId,
                messageData,
                String.valueOf(retryAt),
                String.valueOf(activeSetKeys.size())
        );

        boolean success = result != null && result == 1L;
        if (success) {
            log.debug("Executed nackMessage script: messageId={}, retryAt={}", messageId, retryAt);
        } else {
            log.warn("Nack skipped, message no longer exists: messageId={}", messageId);
        }
        return success;
    }

    /**
     * 예약을 해제하고 데드 레터로 이동합니다 (원자적 작업).
     *
     * @return 성공 여부 (false: 그 사이 메시지가 삭제됨)
     */
    public boolean executeMoveToDeadLetter(
            String messageKey,
            String queueKey,
            String envQueueKey,
            String deadLetterKey,
            List<String> activeSetKeys,
            List<String> masterQueueKeys,
            String messageId,
            String messageData,
            long deadLetteredAt) {

        List<String> keys = new ArrayList<>(List.of(messageKey, queueKey, envQueueKey, deadLetterKey));
        keys.addAll(activeSetKeys);
        keys.addAll(masterQueueKeys);

        Long result = redisTemplate.execute(
                moveToDeadLetterScript,
                keys,
                messageId,
                messageData,
                String.valueOf(deadLetteredAt),
                String.valueOf(activeSetKeys.size())
        );

        boolean success = result != null && result == 1L;
        if (success) {
            log.debug("Executed moveToDeadLetter script: messageId={}", messageId);
        } else {
            log.warn("Dead-letter move skipped, message no longer exists: messageId={}", messageId);
        }
        return success;
    }

    /**
     * 마스터 큐 점수를 큐의 가장 오래된 메시지로 맞춥니다 (원자적 작업).
     */
    public void executeRebalanceMasterQueues(String queueKey, List<String> masterQueueKeys) {
        if (masterQueueKeys.isEmpty()) {
            return;
        }

        List<String> keys = new ArrayList<>();
        keys.add(queueKey);
        keys.addAll(masterQueueKeys);

        redisTemplate.execute(rebalanceMasterQueuesScript, keys);
    }

    /**
     * 후보 테넌트의 pass를 정규화하고 반환합니다 (원자적 작업).
     *
     * @param passKey pass 해시 키
     * @param tenants 이번 라운드의 후보 테넌트 ID
     * @return 테넌트 ID → pass (최소값 0)
     */
    public Map<String, Double> executeSyncPasses(String passKey, Collection<String> tenants) {
        String json = redisTemplate.execute(strideSyncPassesScript, List.of(passKey), tenants.toArray());
        return messageConverter.toPasses(passKey, json);
    }

    /**
     * 테넌트 pass를 stride만큼 증가시킵니다 (원자적 작업).
     */
    public void executeAdvancePass(String passKey, String tenantId, double stride) {
        redisTemplate.execute(
                strideAdvancePassScript,
                List.of(passKey),
                tenantId,
                String.valueOf(stride)
        );
    }

    /**
     * 워커 큐 head를 꺼내고 남은 길이를 함께 반환합니다 (원자적 작업).
     */
    public Optional<WorkerQueuePopResult> executeWorkerQueuePop(String workerQueueKey) {
        String json = redisTemplate.execute(workerQueuePopScript, List.of(workerQueueKey));

        if (json == null) {
            return Optional.empty();
        }

        return Optional.of(messageConverter.toWorkerQueuePopResult(workerQueueKey, json));
    }
}
