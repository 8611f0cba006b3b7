package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.RateLimitSettings;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run Queue Repository (Output Port)
 * 메시지 상태 전이를 원자적으로 수행하는 Redis 저장소 인터페이스
 *
 * activeSetKeys는 ConcurrencyManager가 계산한 그룹 active set 키 목록입니다.
 */
public interface RunQueueRepository {

    /**
     * 메시지를 저장하고 ready 구조와 마스터 큐에 등록
     * 이전 예약과 데드 레터 항목은 제거됩니다.
     *
     * @param message 메시지
     * @param score   ready 점수 (사용 가능 시각, epoch ms)
     */
    void enqueue(QueueMessage message, long score, List<String> activeSetKeys);

    /**
     * 점수가 maxScore 이하인 ready 메시지 ID를 오래된 순으로 조회
     *
     * @return messageId → score (삽입 순서 유지)
     */
    Map<String, Long> peekReady(String queueKey, long maxScore, int limit);

    Optional<QueueMessage> readMessage(String orgId, String messageId);

    /**
     * 메시지를 모든 구조에서 삭제하고 예약 해제
     */
    void acknowledge(QueueMessage message, List<String> activeSetKeys);

    /**
     * 예약 해제 후 retryAt 점수로 ready에 재등록
     *
     * @return 그 사이 메시지가 삭제되었다면 false
     */
    boolean requeue(QueueMessage message, long retryAt, List<String> activeSetKeys);

    /**
     * 예약 해제 후 데드 레터로 이동
     *
     * @return 그 사이 메시지가 삭제되었다면 false
     */
    boolean moveToDeadLetter(QueueMessage message, List<String> activeSetKeys);

    /**
     * 메시지가 속한 마스터 큐들의 점수를 큐의 가장 오래된 메시지로 갱신
     */
    void rebalanceMasterQueues(QueueMessage message);

    /**
     * 하나의 마스터 큐에 대해 큐 점수를 맞춤 (메시지 없이 큐 키만 알 때)
     */
    void rebalanceMasterQueue(String queueKey, String masterQueue);

    long lengthOfQueue(QueueDescriptor descriptor);

    long lengthOfEnvQueue(String orgId, String envId);

    long lengthOfDeadLetterQueue(String orgId, String projectId, String envId);

    /**
     * 큐에서 가장 오래된 ready 메시지의 점수
     */
    Optional<Long> oldestMessageScore(QueueDescriptor descriptor);

    boolean isInDeadLetterQueue(QueueMessage message);

    Optional<RateLimitSettings> getQueueRateLimit(QueueDescriptor descriptor);

    void setQueueRateLimit(QueueDescriptor descriptor, RateLimitSettings settings);

    void removeQueueRateLimit(QueueDescriptor descriptor);
}
