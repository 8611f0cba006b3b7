package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.QueueDescriptor;

/**
 * Key Producer (Output Port)
 * 논리 엔티티를 Redis 키 이름으로 매핑하는 순수 함수 집합
 *
 * 서로 다른 종류의 키는 충돌하지 않으며 프로세스 재시작 후에도 동일한 키를 생성합니다.
 */
public interface KeyProducer {

    /**
     * 큐의 ready 정렬 집합 키
     */
    String queueKey(QueueDescriptor descriptor);

    /**
     * 환경 전체의 ready 정렬 집합 키
     */
    String envQueueKey(String orgId, String envId);

    /**
     * 메시지 본문 키
     */
    String messageKey(String orgId, String messageId);

    /**
     * 환경의 데드 레터 정렬 집합 키
     */
    String deadLetterQueueKey(String orgId, String projectId, String envId);

    /**
     * 마스터 큐 정렬 집합 키 (멤버: 큐 키, 점수: 가장 오래된 메시지)
     */
    String masterQueueKey(String masterQueue);

    /**
     * 마스터 큐의 테넌트별 pass(공정 선택 가상 시간) 해시 키
     */
    String passKey(String masterQueue);

    /**
     * 동시성 그룹 active set 키
     */
    String concurrencySetKey(ConcurrencyGroup group, String groupId);

    /**
     * 동시성 그룹 제한값 override 키
     */
    String concurrencyLimitKey(ConcurrencyGroup group, String groupId);

    /**
     * GCRA TAT 키
     */
    String rateLimitKey(String limiterName, String identifier);

    /**
     * 큐별 GCRA 설정 해시 키
     */
    String queueRateLimitConfigKey(QueueDescriptor descriptor);

    /**
     * 워커 큐 리스트 키
     */
    String workerQueueKey(String workerId);

    /**
     * 큐 키에서 디스크립터 복원
     *
     * @throws personal.runqueue.engine.domain.exception.InvalidQueueKeyException 형식이 맞지 않는 키
     */
    QueueDescriptor descriptorFromQueueKey(String queueKey);
}
