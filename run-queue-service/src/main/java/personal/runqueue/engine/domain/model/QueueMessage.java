package personal.runqueue.engine.domain.model;

import java.util.List;

/**
 * 런 큐 메시지 (Value Object)
 * Redis의 메시지 키에 JSON으로 저장되는 불변 객체
 *
 * payload는 해석하지 않는 불투명 문자열입니다.
 */
public record QueueMessage(
        String messageId,
        String queue,
        String orgId,
        String projectId,
        String environmentId,
        EnvironmentType environmentType,
        List<String> masterQueues,
        long timestamp,
        int attempt,
        String payload,
        String lastError,
        Long deadLetteredAt) {

    private static final int INITIAL_ATTEMPT = 0;

    public QueueMessage {
        masterQueues = masterQueues == null ? List.of() : List.copyOf(masterQueues);
    }

    /**
     * 신규 메시지 생성 (attempt = 0)
     */
    public static QueueMessage create(
            EnvironmentDescriptor env,
            String queue,
            String messageId,
            String payload,
            List<String> masterQueues,
            long timestamp) {
        return new QueueMessage(
                messageId,
                queue,
                env.orgId(),
                env.projectId(),
                env.envId(),
                env.envType(),
                masterQueues,
                timestamp,
                INITIAL_ATTEMPT,
                payload,
                null,
                null);
    }

    public EnvironmentDescriptor environment() {
        return new EnvironmentDescriptor(orgId, projectId, environmentId, environmentType);
    }

    public QueueDescriptor queueDescriptor() {
        return new QueueDescriptor(orgId, projectId, environmentId, queue);
    }

    /**
     * 다음 시도 횟수가 재시도 한도에 도달했는지 확인
     */
    public boolean exhaustsRetriesOnNextAttempt(int maxAttempts) {
        return attempt + 1 >= maxAttempts;
    }

    /**
     * nack 이후의 메시지 (attempt + 1)
     *
     * @param error 실패 사유 (없으면 기존 값 유지)
     */
    public QueueMessage nextAttempt(String error) {
        return new QueueMessage(
                messageId, queue, orgId, projectId, environmentId, environmentType, masterQueues,
                timestamp, attempt + 1, payload, error != null ? error : lastError, null);
    }

    /**
     * attempt를 올리지 않고 실패 사유만 기록 (retryAt 지정 nack 등)
     */
    public QueueMessage withError(String error) {
        return new QueueMessage(
                messageId, queue, orgId, projectId, environmentId, environmentType, masterQueues,
                timestamp, attempt, payload, error != null ? error : lastError, null);
    }

    /**
     * 데드 레터 처리된 메시지
     */
    public QueueMessage deadLettered(long deadLetteredAt) {
        return new QueueMessage(
                messageId, queue, orgId, projectId, environmentId, environmentType, masterQueues,
                timestamp, attempt, payload, lastError, deadLetteredAt);
    }

    /**
     * 운영자 redrive: 시도 횟수와 데드 레터 정보 초기화
     */
    public QueueMessage redriven(long now) {
        return new QueueMessage(
                messageId, queue, orgId, projectId, environmentId, environmentType, masterQueues,
                now, INITIAL_ATTEMPT, payload, lastError, null);
    }

    public boolean wasDeadLettered() {
        return deadLetteredAt != null;
    }
}
