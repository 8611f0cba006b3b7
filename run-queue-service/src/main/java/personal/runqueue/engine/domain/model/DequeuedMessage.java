package personal.runqueue.engine.domain.model;

/**
 * dequeue 결과 엔벨로프
 *
 * @param messageId 메시지 ID
 * @param queueKey  메시지를 꺼낸 큐의 Redis 키
 * @param score     ready 큐에서의 점수 (사용 가능 시각, epoch ms)
 * @param message   현재 attempt를 포함한 메시지 본문
 */
public record DequeuedMessage(
        String messageId,
        String queueKey,
        long score,
        QueueMessage message
) {
}
