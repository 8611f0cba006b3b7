package personal.runqueue.engine.domain.model;

/**
 * 마스터 큐에 등록된 후보 큐
 *
 * @param queueKey    큐의 Redis 키 (마스터 큐 멤버 값)
 * @param descriptor  큐 키에서 복원한 디스크립터
 * @param oldestScore 가장 오래된 ready 메시지의 점수 (epoch ms)
 */
public record CandidateQueue(
        String queueKey,
        QueueDescriptor descriptor,
        long oldestScore
) {
}
