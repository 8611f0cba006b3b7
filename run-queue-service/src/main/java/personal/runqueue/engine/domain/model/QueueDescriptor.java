package personal.runqueue.engine.domain.model;

/**
 * 큐 식별 정보
 * 큐 키에서 역으로 복원할 수 있는 정보만 담습니다 (환경 유형은 포함하지 않음).
 */
public record QueueDescriptor(
        String orgId,
        String projectId,
        String envId,
        String queue
) {
}
