package personal.runqueue.engine.domain.model;

/**
 * 환경 식별 정보
 * 메시지가 속한 조직 / 프로젝트 / 환경을 나타냅니다.
 */
public record EnvironmentDescriptor(
        String orgId,
        String projectId,
        String envId,
        EnvironmentType envType
) {
    public QueueDescriptor queue(String queueName) {
        return new QueueDescriptor(orgId, projectId, envId, queueName);
    }
}
