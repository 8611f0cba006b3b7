package personal.runqueue.engine.adapter.in.web.dto;

import personal.runqueue.engine.domain.model.EnvironmentType;
import personal.runqueue.engine.domain.model.QueueMessage;

import java.util.List;

/**
 * 메시지 조회 응답 DTO
 */
public record QueueMessageResponse(
        String messageId,
        String orgId,
        String projectId,
        String envId,
        EnvironmentType envType,
        String queue,
        List<String> masterQueues,
        long timestamp,
        int attempt,
        String payload,
        String lastError,
        Long deadLetteredAt
) {
    public static QueueMessageResponse from(QueueMessage message) {
        return new QueueMessageResponse(
                message.messageId(),
                message.orgId(),
                message.projectId(),
                message.environmentId(),
                message.environmentType(),
                message.queue(),
                message.masterQueues(),
                message.timestamp(),
                message.attempt(),
                message.payload(),
                message.lastError(),
                message.deadLetteredAt());
    }
}
