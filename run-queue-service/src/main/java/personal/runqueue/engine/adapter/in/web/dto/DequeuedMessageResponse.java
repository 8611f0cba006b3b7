package personal.runqueue.engine.adapter.in.web.dto;

import personal.runqueue.engine.domain.model.DequeuedMessage;

/**
 * dequeue된 메시지 응답 DTO
 */
public record DequeuedMessageResponse(
        String messageId,
        String queueKey,
        long score,
        QueueMessageResponse message
) {
    public static DequeuedMessageResponse from(DequeuedMessage dequeued) {
        return new DequeuedMessageResponse(
                dequeued.messageId(),
                dequeued.queueKey(),
                dequeued.score(),
                QueueMessageResponse.from(dequeued.message()));
    }
}
