package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.DequeuedMessage;

import java.util.List;

/**
 * 마스터 큐에서 메시지를 꺼내는 UseCase
 */
public interface DequeueMessageUseCase {

    /**
     * 공정 선택 + 동시성 예약을 거쳐 최대 maxCount개의 메시지를 점유합니다.
     * 예약에 실패한 메시지는 ready 상태로 남습니다.
     */
    List<DequeuedMessage> dequeue(DequeueMessageCommand command);

    record DequeueMessageCommand(
            String consumerId,
            String masterQueue,
            int maxCount
    ) {
    }
}
