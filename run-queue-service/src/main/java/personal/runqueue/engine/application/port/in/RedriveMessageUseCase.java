package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.QueueMessage;

/**
 * 데드 레터 메시지 redrive UseCase (운영자 작업)
 */
public interface RedriveMessageUseCase {

    /**
     * attempt를 초기화하고 원래 큐에 다시 등록합니다.
     *
     * @throws personal.runqueue.engine.domain.exception.MessageNotFoundException        메시지 없음
     * @throws personal.runqueue.engine.domain.exception.MessageNotInDeadLetterException 데드 레터 상태가 아님
     */
    QueueMessage redrive(String orgId, String messageId);
}
