package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * 데드 레터 큐에 없는 메시지를 redrive하려 할 때 발생하는 예외
 */
public class MessageNotInDeadLetterException extends BusinessException {

    public MessageNotInDeadLetterException(String orgId, String messageId) {
        super(ErrorCode.MESSAGE_NOT_IN_DEAD_LETTER,
                String.format("Message is not dead-lettered: orgId=%s, messageId=%s", orgId, messageId));
    }
}
