package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * 메시지를 찾을 수 없음
 */
public class MessageNotFoundException extends BusinessException {

    public MessageNotFoundException(String orgId, String messageId) {
        super(ErrorCode.MESSAGE_NOT_FOUND,
                String.format("Message not found: orgId=%s, messageId=%s", orgId, messageId));
    }
}
