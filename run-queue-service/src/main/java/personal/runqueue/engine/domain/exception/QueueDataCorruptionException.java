package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * Redis에 저장된 메시지 데이터를 해석할 수 없을 때 발생하는 예외
 */
public class QueueDataCorruptionException extends BusinessException {

    public QueueDataCorruptionException(String messageKey, Throwable cause) {
        super(ErrorCode.MESSAGE_DATA_CORRUPTED,
                String.format("Failed to parse message data: key=%s", messageKey), cause);
    }
}
