package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * 키 구성 요소가 비어 있거나 구분자를 포함할 때 발생하는 예외
 */
public class InvalidQueueKeyException extends BusinessException {

    public InvalidQueueKeyException(String component, String value) {
        super(ErrorCode.INVALID_QUEUE_KEY,
                String.format("Invalid key component: %s=%s", component, value));
    }

    public InvalidQueueKeyException(String key) {
        super(ErrorCode.INVALID_QUEUE_KEY, String.format("Malformed queue key: %s", key));
    }
}
