package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * quit() 이후 호출된 연산
 */
public class RunQueueClosedException extends BusinessException {

    public RunQueueClosedException(String operation) {
        super(ErrorCode.RUN_QUEUE_CLOSED,
                String.format("Run queue is closed: operation=%s", operation));
    }
}
