package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * 음수 등 허용되지 않는 동시성 제한값
 */
public class InvalidConcurrencyLimitException extends BusinessException {

    public InvalidConcurrencyLimitException(String groupName, String groupId, long limit) {
        super(ErrorCode.INVALID_CONCURRENCY_LIMIT,
                String.format("Invalid concurrency limit: group=%s, groupId=%s, limit=%d",
                        groupName, groupId, limit));
    }
}
