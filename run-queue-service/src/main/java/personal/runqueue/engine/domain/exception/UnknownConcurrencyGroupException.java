package personal.runqueue.engine.domain.exception;

import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;

/**
 * 알 수 없는 동시성 그룹 이름
 */
public class UnknownConcurrencyGroupException extends BusinessException {

    public UnknownConcurrencyGroupException(String groupName) {
        super(ErrorCode.UNKNOWN_CONCURRENCY_GROUP,
                String.format("Unknown concurrency group: groupName=%s", groupName));
    }
}
