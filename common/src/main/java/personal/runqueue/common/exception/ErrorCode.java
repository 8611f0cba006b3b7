package personal.runqueue.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Run Queue Domain (Rxxx)
    INVALID_QUEUE_KEY(HttpStatus.BAD_REQUEST, "R001", "유효하지 않은 큐 키 구성 요소입니다."),
    UNKNOWN_CONCURRENCY_GROUP(HttpStatus.BAD_REQUEST, "R002", "알 수 없는 동시성 그룹입니다."),
    MESSAGE_NOT_FOUND(HttpStatus.NOT_FOUND, "R003", "메시지를 찾을 수 없습니다."),
    MESSAGE_DATA_CORRUPTED(HttpStatus.INTERNAL_SERVER_ERROR, "R004", "메시지 데이터가 손상되었습니다."),
    RUN_QUEUE_CLOSED(HttpStatus.SERVICE_UNAVAILABLE, "R005", "런 큐가 종료되었습니다."),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "R006", "요청 한도를 초과했습니다."),
    INVALID_CONCURRENCY_LIMIT(HttpStatus.BAD_REQUEST, "R007", "유효하지 않은 동시성 제한 값입니다."),
    MESSAGE_NOT_IN_DEAD_LETTER(HttpStatus.CONFLICT, "R008", "데드 레터 큐에 없는 메시지입니다."),

    // Worker Queue (Wxxx)
    INVALID_WORKER_QUEUE_ENTRY(HttpStatus.BAD_REQUEST, "W001", "유효하지 않은 워커 큐 항목입니다."),

    // Infrastructure (Exxx)
    BACKING_STORE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "저장소 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
