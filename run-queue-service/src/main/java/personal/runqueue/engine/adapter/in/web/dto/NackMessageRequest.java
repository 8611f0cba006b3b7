package personal.runqueue.engine.adapter.in.web.dto;

import personal.runqueue.engine.application.port.in.NackMessageUseCase.NackMessageCommand;

/**
 * 메시지 nack 요청 DTO (본문 생략 가능)
 *
 * @param retryAt          재시도 시각 (epoch ms, 생략 시 백오프)
 * @param error            실패 사유
 * @param incrementAttempt attempt 증가 여부 (기본 true)
 */
public record NackMessageRequest(
        Long retryAt,
        String error,
        Boolean incrementAttempt
) {
    public NackMessageCommand toCommand(String orgId, String messageId) {
        return new NackMessageCommand(orgId, messageId, retryAt, error,
                incrementAttempt == null || incrementAttempt);
    }
}
