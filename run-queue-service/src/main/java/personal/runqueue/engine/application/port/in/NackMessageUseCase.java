package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.NackResult;

/**
 * 메시지 처리 실패 UseCase
 */
public interface NackMessageUseCase {

    /**
     * 예약을 해제하고 백오프 후 재등록하거나 데드 레터로 이동합니다.
     */
    NackResult nack(NackMessageCommand command);

    /**
     * @param orgId            조직 ID
     * @param messageId        메시지 ID
     * @param retryAt          재시도 시각 지정 (null이면 백오프 계산)
     * @param error            실패 사유 (선택)
     * @param incrementAttempt false면 attempt를 유지 (retryAt 지정 시에만 의미 있음)
     */
    record NackMessageCommand(
            String orgId,
            String messageId,
            Long retryAt,
            String error,
            boolean incrementAttempt
    ) {
        public static NackMessageCommand of(String orgId, String messageId) {
            return new NackMessageCommand(orgId, messageId, null, null, true);
        }
    }
}
