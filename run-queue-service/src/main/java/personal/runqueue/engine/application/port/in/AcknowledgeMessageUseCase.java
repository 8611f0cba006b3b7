package personal.runqueue.engine.application.port.in;

/**
 * 메시지 처리 완료 UseCase
 */
public interface AcknowledgeMessageUseCase {

    /**
     * 예약을 해제하고 메시지를 모든 구조에서 삭제합니다.
     *
     * @return 메시지가 존재했으면 true
     */
    boolean acknowledge(String orgId, String messageId);
}
