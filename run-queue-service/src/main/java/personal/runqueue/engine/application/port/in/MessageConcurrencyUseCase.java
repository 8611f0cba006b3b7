package personal.runqueue.engine.application.port.in;

/**
 * 메시지 단위 동시성 예약 조정 UseCase
 * 실행 중인 메시지가 대기 상태로 들어가거나 다시 깨어날 때 사용합니다.
 */
public interface MessageConcurrencyUseCase {

    /**
     * 모든 그룹에서 메시지의 예약을 해제합니다. 메시지는 in-flight 상태로 남습니다.
     *
     * @return 메시지가 존재했으면 true
     */
    boolean releaseAllConcurrency(String orgId, String messageId);

    /**
     * 환경 그룹에서만 예약을 해제합니다.
     *
     * @return 메시지가 존재했으면 true
     */
    boolean releaseEnvConcurrency(String orgId, String messageId);

    /**
     * 모든 그룹에 다시 예약합니다. 이미 예약된 그룹은 용량 검사에서 제외됩니다.
     *
     * @return 모든 그룹이 수락하면 true, 하나라도 가득 차면 false (변경 없음)
     * @throws personal.runqueue.engine.domain.exception.MessageNotFoundException 메시지 없음
     */
    boolean reacquireConcurrency(String orgId, String messageId);
}
