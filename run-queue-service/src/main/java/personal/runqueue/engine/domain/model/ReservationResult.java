package personal.runqueue.engine.domain.model;

/**
 * Ready 큐에서 메시지를 점유(claim)한 결과
 */
public enum ReservationResult {
    /** 모든 그룹에 예약되고 ready 구조에서 제거됨 */
    RESERVED,
    /** 하나 이상의 그룹이 가득 참, 변경 없음 */
    AT_CAPACITY,
    /** 다른 컨슈머가 먼저 가져갔거나 아직 재시도 시각 전, 변경 없음 */
    NOT_AVAILABLE
}
