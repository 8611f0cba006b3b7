package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.ConcurrencyCheckResult;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.ConcurrencyState;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.ReservationResult;

import java.util.List;

/**
 * Concurrency Manager (Output Port)
 * 설정된 모든 동시성 그룹에 걸친 in-flight 슬롯 예약/해제
 *
 * 불변식은 reserve 계열 스크립트만 강제합니다. 조회 메서드는 판단 근거로 사용하지 않습니다.
 */
public interface ConcurrencyManager {

    /**
     * 설정된 순서대로 그룹을 평가해 처음으로 가득 찬 그룹을 반환
     */
    ConcurrencyCheckResult canProcess(QueueDescriptor descriptor);

    /**
     * 모든 그룹의 active set에 메시지를 추가 (all-or-nothing)
     *
     * @return 모든 그룹이 수락하면 true, 하나라도 가득 차면 false (변경 없음)
     */
    boolean reserve(QueueDescriptor descriptor, String messageId);

    /**
     * ready 상태 확인 + 용량 확인 + 예약 + ready 구조에서 제거를 하나의 스크립트로 수행
     *
     * @param readyKeys 메시지를 제거할 ready 정렬 집합 (첫 번째 키로 ready 여부 판단)
     * @param maxScore  이 점수 이하인 메시지만 점유 (현재 시각)
     */
    ReservationResult reserveFromReady(QueueDescriptor descriptor, String messageId,
                                       List<String> readyKeys, long maxScore);

    /**
     * 모든 그룹의 active set에서 메시지 제거 (멱등)
     */
    void release(QueueDescriptor descriptor, String messageId);

    /**
     * 한 그룹의 active set에서만 메시지 제거 (멱등)
     */
    void releaseGroup(ConcurrencyGroup group, QueueDescriptor descriptor, String messageId);

    long getCurrentConcurrency(String groupName, String groupId);

    long getConcurrencyLimit(String groupName, String groupId);

    boolean isAtCapacity(String groupName, String groupId);

    ConcurrencyState getState(String groupName, String groupId);

    /**
     * 디스크립터에 해당하는 모든 그룹의 상태 (설정 순서)
     */
    List<ConcurrencyState> getStates(QueueDescriptor descriptor);

    /**
     * 그룹 active set 전체 삭제 (장애 복구용 관리 작업)
     */
    void clearGroup(String groupName, String groupId);

    /**
     * Redis에 제한값 override 저장
     */
    void setConcurrencyLimit(String groupName, String groupId, long limit);

    /**
     * Redis override 제거 (설정 기본값으로 복귀)
     */
    void removeConcurrencyLimit(String groupName, String groupId);

    /**
     * 디스크립터가 속한 모든 그룹의 active set 키 (설정 순서)
     */
    List<String> activeSetKeys(QueueDescriptor descriptor);

    List<ConcurrencyGroup> groups();
}
