package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.CandidateQueue;

import java.util.List;
import java.util.Optional;

/**
 * Fair Queue Selection Strategy (Output Port)
 * 마스터 큐에 등록된 큐 중 다음에 서비스할 큐를 선택
 */
public interface FairQueueSelectionStrategy {

    /**
     * 다음에 서비스할 큐 하나
     *
     * @return ready 메시지와 동시성 여유가 모두 있는 큐가 없으면 empty
     */
    Optional<CandidateQueue> chooseQueue(String masterQueue, String consumerId, int maxCount);

    /**
     * 서비스 순서대로 정렬된 적격 큐 목록
     * 가득 찬 큐는 제외됩니다.
     */
    List<CandidateQueue> distributeQueues(String masterQueue, String consumerId, int maxCount);

    /**
     * 큐에서 실제로 꺼낸 메시지 수를 반영 (테넌트 pass 증가)
     */
    void recordDequeued(String masterQueue, CandidateQueue queue, int count);
}
