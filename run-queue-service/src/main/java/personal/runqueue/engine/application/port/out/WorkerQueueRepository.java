package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.List;
import java.util.Optional;

/**
 * Worker Queue Repository (Output Port)
 * 워커별 FIFO 리스트
 */
public interface WorkerQueueRepository {

    long push(String workerId, List<String> entries);

    Optional<WorkerQueuePopResult> pop(String workerId);

    List<String> peek(String workerId);

    long remove(String workerId, String entry);

    void clear(String workerId);

    long length(String workerId);
}
