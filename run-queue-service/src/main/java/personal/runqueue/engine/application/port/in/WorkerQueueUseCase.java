package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.List;
import java.util.Optional;

/**
 * 워커 큐 UseCase
 * 이미 승인된 메시지를 특정 워커에게 전달하는 FIFO
 */
public interface WorkerQueueUseCase {

    void push(String workerId, String entry);

    void pushBatch(String workerId, List<String> entries);

    Optional<WorkerQueuePopResult> pop(String workerId);

    List<String> peek(String workerId);

    long remove(String workerId, String entry);

    void clear(String workerId);

    long getLength(String workerId);
}
