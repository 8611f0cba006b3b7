package personal.runqueue.engine.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;
import personal.runqueue.engine.application.port.in.WorkerQueueUseCase;
import personal.runqueue.engine.application.port.out.WorkerQueueRepository;
import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.List;
import java.util.Optional;

/**
 * Worker Queue Manager
 * 승인된 메시지를 워커별 FIFO 리스트로 전달
 *
 * 용량 검사는 하지 않습니다. 항목은 불투명 문자열입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerQueueManager implements WorkerQueueUseCase {

    private final WorkerQueueRepository workerQueueRepository;
    private final RunQueueLifecycle lifecycle;

    @Override
    public void push(String workerId, String entry) {
        lifecycle.ensureOpen("workerQueue.push");
        validateEntry(workerId, entry);

        long length = workerQueueRepository.push(workerId, List.of(entry));
        log.debug("Worker queue push: workerId={}, length={}", workerId, length);
    }

    @Override
    public void pushBatch(String workerId, List<String> entries) {
        lifecycle.ensureOpen("workerQueue.pushBatch");
        if (entries == null || entries.isEmpty()) {
            return;
        }
        entries.forEach(entry -> validateEntry(workerId, entry));

        long length = workerQueueRepository.push(workerId, entries);
        log.debug("Worker queue batch push: workerId={}, count={}, length={}", workerId, entries.size(), length);
    }

    @Override
    public Optional<WorkerQueuePopResult> pop(String workerId) {
        lifecycle.ensureOpen("workerQueue.pop");
        return workerQueueRepository.pop(workerId);
    }

    @Override
    public List<String> peek(String workerId) {
        lifecycle.ensureOpen("workerQueue.peek");
        return workerQueueRepository.peek(workerId);
    }

    @Override
    public long remove(String workerId, String entry) {
        lifecycle.ensureOpen("workerQueue.remove");
        long removed = workerQueueRepository.remove(workerId, entry);
        log.debug("Worker queue remove: workerId={}, removed={}", workerId, removed);
        return removed;
    }

    @Override
    public void clear(String workerId) {
        lifecycle.ensureOpen("workerQueue.clear");
        workerQueueRepository.clear(workerId);
        log.info("Worker queue cleared: workerId={}", workerId);
    }

    @Override
    public long getLength(String workerId) {
        lifecycle.ensureOpen("workerQueue.getLength");
        return workerQueueRepository.length(workerId);
    }

    private void validateEntry(String workerId, String entry) {
        if (entry == null || entry.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_WORKER_QUEUE_ENTRY,
                    "Worker queue entry must not be blank: workerId=" + workerId);
        }
    }
}
