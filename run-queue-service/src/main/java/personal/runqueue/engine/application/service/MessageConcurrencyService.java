package personal.runqueue.engine.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.runqueue.engine.application.port.in.MessageConcurrencyUseCase;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.RunQueueRepository;
import personal.runqueue.engine.domain.exception.MessageNotFoundException;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.QueueMessage;

import java.util.Optional;

/**
 * 메시지 단위 동시성 예약 조정 Service
 * 예약은 메시지 ID로 식별하므로 dequeue한 프로세스가 아니어도 호출할 수 있습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageConcurrencyService implements MessageConcurrencyUseCase {

    private final ConcurrencyManager concurrencyManager;
    private final RunQueueRepository runQueueRepository;
    private final RunQueueLifecycle lifecycle;

    @Override
    public boolean releaseAllConcurrency(String orgId, String messageId) {
        lifecycle.ensureOpen("releaseAllConcurrency");

        Optional<QueueMessage> found = runQueueRepository.readMessage(orgId, messageId);
        if (found.isEmpty()) {
            log.warn("Concurrency release skipped, message not found: orgId={}, messageId={}", orgId, messageId);
            return false;
        }

        concurrencyManager.release(found.get().queueDescriptor(), messageId);
        log.debug("Concurrency released: orgId={}, queue={}, messageId={}", orgId, found.get().queue(), messageId);
        return true;
    }

    @Override
    public boolean releaseEnvConcurrency(String orgId, String messageId) {
        lifecycle.ensureOpen("releaseEnvConcurrency");

        Optional<QueueMessage> found = runQueueRepository.readMessage(orgId, messageId);
        if (found.isEmpty()) {
            log.warn("Env concurrency release skipped, message not found: orgId={}, messageId={}", orgId, messageId);
            return false;
        }

        concurrencyManager.releaseGroup(ConcurrencyGroup.ENVIRONMENT, found.get().queueDescriptor(), messageId);
        log.debug("Env concurrency released: orgId={}, envId={}, messageId={}",
                orgId, found.get().environmentId(), messageId);
        return true;
    }

    @Override
    public boolean reacquireConcurrency(String orgId, String messageId) {
        lifecycle.ensureOpen("reacquireConcurrency");

        QueueMessage message = runQueueRepository.readMessage(orgId, messageId)
                .orElseThrow(() -> new MessageNotFoundException(orgId, messageId));

        boolean reserved = concurrencyManager.reserve(message.queueDescriptor(), messageId);
        if (reserved) {
            log.debug("Concurrency reacquired: orgId={}, queue={}, messageId={}", orgId, message.queue(), messageId);
        } else {
            log.info("Concurrency reacquire rejected, group at capacity: orgId={}, queue={}, messageId={}",
                    orgId, message.queue(), messageId);
        }
        return reserved;
    }
}
