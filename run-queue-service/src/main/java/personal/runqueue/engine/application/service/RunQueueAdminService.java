package personal.runqueue.engine.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.runqueue.engine.application.port.in.ConcurrencyAdminUseCase;
import personal.runqueue.engine.application.port.in.RedriveMessageUseCase;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.RunQueueRepository;
import personal.runqueue.engine.domain.exception.MessageNotFoundException;
import personal.runqueue.engine.domain.exception.MessageNotInDeadLetterException;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.ConcurrencyState;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.RateLimitSettings;

import java.time.Clock;

/**
 * 운영자용 Service
 * 동시성 제한 override, 그룹 초기화, 큐 속도 제한, 데드 레터 redrive
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunQueueAdminService implements ConcurrencyAdminUseCase, RedriveMessageUseCase {

    private final ConcurrencyManager concurrencyManager;
    private final RunQueueRepository runQueueRepository;
    private final RunQueueLifecycle lifecycle;
    private final Clock clock;

    @Override
    public void updateQueueConcurrencyLimit(QueueDescriptor queue, long limit) {
        lifecycle.ensureOpen("updateQueueConcurrencyLimit");
        concurrencyManager.setConcurrencyLimit(
                ConcurrencyGroup.QUEUE.groupName(), ConcurrencyGroup.QUEUE.groupId(queue), limit);
    }

    @Override
    public void removeQueueConcurrencyLimit(QueueDescriptor queue) {
        lifecycle.ensureOpen("removeQueueConcurrencyLimit");
        concurrencyManager.removeConcurrencyLimit(
                ConcurrencyGroup.QUEUE.groupName(), ConcurrencyGroup.QUEUE.groupId(queue));
    }

    @Override
    public void updateEnvConcurrencyLimit(EnvironmentDescriptor env, long limit) {
        lifecycle.ensureOpen("updateEnvConcurrencyLimit");
        concurrencyManager.setConcurrencyLimit(ConcurrencyGroup.ENVIRONMENT.groupName(), env.envId(), limit);
    }

    @Override
    public void removeEnvConcurrencyLimit(EnvironmentDescriptor env) {
        lifecycle.ensureOpen("removeEnvConcurrencyLimit");
        concurrencyManager.removeConcurrencyLimit(ConcurrencyGroup.ENVIRONMENT.groupName(), env.envId());
    }

    @Override
    public void updateOrgConcurrencyLimit(String orgId, long limit) {
        lifecycle.ensureOpen("updateOrgConcurrencyLimit");
        concurrencyManager.setConcurrencyLimit(ConcurrencyGroup.ORGANIZATION.groupName(), orgId, limit);
    }

    @Override
    public void removeOrgConcurrencyLimit(String orgId) {
        lifecycle.ensureOpen("removeOrgConcurrencyLimit");
        concurrencyManager.removeConcurrencyLimit(ConcurrencyGroup.ORGANIZATION.groupName(), orgId);
    }

    @Override
    public ConcurrencyState getConcurrencyState(String groupName, String groupId) {
        lifecycle.ensureOpen("getConcurrencyState");
        return concurrencyManager.getState(groupName, groupId);
    }

    @Override
    public void clearConcurrencyGroup(String groupName, String groupId) {
        lifecycle.ensureOpen("clearConcurrencyGroup");
        concurrencyManager.clearGroup(groupName, groupId);
        log.warn("Concurrency group cleared by operator: group={}, groupId={}", groupName, groupId);
    }

    @Override
    public void setQueueRateLimit(QueueDescriptor queue, RateLimitSettings settings) {
        lifecycle.ensureOpen("setQueueRateLimit");
        runQueueRepository.setQueueRateLimit(queue, settings);
        log.info("Queue rate limit updated: orgId={}, envId={}, queue={}, emissionInterval={}, burstTolerance={}",
                queue.orgId(), queue.envId(), queue.queue(),
                settings.emissionIntervalMs(), settings.burstToleranceMs());
    }

    @Override
    public void removeQueueRateLimit(QueueDescriptor queue) {
        lifecycle.ensureOpen("removeQueueRateLimit");
        runQueueRepository.removeQueueRateLimit(queue);
        log.info("Queue rate limit removed: orgId={}, envId={}, queue={}", queue.orgId(), queue.envId(), queue.queue());
    }

    @Override
    public QueueMessage redrive(String orgId, String messageId) {
        lifecycle.ensureOpen("redrive");

        QueueMessage message = runQueueRepository.readMessage(orgId, messageId)
                .orElseThrow(() -> new MessageNotFoundException(orgId, messageId));

        if (!runQueueRepository.isInDeadLetterQueue(message)) {
            throw new MessageNotInDeadLetterException(orgId, messageId);
        }

        long now = clock.millis();
        QueueMessage redriven = message.redriven(now);
        runQueueRepository.enqueue(redriven, now, concurrencyManager.activeSetKeys(redriven.queueDescriptor()));

        log.info("Message redriven from dead letter queue: orgId={}, queue={}, messageId={}",
                orgId, redriven.queue(), messageId);
        return redriven;
    }
}
