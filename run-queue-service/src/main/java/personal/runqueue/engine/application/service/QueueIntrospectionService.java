package personal.runqueue.engine.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import personal.runqueue.engine.application.port.in.QueueIntrospectionUseCase;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.RunQueueRepository;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentMetrics;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.QueueMetrics;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 큐 조회 Service
 * 저장소와 동시성 관리자의 값을 그대로 읽으며 아무것도 변경하지 않습니다.
 */
@Service
@RequiredArgsConstructor
public class QueueIntrospectionService implements QueueIntrospectionUseCase {

    private final RunQueueRepository runQueueRepository;
    private final ConcurrencyManager concurrencyManager;
    private final RunQueueLifecycle lifecycle;
    private final Clock clock;

    @Override
    public long lengthOfQueue(QueueDescriptor queue) {
        lifecycle.ensureOpen("lengthOfQueue");
        return runQueueRepository.lengthOfQueue(queue);
    }

    @Override
    public Map<String, Long> lengthOfQueues(EnvironmentDescriptor env, List<String> queues) {
        lifecycle.ensureOpen("lengthOfQueues");
        Map<String, Long> lengths = new LinkedHashMap<>();
        for (String queue : queues) {
            lengths.put(queue, runQueueRepository.lengthOfQueue(env.queue(queue)));
        }
        return lengths;
    }

    @Override
    public long lengthOfEnvQueue(EnvironmentDescriptor env) {
        lifecycle.ensureOpen("lengthOfEnvQueue");
        return runQueueRepository.lengthOfEnvQueue(env.orgId(), env.envId());
    }

    @Override
    public long lengthOfDeadLetterQueue(EnvironmentDescriptor env) {
        lifecycle.ensureOpen("lengthOfDeadLetterQueue");
        return runQueueRepository.lengthOfDeadLetterQueue(env.orgId(), env.projectId(), env.envId());
    }

    @Override
    public long currentConcurrencyOfQueue(QueueDescriptor queue) {
        lifecycle.ensureOpen("currentConcurrencyOfQueue");
        return currentOf(ConcurrencyGroup.QUEUE, queue);
    }

    @Override
    public Map<String, Long> currentConcurrencyOfQueues(EnvironmentDescriptor env, List<String> queues) {
        lifecycle.ensureOpen("currentConcurrencyOfQueues");
        Map<String, Long> current = new LinkedHashMap<>();
        for (String queue : queues) {
            current.put(queue, currentOf(ConcurrencyGroup.QUEUE, env.queue(queue)));
        }
        return current;
    }

    @Override
    public long currentConcurrencyOfEnvironment(EnvironmentDescriptor env) {
        lifecycle.ensureOpen("currentConcurrencyOfEnvironment");
        return concurrencyManager.getCurrentConcurrency(ConcurrencyGroup.ENVIRONMENT.groupName(), env.envId());
    }

    @Override
    public long currentConcurrencyOfOrg(String orgId) {
        lifecycle.ensureOpen("currentConcurrencyOfOrg");
        return concurrencyManager.getCurrentConcurrency(ConcurrencyGroup.ORGANIZATION.groupName(), orgId);
    }

    @Override
    public long getQueueConcurrencyLimit(QueueDescriptor queue) {
        lifecycle.ensureOpen("getQueueConcurrencyLimit");
        return queueLimitOf(queue);
    }

    @Override
    public long getEnvConcurrencyLimit(EnvironmentDescriptor env) {
        lifecycle.ensureOpen("getEnvConcurrencyLimit");
        return concurrencyManager.getConcurrencyLimit(ConcurrencyGroup.ENVIRONMENT.groupName(), env.envId());
    }

    @Override
    public long getOrgConcurrencyLimit(String orgId) {
        lifecycle.ensureOpen("getOrgConcurrencyLimit");
        return concurrencyManager.getConcurrencyLimit(ConcurrencyGroup.ORGANIZATION.groupName(), orgId);
    }

    @Override
    public Optional<Long> oldestMessageInQueue(QueueDescriptor queue) {
        lifecycle.ensureOpen("oldestMessageInQueue");
        return runQueueRepository.oldestMessageScore(queue);
    }

    @Override
    public Optional<QueueMessage> readMessage(String orgId, String messageId) {
        lifecycle.ensureOpen("readMessage");
        return runQueueRepository.readMessage(orgId, messageId);
    }

    @Override
    public boolean messageInDeadLetterQueue(String orgId, String messageId) {
        lifecycle.ensureOpen("messageInDeadLetterQueue");
        return runQueueRepository.readMessage(orgId, messageId)
                .map(runQueueRepository::isInDeadLetterQueue)
                .orElse(false);
    }

    @Override
    public QueueMetrics queueMetrics(QueueDescriptor queue) {
        lifecycle.ensureOpen("queueMetrics");
        long length = runQueueRepository.lengthOfQueue(queue);
        long current = currentOf(ConcurrencyGroup.QUEUE, queue);
        long limit = queueLimitOf(queue);
        // 재시도 대기 중인 메시지는 점수가 미래이므로 나이 0
        long oldestAge = runQueueRepository.oldestMessageScore(queue)
                .map(score -> Math.max(0L, clock.millis() - score))
                .orElse(0L);

        return new QueueMetrics(length, current, limit, limit - current, oldestAge);
    }

    @Override
    public EnvironmentMetrics environmentMetrics(EnvironmentDescriptor env) {
        lifecycle.ensureOpen("environmentMetrics");
        long length = runQueueRepository.lengthOfEnvQueue(env.orgId(), env.envId());
        long deadLetterLength = runQueueRepository.lengthOfDeadLetterQueue(env.orgId(), env.projectId(), env.envId());
        long current = concurrencyManager.getCurrentConcurrency(ConcurrencyGroup.ENVIRONMENT.groupName(), env.envId());
        long limit = concurrencyManager.getConcurrencyLimit(ConcurrencyGroup.ENVIRONMENT.groupName(), env.envId());

        return new EnvironmentMetrics(length, deadLetterLength, current, limit, limit - current);
    }

    private long currentOf(ConcurrencyGroup group, QueueDescriptor queue) {
        return concurrencyManager.getCurrentConcurrency(group.groupName(), group.groupId(queue));
    }

    private long queueLimitOf(QueueDescriptor queue) {
        long queueLimit = concurrencyManager.getConcurrencyLimit(
                ConcurrencyGroup.QUEUE.groupName(), ConcurrencyGroup.QUEUE.groupId(queue));
        long envLimit = concurrencyManager.getConcurrencyLimit(
                ConcurrencyGroup.ENVIRONMENT.groupName(), ConcurrencyGroup.ENVIRONMENT.groupId(queue));
        return Math.min(queueLimit, envLimit);
    }
}
