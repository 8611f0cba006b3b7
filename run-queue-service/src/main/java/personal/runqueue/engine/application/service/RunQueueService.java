package personal.runqueue.engine.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.runqueue.common.exception.BusinessException;
import personal.runqueue.common.exception.ErrorCode;
import personal.runqueue.engine.application.port.in.AcknowledgeMessageUseCase;
import personal.runqueue.engine.application.port.in.DequeueMessageUseCase;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase;
import personal.runqueue.engine.application.port.in.NackMessageUseCase;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.FairQueueSelectionStrategy;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.application.port.out.RateLimiter;
import personal.runqueue.engine.application.port.out.RateLimiterFactory;
import personal.runqueue.engine.application.port.out.RunQueueRepository;
import personal.runqueue.engine.domain.model.CandidateQueue;
import personal.runqueue.engine.domain.model.DequeuedMessage;
import personal.runqueue.engine.domain.model.NackResult;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.ReservationResult;
import personal.runqueue.engine.domain.model.RetryOptions;
import personal.runqueue.engine.domain.service.RetryBackoffCalculator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run Queue Service
 * 메시지 상태 전이: ready → in-flight → {ack 삭제 | nack 재등록 | 데드 레터}
 *
 * 모든 상태 변경은 저장소의 Lua 스크립트 한 번으로 처리되며,
 * 저장소 오류는 잡지 않고 호출자에게 전파합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunQueueService implements
        EnqueueMessageUseCase,
        DequeueMessageUseCase,
        AcknowledgeMessageUseCase,
        NackMessageUseCase {

    private static final String QUEUE_RATE_LIMITER = "queue";

    private final RunQueueRepository runQueueRepository;
    private final ConcurrencyManager concurrencyManager;
    private final FairQueueSelectionStrategy selectionStrategy;
    private final KeyProducer keyProducer;
    private final RateLimiterFactory rateLimiterFactory;
    private final RetryBackoffCalculator backoffCalculator;
    private final RetryOptions retryOptions;
    private final RunQueueLifecycle lifecycle;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public void enqueue(EnqueueMessageCommand command) {
        lifecycle.ensureOpen("enqueue");
        if (command.masterQueues() == null || command.masterQueues().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "At least one master queue is required: messageId=" + command.messageId());
        }

        long timestamp = command.timestamp() != null ? command.timestamp() : clock.millis();
        QueueMessage message = QueueMessage.create(
                command.env(),
                command.queue(),
                command.messageId(),
                command.payload(),
                command.masterQueues(),
                timestamp);

        // 다른 큐에 있던 같은 ID는 먼저 정리 (한 메시지는 한 큐에만 존재)
        runQueueRepository.readMessage(message.orgId(), message.messageId())
                .filter(existing -> !existing.queueDescriptor().equals(message.queueDescriptor()))
                .ifPresent(existing -> {
                    runQueueRepository.acknowledge(existing, concurrencyManager.activeSetKeys(existing.queueDescriptor()));
                    log.info("Message moved between queues: messageId={}, from={}, to={}",
                            message.messageId(), existing.queue(), message.queue());
                });

        runQueueRepository.enqueue(message, timestamp,
                concurrencyManager.activeSetKeys(message.queueDescriptor()));

        Counter.builder("runqueue.messages.enqueued")
                .description("Number of messages enqueued")
                .register(meterRegistry)
                .increment();

        log.debug("Message enqueued: orgId={}, envId={}, queue={}, messageId={}, masterQueues={}",
                message.orgId(), message.environmentId(), message.queue(), message.messageId(),
                message.masterQueues());
    }

    @Override
    public List<DequeuedMessage> dequeue(DequeueMessageCommand command) {
        lifecycle.ensureOpen("dequeue");
        if (command.maxCount() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "maxCount must be positive: " + command.maxCount());
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        long now = clock.millis();
        List<DequeuedMessage> dequeued = new ArrayList<>();

        List<CandidateQueue> queues = selectionStrategy.distributeQueues(
                command.masterQueue(), command.consumerId(), command.maxCount());

        for (CandidateQueue candidate : queues) {
            int remaining = command.maxCount() - dequeued.size();
            if (remaining <= 0) {
                break;
            }

            List<DequeuedMessage> taken = dequeueFromQueue(command.masterQueue(), candidate, remaining, now);
            if (!taken.isEmpty()) {
                selectionStrategy.recordDequeued(command.masterQueue(), candidate, taken.size());
                dequeued.addAll(taken);
            }
        }

        sample.stop(Timer.builder("runqueue.dequeue.duration")
                .tag("master_queue", command.masterQueue())
                .description("Time taken to dequeue from a master queue")
                .register(meterRegistry));

        Counter.builder("runqueue.messages.dequeued")
                .tag("master_queue", command.masterQueue())
                .description("Number of messages dequeued")
                .register(meterRegistry)
                .increment(dequeued.size());

        log.debug("Dequeue completed: masterQueue={}, consumerId={}, requested={}, dequeued={}",
                command.masterQueue(), command.consumerId(), command.maxCount(), dequeued.size());

        return dequeued;
    }

    @Override
    public boolean acknowledge(String orgId, String messageId) {
        lifecycle.ensureOpen("acknowledge");

        Optional<QueueMessage> found = runQueueRepository.readMessage(orgId, messageId);
        if (found.isEmpty()) {
            log.warn("Acknowledge skipped, message not found: orgId={}, messageId={}", orgId, messageId);
            return false;
        }

        QueueMessage message = found.get();
        runQueueRepository.acknowledge(message, concurrencyManager.activeSetKeys(message.queueDescriptor()));

        countResult("runqueue.messages.acked", "acked");
        log.debug("Message acknowledged: orgId={}, queue={}, messageId={}", orgId, message.queue(), messageId);
        return true;
    }

    @Override
    public NackResult nack(NackMessageCommand command) {
        lifecycle.ensureOpen("nack");

        Optional<QueueMessage> found = runQueueRepository.readMessage(command.orgId(), command.messageId());
        if (found.isEmpty()) {
            log.warn("Nack skipped, message not found: orgId={}, messageId={}", command.orgId(), command.messageId());
            return NackResult.notFound();
        }

        QueueMessage message = found.get();
        if (message.wasDeadLettered()) {
            log.warn("Nack ignored, message already dead-lettered: orgId={}, messageId={}",
                    command.orgId(), command.messageId());
            return NackResult.deadLettered(message.attempt());
        }

        List<String> activeSetKeys = concurrencyManager.activeSetKeys(message.queueDescriptor());
        long now = clock.millis();

        if (!command.incrementAttempt()) {
            // 시도 횟수 유지, 데드 레터 판정 없음
            long retryAt = command.retryAt() != null
                    ? command.retryAt()
                    : now + backoffCalculator.nextRetryDelay(retryOptions, Math.max(1, message.attempt()));
            return requeue(message.withError(command.error()), retryAt, activeSetKeys);
        }

        QueueMessage retried = message.nextAttempt(command.error());

        if (message.exhaustsRetriesOnNextAttempt(retryOptions.maxAttempts())) {
            QueueMessage deadLettered = retried.deadLettered(now);
            if (!runQueueRepository.moveToDeadLetter(deadLettered, activeSetKeys)) {
                return NackResult.notFound();
            }

            countResult("runqueue.messages.dead_lettered", "dead_lettered");
            log.info("Message dead-lettered: orgId={}, envId={}, queue={}, messageId={}, attempt={}",
                    deadLettered.orgId(), deadLettered.environmentId(), deadLettered.queue(),
                    deadLettered.messageId(), deadLettered.attempt());
            return NackResult.deadLettered(deadLettered.attempt());
        }

        long retryAt = command.retryAt() != null
                ? command.retryAt()
                : now + backoffCalculator.nextRetryDelay(retryOptions, retried.attempt());

        return requeue(retried, retryAt, activeSetKeys);
    }

    private NackResult requeue(QueueMessage message, long retryAt, List<String> activeSetKeys) {
        if (!runQueueRepository.requeue(message, retryAt, activeSetKeys)) {
            return NackResult.notFound();
        }

        countResult("runqueue.messages.nacked", "requeued");
        log.debug("Message requeued: orgId={}, queue={}, messageId={}, attempt={}, retryAt={}",
                message.orgId(), message.queue(), message.messageId(), message.attempt(), retryAt);
        return NackResult.requeued(message.attempt(), retryAt);
    }

    /**
     * 한 큐에서 최대 limit개의 메시지를 점유
     * - 가득 찬 그룹을 만나면 이 큐는 중단
     * - 다른 컨슈머가 먼저 가져간 메시지는 건너뜀
     */
    private List<DequeuedMessage> dequeueFromQueue(String masterQueue, CandidateQueue candidate, int limit, long now) {
        QueueDescriptor descriptor = candidate.descriptor();
        Map<String, Long> ready = runQueueRepository.peekReady(candidate.queueKey(), now, limit);

        if (ready.isEmpty()) {
            // 마스터 큐 점수가 실제 큐 상태와 어긋난 경우
            runQueueRepository.rebalanceMasterQueue(candidate.queueKey(), masterQueue);
            return List.of();
        }

        Optional<RateLimiter> rateLimiter = runQueueRepository.getQueueRateLimit(descriptor)
                .map(settings -> rateLimiterFactory.create(QUEUE_RATE_LIMITER, settings));
        List<String> readyKeys = List.of(
                candidate.queueKey(),
                keyProducer.envQueueKey(descriptor.orgId(), descriptor.envId()));

        List<DequeuedMessage> taken = new ArrayList<>();
        Map<List<String>, QueueMessage> rebalanceTargets = new LinkedHashMap<>();

        for (Map.Entry<String, Long> entry : ready.entrySet()) {
            String messageId = entry.getKey();

            ReservationResult reservation = concurrencyManager.reserveFromReady(descriptor, messageId, readyKeys, now);
            if (reservation == ReservationResult.AT_CAPACITY) {
                break;
            }
            if (reservation == ReservationResult.NOT_AVAILABLE) {
                continue;
            }

            Optional<QueueMessage> message = runQueueRepository.readMessage(descriptor.orgId(), messageId);
            if (message.isEmpty()) {
                concurrencyManager.release(descriptor, messageId);
                log.error("Claimed message has no body, reservation released: queueKey={}, messageId={}",
                        candidate.queueKey(), messageId);
                continue;
            }

            // 점유에 성공한 메시지에만 토큰 소비, 거절되면 원래 점수로 되돌림
            if (rateLimiter.isPresent() && !rateLimiter.get().check(candidate.queueKey(), now).allowed()) {
                runQueueRepository.requeue(message.get(), entry.getValue(),
                        concurrencyManager.activeSetKeys(descriptor));
                log.debug("Queue rate limited, claim returned: queueKey={}, messageId={}",
                        candidate.queueKey(), messageId);
                break;
            }

            taken.add(new DequeuedMessage(messageId, candidate.queueKey(), entry.getValue(), message.get()));
            rebalanceTargets.putIfAbsent(message.get().masterQueues(), message.get());
        }

        rebalanceTargets.values().forEach(runQueueRepository::rebalanceMasterQueues);
        return taken;
    }

    private void countResult(String name, String result) {
        Counter.builder(name)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
