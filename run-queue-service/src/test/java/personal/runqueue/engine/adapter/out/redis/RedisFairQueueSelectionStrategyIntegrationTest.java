package personal.runqueue.engine.adapter.out.redis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase.EnqueueMessageCommand;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.FairQueueSelectionStrategy;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.domain.model.CandidateQueue;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentType;
import personal.runqueue.engine.support.RedisIntegrationTestSupport;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Fair Queue Selection Strategy 통합 테스트")
class RedisFairQueueSelectionStrategyIntegrationTest extends RedisIntegrationTestSupport {

    private static final String MASTER_QUEUE = "main";
    private static final EnvironmentDescriptor ENV_A =
            new EnvironmentDescriptor("org1", "proj1", "envA", EnvironmentType.PRODUCTION);
    private static final EnvironmentDescriptor ENV_B =
            new EnvironmentDescriptor("org1", "proj1", "envB", EnvironmentType.PRODUCTION);

    @Autowired
    private FairQueueSelectionStrategy selectionStrategy;

    @Autowired
    private ConcurrencyManager concurrencyManager;

    @Autowired
    private KeyProducer keyProducer;

    @Autowired
    private EnqueueMessageUseCase enqueueMessageUseCase;

    private void enqueue(EnvironmentDescriptor env, String messageId, long timestamp) {
        enqueueMessageUseCase.enqueue(new EnqueueMessageCommand(
                env, "q", messageId, "{}", List.of(MASTER_QUEUE), timestamp));
    }

    @Test
    @DisplayName("ready 큐가 없으면 선택 결과가 없다")
    void chooseQueue_EmptyMasterQueue() {
        // when
        Optional<CandidateQueue> chosen = selectionStrategy.chooseQueue(MASTER_QUEUE, "c1", 10);

        // then
        assertThat(chosen).isEmpty();
    }

    @Test
    @DisplayName("아직 때가 되지 않은 메시지만 있으면 선택 결과가 없다")
    void chooseQueue_OnlyFutureMessages() {
        // given
        enqueue(ENV_A, "a1", System.currentTimeMillis() + 60_000L);

        // when
        Optional<CandidateQueue> chosen = selectionStrategy.chooseQueue(MASTER_QUEUE, "c1", 10);

        // then
        assertThat(chosen).isEmpty();
    }

    @Test
    @DisplayName("동시성 여유가 있으면 가장 오래된 큐를 고른다")
    void chooseQueue_OldestQueue() {
        // given
        enqueue(ENV_A, "a1", 1_000L);
        enqueue(ENV_B, "b1", 2_000L);

        // when
        Optional<CandidateQueue> chosen = selectionStrategy.chooseQueue(MASTER_QUEUE, "c1", 10);

        // then
        assertThat(chosen).hasValueSatisfying(candidate ->
                assertThat(candidate.queueKey()).isEqualTo(keyProducer.queueKey(ENV_A.queue("q"))));
    }

    @Test
    @DisplayName("가득 찬 환경의 큐는 건너뛰고 다음 큐를 고른다")
    void chooseQueue_SkipsQueueAtCapacity() {
        // given
        enqueue(ENV_A, "a1", 1_000L);
        enqueue(ENV_B, "b1", 2_000L);
        concurrencyManager.setConcurrencyLimit("environment", "envA", 1);
        concurrencyManager.reserve(ENV_A.queue("q"), "running");

        // when
        Optional<CandidateQueue> chosen = selectionStrategy.chooseQueue(MASTER_QUEUE, "c1", 10);

        // then
        assertThat(concurrencyManager.isAtCapacity("environment", "envA")).isTrue();
        assertThat(chosen).hasValueSatisfying(candidate ->
                assertThat(candidate.descriptor().envId()).isEqualTo("envB"));
    }
}
