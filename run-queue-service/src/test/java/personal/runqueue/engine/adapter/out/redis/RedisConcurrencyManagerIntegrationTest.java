package personal.runqueue.engine.adapter.out.redis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.domain.exception.InvalidConcurrencyLimitException;
import personal.runqueue.engine.domain.model.ConcurrencyCheckResult;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.support.RedisIntegrationTestSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Concurrency Manager 통합 테스트")
class RedisConcurrencyManagerIntegrationTest extends RedisIntegrationTestSupport {

    private static final QueueDescriptor QUEUE = new QueueDescriptor("org1", "proj1", "env1", "q1");

    @Autowired
    private ConcurrencyManager concurrencyManager;

    @Test
    @DisplayName("동시에 N개를 예약해도 성공 수는 제한값과 같다")
    void parallelReserve_NeverExceedsLimit() throws Exception {
        // given
        int limit = 5;
        int threadCount = 30;
        concurrencyManager.setConcurrencyLimit("queue", "env1:q1", limit);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            String messageId = "m" + i;
            futures.add(executor.submit(() -> {
                start.await();
                return concurrencyManager.reserve(QUEUE, messageId);
            }));
        }
        start.countDown();

        long reserved = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                reserved++;
            }
        }
        executor.shutdown();

        // then
        assertThat(reserved).isEqualTo(limit);
        assertThat(concurrencyManager.getCurrentConcurrency("queue", "env1:q1")).isEqualTo(limit);
        assertThat(concurrencyManager.getCurrentConcurrency("environment", "env1")).isEqualTo(limit);
        assertThat(concurrencyManager.getCurrentConcurrency("organization", "org1")).isEqualTo(limit);
    }

    @Test
    @DisplayName("한 그룹이라도 가득 차면 어느 그룹에도 추가되지 않는다")
    void reserve_AllOrNothing() {
        // given
        concurrencyManager.setConcurrencyLimit("environment", "env1", 1);
        concurrencyManager.reserve(QUEUE, "m1");

        // when
        boolean reserved = concurrencyManager.reserve(QUEUE, "m2");

        // then
        assertThat(reserved).isFalse();
        assertThat(concurrencyManager.getCurrentConcurrency("organization", "org1")).isEqualTo(1);
        assertThat(concurrencyManager.getCurrentConcurrency("queue", "env1:q1")).isEqualTo(1);
    }

    @Test
    @DisplayName("이미 예약된 메시지를 다시 예약하면 자리를 더 차지하지 않는다")
    void reserve_Idempotent() {
        // given
        concurrencyManager.setConcurrencyLimit("queue", "env1:q1", 1);
        concurrencyManager.reserve(QUEUE, "m1");

        // when
        boolean again = concurrencyManager.reserve(QUEUE, "m1");

        // then
        assertThat(again).isTrue();
        assertThat(concurrencyManager.getCurrentConcurrency("queue", "env1:q1")).isEqualTo(1);
    }

    @Test
    @DisplayName("release 후에는 예약 전 상태로 돌아간다")
    void release_RestoresState() {
        // given
        concurrencyManager.reserve(QUEUE, "m1");

        // when
        concurrencyManager.release(QUEUE, "m1");
        concurrencyManager.release(QUEUE, "m1");

        // then
        assertThat(concurrencyManager.getStates(QUEUE))
                .allSatisfy(state -> assertThat(state.current()).isZero());
    }

    @Test
    @DisplayName("canProcess는 처음으로 가득 찬 그룹을 알려준다")
    void canProcess_ReportsBlockingGroup() {
        // given
        concurrencyManager.setConcurrencyLimit("environment", "env1", 1);
        concurrencyManager.reserve(QUEUE, "m1");

        // when
        ConcurrencyCheckResult result = concurrencyManager.canProcess(QUEUE);

        // then
        assertThat(result.allowed()).isFalse();
        assertThat(result.blockedBy().groupName()).isEqualTo("environment");
    }

    @Test
    @DisplayName("override를 제거하면 설정 기본값으로 돌아간다")
    void removeLimit_FallsBackToDefault() {
        // given
        concurrencyManager.setConcurrencyLimit("organization", "org1", 3);

        // when
        concurrencyManager.removeConcurrencyLimit("organization", "org1");

        // then
        assertThat(concurrencyManager.getConcurrencyLimit("organization", "org1")).isEqualTo(100);
    }

    @Test
    @DisplayName("음수 제한값은 거부된다")
    void setLimit_Negative() {
        // when & then
        assertThatThrownBy(() -> concurrencyManager.setConcurrencyLimit("queue", "env1:q1", -1))
                .isInstanceOf(InvalidConcurrencyLimitException.class);
    }

    @Test
    @DisplayName("clearGroup은 그룹의 in-flight 집합만 비운다")
    void clearGroup() {
        // given
        concurrencyManager.reserve(QUEUE, "m1");

        // when
        concurrencyManager.clearGroup("queue", "env1:q1");

        // then
        assertThat(concurrencyManager.getCurrentConcurrency("queue", "env1:q1")).isZero();
        assertThat(concurrencyManager.getCurrentConcurrency("environment", "env1")).isEqualTo(1);
    }

    @Test
    @DisplayName("isAtCapacity는 현재 값이 제한값에 도달했을 때만 true")
    void isAtCapacity_TracksLimit() {
        // given
        concurrencyManager.setConcurrencyLimit("queue", "env1:q1", 2);
        concurrencyManager.reserve(QUEUE, "m1");

        // when & then
        assertThat(concurrencyManager.isAtCapacity("queue", "env1:q1")).isFalse();
        assertThat(concurrencyManager.isAtCapacity("environment", "env1")).isFalse();

        // when
        concurrencyManager.reserve(QUEUE, "m2");

        // then
        assertThat(concurrencyManager.isAtCapacity("queue", "env1:q1")).isTrue();
        assertThat(concurrencyManager.isAtCapacity("organization", "org1")).isFalse();

        // when
        concurrencyManager.release(QUEUE, "m1");

        // then
        assertThat(concurrencyManager.isAtCapacity("queue", "env1:q1")).isFalse();
    }

    @Test
    @DisplayName("releaseGroup은 지정한 그룹의 예약만 제거한다")
    void releaseGroup_OnlyThatGroup() {
        // given
        concurrencyManager.reserve(QUEUE, "m1");

        // when
        concurrencyManager.releaseGroup(ConcurrencyGroup.ENVIRONMENT, QUEUE, "m1");

        // then
        assertThat(concurrencyManager.getCurrentConcurrency("environment", "env1")).isZero();
        assertThat(concurrencyManager.getCurrentConcurrency("queue", "env1:q1")).isEqualTo(1);
        assertThat(concurrencyManager.getCurrentConcurrency("organization", "org1")).isEqualTo(1);

        // when
        boolean reacquired = concurrencyManager.reserve(QUEUE, "m1");

        // then
        assertThat(reacquired).isTrue();
        assertThat(concurrencyManager.getCurrentConcurrency("environment", "env1")).isEqualTo(1);
        assertThat(concurrencyManager.getCurrentConcurrency("queue", "env1:q1")).isEqualTo(1);
    }
}
