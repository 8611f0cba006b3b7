package personal.runqueue.engine.adapter.out.redis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import personal.runqueue.engine.domain.exception.InvalidQueueKeyException;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.QueueDescriptor;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RedisKeyProducer 단위 테스트")
class RedisKeyProducerTest {

    private static final QueueDescriptor QUEUE = new QueueDescriptor("org1", "proj1", "env1", "task/hello");

    private final RedisKeyProducer keyProducer = new RedisKeyProducer("runqueue", false);

    @Test
    @DisplayName("큐 키는 prefix와 조직/프로젝트/환경/큐 구간으로 구성된다")
    void queueKey_Format() {
        // when
        String key = keyProducer.queueKey(QUEUE);

        // then
        assertThat(key).isEqualTo("runqueue:org:org1:proj:proj1:env:env1:queue:task/hello");
    }

    @Test
    @DisplayName("큐 키에서 디스크립터를 그대로 복원한다")
    void descriptorFromQueueKey_RoundTrip() {
        // given
        String key = keyProducer.queueKey(QUEUE);

        // when
        QueueDescriptor parsed = keyProducer.descriptorFromQueueKey(key);

        // then
        assertThat(parsed).isEqualTo(QUEUE);
    }

    @Test
    @DisplayName("서로 다른 종류의 키는 충돌하지 않는다")
    void differentKinds_NeverCollide() {
        // when
        Set<String> keys = Set.of(
                keyProducer.queueKey(QUEUE),
                keyProducer.envQueueKey("org1", "env1"),
                keyProducer.messageKey("org1", "msg1"),
                keyProducer.deadLetterQueueKey("org1", "proj1", "env1"),
                keyProducer.masterQueueKey("main"),
                keyProducer.passKey("main"),
                keyProducer.concurrencySetKey(ConcurrencyGroup.QUEUE, "env1:task/hello"),
                keyProducer.concurrencyLimitKey(ConcurrencyGroup.QUEUE, "env1:task/hello"),
                keyProducer.rateLimitKey("dequeue", "consumer-1"),
                keyProducer.queueRateLimitConfigKey(QUEUE),
                keyProducer.workerQueueKey("worker-1"));

        // then
        assertThat(keys).hasSize(11);
        assertThat(keys).allMatch(key -> key.startsWith("runqueue:"));
    }

    @Test
    @DisplayName("같은 입력은 인스턴스가 달라도 같은 키를 만든다")
    void sameInput_SameKeyAcrossInstances() {
        // given
        RedisKeyProducer another = new RedisKeyProducer("runqueue", false);

        // when & then
        assertThat(another.queueKey(QUEUE)).isEqualTo(keyProducer.queueKey(QUEUE));
        assertThat(another.messageKey("org1", "m")).isEqualTo(keyProducer.messageKey("org1", "m"));
    }

    @Test
    @DisplayName("동시성 키는 그룹 이름을 포함한다")
    void concurrencyKeys_ContainGroupName() {
        // when & then
        assertThat(keyProducer.concurrencySetKey(ConcurrencyGroup.ORGANIZATION, "org1"))
                .isEqualTo("runqueue:concurrency:organization:org1:current");
        assertThat(keyProducer.concurrencyLimitKey(ConcurrencyGroup.ENVIRONMENT, "env1"))
                .isEqualTo("runqueue:concurrency:environment:env1:limit");
    }

    @Nested
    @DisplayName("Hash Tag 모드")
    class ClusterHashTag {

        private final RedisKeyProducer hashTagged = new RedisKeyProducer("runqueue", true);

        @Test
        @DisplayName("모든 키가 같은 Hash Tag로 시작한다")
        void allKeys_ShareHashTag() {
            // when & then
            assertThat(hashTagged.queueKey(QUEUE)).startsWith("{runqueue}:");
            assertThat(hashTagged.workerQueueKey("w1")).startsWith("{runqueue}:");
            assertThat(hashTagged.masterQueueKey("main")).startsWith("{runqueue}:");
        }

        @Test
        @DisplayName("Hash Tag가 붙은 큐 키도 복원된다")
        void descriptorFromQueueKey_WithHashTag() {
            // when & then
            assertThat(hashTagged.descriptorFromQueueKey(hashTagged.queueKey(QUEUE))).isEqualTo(QUEUE);
        }
    }

    @Nested
    @DisplayName("잘못된 입력")
    class InvalidInput {

        @Test
        @DisplayName("구분자를 포함한 큐 이름은 거부된다")
        void queueName_WithSeparator_Rejected() {
            // given
            QueueDescriptor invalid = new QueueDescriptor("org1", "proj1", "env1", "a:b");

            // when & then
            assertThatThrownBy(() -> keyProducer.queueKey(invalid))
                    .isInstanceOf(InvalidQueueKeyException.class);
        }

        @Test
        @DisplayName("빈 값과 Hash Tag 문자는 거부된다")
        void blankOrBraces_Rejected() {
            // when & then
            assertThatThrownBy(() -> keyProducer.messageKey("org1", " "))
                    .isInstanceOf(InvalidQueueKeyException.class);
            assertThatThrownBy(() -> keyProducer.workerQueueKey("w{1}"))
                    .isInstanceOf(InvalidQueueKeyException.class);
            assertThatThrownBy(() -> keyProducer.masterQueueKey(null))
                    .isInstanceOf(InvalidQueueKeyException.class);
        }

        @Test
        @DisplayName("형식이 맞지 않는 큐 키는 복원할 수 없다")
        void malformedQueueKey_Rejected() {
            // when & then
            assertThatThrownBy(() -> keyProducer.descriptorFromQueueKey("runqueue:org:o:env:e"))
                    .isInstanceOf(InvalidQueueKeyException.class);
            assertThatThrownBy(() -> keyProducer.descriptorFromQueueKey("other:org:o:proj:p:env:e:queue:q"))
                    .isInstanceOf(InvalidQueueKeyException.class);
            assertThatThrownBy(() -> keyProducer.descriptorFromQueueKey(
                    "runqueue:org:o:proj:p:env:e:topic:q"))
                    .isInstanceOf(InvalidQueueKeyException.class);
        }
    }
}
