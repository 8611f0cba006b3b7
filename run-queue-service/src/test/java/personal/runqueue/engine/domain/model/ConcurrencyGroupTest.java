package personal.runqueue.engine.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.runqueue.engine.domain.exception.UnknownConcurrencyGroupException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConcurrencyGroup / ConcurrencyLimitPolicy 단위 테스트")
class ConcurrencyGroupTest {

    private static final QueueDescriptor QUEUE = new QueueDescriptor("org1", "proj1", "env1", "q1");

    @Test
    @DisplayName("그룹별로 디스크립터에서 그룹 ID를 추출한다")
    void groupId_PerGroup() {
        // when & then
        assertThat(ConcurrencyGroup.ORGANIZATION.groupId(QUEUE)).isEqualTo("org1");
        assertThat(ConcurrencyGroup.ENVIRONMENT.groupId(QUEUE)).isEqualTo("env1");
        assertThat(ConcurrencyGroup.QUEUE.groupId(QUEUE)).isEqualTo("env1:q1");
    }

    @Test
    @DisplayName("이름으로 조회 (대소문자 무시)")
    void fromName() {
        // when & then
        assertThat(ConcurrencyGroup.fromName("Environment")).isEqualTo(ConcurrencyGroup.ENVIRONMENT);
    }

    @Test
    @DisplayName("알 수 없는 그룹 이름은 예외")
    void fromName_Unknown() {
        // when & then
        assertThatThrownBy(() -> ConcurrencyGroup.fromName("region"))
                .isInstanceOf(UnknownConcurrencyGroupException.class);
    }

    @Test
    @DisplayName("설정 override가 있으면 기본값보다 우선한다")
    void fallbackLimit_OverrideWins() {
        // given
        ConcurrencyLimitPolicy policy = new ConcurrencyLimitPolicy(
                List.of(ConcurrencyGroup.ORGANIZATION, ConcurrencyGroup.ENVIRONMENT),
                Map.of(ConcurrencyGroup.ORGANIZATION, 100, ConcurrencyGroup.ENVIRONMENT, 10),
                Map.of(ConcurrencyGroup.ENVIRONMENT, Map.of("env-big", 50)));

        // when & then
        assertThat(policy.fallbackLimit(ConcurrencyGroup.ENVIRONMENT, "env-big")).isEqualTo(50);
        assertThat(policy.fallbackLimit(ConcurrencyGroup.ENVIRONMENT, "env1")).isEqualTo(10);
        assertThat(policy.fallbackLimit(ConcurrencyGroup.ORGANIZATION, "org1")).isEqualTo(100);
    }

    @Test
    @DisplayName("현재 값이 제한값 이상이면 가득 찬 상태")
    void concurrencyState_AtCapacity() {
        // when & then
        assertThat(new ConcurrencyState("queue", "env1:q1", 3, 3).isAtCapacity()).isTrue();
        assertThat(new ConcurrencyState("queue", "env1:q1", 2, 3).capacity()).isEqualTo(1);
        assertThat(new ConcurrencyState("queue", "env1:q1", 0, 0).isAtCapacity()).isTrue();
    }
}
