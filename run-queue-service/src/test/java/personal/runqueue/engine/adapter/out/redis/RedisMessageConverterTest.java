package personal.runqueue.engine.adapter.out.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.runqueue.engine.domain.exception.QueueDataCorruptionException;
import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RedisMessageConverter 단위 테스트")
class RedisMessageConverterTest {

    private final RedisMessageConverter converter = new RedisMessageConverter(new ObjectMapper());

    @Test
    @DisplayName("pass 동기화 결과는 스크립트가 돌려준 순서를 유지한다")
    void toPasses_KeepsOrder() {
        // when
        Map<String, Double> passes = converter.toPasses("pass", "[\"org2\",\"1.5\",\"org1\",\"0\"]");

        // then
        assertThat(passes).containsExactly(Map.entry("org2", 1.5), Map.entry("org1", 0.0));
    }

    @Test
    @DisplayName("빈 결과는 빈 Map")
    void toPasses_Empty() {
        // when & then
        assertThat(converter.toPasses("pass", "[]")).isEmpty();
        assertThat(converter.toPasses("pass", null)).isEmpty();
    }

    @Test
    @DisplayName("숫자가 아닌 pass는 데이터 손상으로 처리한다")
    void toPasses_Corrupted() {
        // when & then
        assertThatThrownBy(() -> converter.toPasses("pass", "[\"org1\",\"abc\"]"))
                .isInstanceOf(QueueDataCorruptionException.class);
    }

    @Test
    @DisplayName("워커 큐 pop 결과는 항목과 남은 길이로 변환된다")
    void toWorkerQueuePopResult() {
        // when
        WorkerQueuePopResult result = converter.toWorkerQueuePopResult(
                "worker", "{\"entry\":\"{\\\"runId\\\":\\\"r1\\\"}\",\"remainingLength\":3}");

        // then
        assertThat(result.entry()).isEqualTo("{\"runId\":\"r1\"}");
        assertThat(result.remainingLength()).isEqualTo(3L);
    }
}
