package personal.runqueue.engine.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.runqueue.engine.domain.model.RetryOptions;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryBackoffCalculator 단위 테스트")
class RetryBackoffCalculatorTest {

    private static final RetryOptions NO_JITTER = new RetryOptions(12, 2, 1_000, 3_600_000, false);

    @Test
    @DisplayName("첫 재시도는 최소 지연, 이후 factor 배로 증가한다")
    void exponentialGrowth() {
        // given
        RetryBackoffCalculator calculator = new RetryBackoffCalculator();

        // when & then
        assertThat(calculator.nextRetryDelay(NO_JITTER, 1)).isEqualTo(1_000);
        assertThat(calculator.nextRetryDelay(NO_JITTER, 2)).isEqualTo(2_000);
        assertThat(calculator.nextRetryDelay(NO_JITTER, 3)).isEqualTo(4_000);
        assertThat(calculator.nextRetryDelay(NO_JITTER, 5)).isEqualTo(16_000);
    }

    @Test
    @DisplayName("지연은 maxTimeout을 넘지 않는다")
    void cappedAtMaxTimeout() {
        // given
        RetryBackoffCalculator calculator = new RetryBackoffCalculator();

        // when
        long delay = calculator.nextRetryDelay(NO_JITTER, 30);

        // then
        assertThat(delay).isEqualTo(3_600_000);
    }

    @Test
    @DisplayName("randomize면 [1, 2) 배수의 지터가 적용된다")
    void jitterApplied() {
        // given
        RetryOptions options = new RetryOptions(12, 2, 1_000, 3_600_000, true);
        RetryBackoffCalculator calculator = new RetryBackoffCalculator(() -> 0.5);

        // when
        long delay = calculator.nextRetryDelay(options, 2);

        // then
        assertThat(delay).isEqualTo(3_000);
    }

    @Test
    @DisplayName("지터가 있어도 지연은 항상 [minTimeout, maxTimeout] 구간이다")
    void jitteredDelay_StaysInRange() {
        // given
        RetryOptions options = new RetryOptions(12, 2, 1_000, 60_000, true);
        RetryBackoffCalculator calculator = new RetryBackoffCalculator();

        // when & then
        for (int attempt = 1; attempt <= 12; attempt++) {
            assertThat(calculator.nextRetryDelay(options, attempt)).isBetween(1_000L, 60_000L);
        }
    }
}
