package personal.runqueue.engine.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import personal.runqueue.engine.domain.exception.RunQueueClosedException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("RunQueueLifecycle 단위 테스트")
class RunQueueLifecycleTest {

    @Test
    @DisplayName("quit 이후 모든 연산은 RunQueueClosedException")
    void quit_ClosesOperations() {
        // given
        LettuceConnectionFactory connectionFactory = mock(LettuceConnectionFactory.class);
        given(connectionFactory.isRunning()).willReturn(true);
        RunQueueLifecycle lifecycle = new RunQueueLifecycle(connectionFactory);

        // when
        lifecycle.quit();

        // then
        assertThat(lifecycle.isClosed()).isTrue();
        verify(connectionFactory).stop();
        assertThatThrownBy(() -> lifecycle.ensureOpen("dequeue"))
                .isInstanceOf(RunQueueClosedException.class);
    }

    @Test
    @DisplayName("quit은 여러 번 호출해도 연결을 한 번만 닫는다")
    void quit_Idempotent() {
        // given
        LettuceConnectionFactory connectionFactory = mock(LettuceConnectionFactory.class);
        given(connectionFactory.isRunning()).willReturn(true);
        RunQueueLifecycle lifecycle = new RunQueueLifecycle(connectionFactory);

        // when
        lifecycle.quit();
        lifecycle.quit();

        // then
        verify(connectionFactory, times(1)).stop();
    }

    @Test
    @DisplayName("quit 전에는 열려 있다")
    void openByDefault() {
        // given
        RunQueueLifecycle lifecycle = new RunQueueLifecycle(mock(LettuceConnectionFactory.class));

        // when & then
        assertThat(lifecycle.isClosed()).isFalse();
        lifecycle.ensureOpen("enqueue");
    }
}
