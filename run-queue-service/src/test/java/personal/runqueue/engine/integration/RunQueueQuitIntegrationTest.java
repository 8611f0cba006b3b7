package personal.runqueue.engine.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import personal.runqueue.engine.application.port.in.DequeueMessageUseCase;
import personal.runqueue.engine.application.port.in.DequeueMessageUseCase.DequeueMessageCommand;
import personal.runqueue.engine.application.port.in.RunQueueLifecycleUseCase;
import personal.runqueue.engine.domain.exception.RunQueueClosedException;
import personal.runqueue.engine.support.RedisIntegrationTestSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DirtiesContext
@DisplayName("Run Queue 종료 통합 테스트")
class RunQueueQuitIntegrationTest extends RedisIntegrationTestSupport {

    @Autowired
    private RunQueueLifecycleUseCase lifecycle;

    @Autowired
    private DequeueMessageUseCase dequeueMessageUseCase;

    @Test
    @DisplayName("quit 이후 작업은 거부되고 quit은 여러 번 호출해도 안전하다")
    void quit_RejectsFurtherOperations() {
        // when
        lifecycle.quit();
        lifecycle.quit();

        // then
        assertThat(lifecycle.isClosed()).isTrue();
        assertThatThrownBy(() -> dequeueMessageUseCase.dequeue(new DequeueMessageCommand("c1", "main", 1)))
                .isInstanceOf(RunQueueClosedException.class);
    }
}
