package personal.runqueue.engine.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Service;
import personal.runqueue.engine.application.port.in.RunQueueLifecycleUseCase;
import personal.runqueue.engine.domain.exception.RunQueueClosedException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run Queue 종료 상태 관리
 * quit() 이후 모든 UseCase는 ensureOpen에서 RunQueueClosedException을 던집니다.
 */
@Slf4j
@Service
public class RunQueueLifecycle implements RunQueueLifecycleUseCase {

    private final RedisConnectionFactory connectionFactory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RunQueueLifecycle(RedisConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public void quit() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        if (connectionFactory instanceof SmartLifecycle lifecycle && lifecycle.isRunning()) {
            lifecycle.stop();
        }
        log.info("Run queue closed, Redis connections released");
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @throws RunQueueClosedException quit() 이후 호출
     */
    public void ensureOpen(String operation) {
        if (closed.get()) {
            throw new RunQueueClosedException(operation);
        }
    }
}
