package personal.runqueue.engine.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.application.port.out.WorkerQueueRepository;
import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.List;
import java.util.Optional;

/**
 * Redis Worker Queue 어댑터
 * LIST 하나가 워커 하나의 FIFO (RPUSH로 넣고 LPOP으로 꺼냄)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisWorkerQueueAdapter implements WorkerQueueRepository {

    private static final long REMOVE_ALL_OCCURRENCES = 0L;

    private final RedisTemplate<String, String> redisTemplate;
    private final KeyProducer keyProducer;
    private final RedisLuaScriptExecutor luaScriptExecutor;

    @Override
    public long push(String workerId, List<String> entries) {
        Long length = redisTemplate.opsForList().rightPushAll(keyProducer.workerQueueKey(workerId), entries);

        log.debug("Pushed to worker queue: workerId={}, count={}, length={}", workerId, entries.size(), length);
        return length != null ? length : 0L;
    }

    @Override
    public Optional<WorkerQueuePopResult> pop(String workerId) {
        return luaScriptExecutor.executeWorkerQueuePop(keyProducer.workerQueueKey(workerId));
    }

    @Override
    public List<String> peek(String workerId) {
        List<String> entries = redisTemplate.opsForList().range(keyProducer.workerQueueKey(workerId), 0, -1);
        return entries != null ? entries : List.of();
    }

    @Override
    public long remove(String workerId, String entry) {
        Long removed = redisTemplate.opsForList()
                .remove(keyProducer.workerQueueKey(workerId), REMOVE_ALL_OCCURRENCES, entry);
        return removed != null ? removed : 0L;
    }

    @Override
    public void clear(String workerId) {
        redisTemplate.delete(keyProducer.workerQueueKey(workerId));
    }

    @Override
    public long length(String workerId) {
        Long size = redisTemplate.opsForList().size(keyProducer.workerQueueKey(workerId));
        return size != null ? size : 0L;
    }
}
