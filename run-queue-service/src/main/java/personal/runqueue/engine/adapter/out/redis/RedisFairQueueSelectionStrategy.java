package personal.runqueue.engine.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.config.RunQueueProperties;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.FairQueueSelectionStrategy;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.domain.exception.InvalidQueueKeyException;
import personal.runqueue.engine.domain.model.CandidateQueue;
import personal.runqueue.engine.domain.model.ConcurrencyCheckResult;
import personal.runqueue.engine.domain.service.StrideSchedulingPlanner;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis 기반 공정 큐 선택 전략 (Stride Scheduling)
 *
 * 1. 마스터 큐에서 점수(가장 오래된 메시지 시각)가 현재 이하인 큐를 최대 parentQueueLimit개 조회
 * 2. 테넌트 pass를 정규화 (stride_sync_passes.lua)
 * 3. pass 오름차순 → 테넌트 안에서는 오래된 큐 순으로 정렬
 * 4. ConcurrencyManager.canProcess로 가득 찬 큐 제외
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisFairQueueSelectionStrategy implements FairQueueSelectionStrategy {

    private final RedisTemplate<String, String> redisTemplate;
    private final KeyProducer keyProducer;
    private final RedisLuaScriptExecutor luaScriptExecutor;
    private final ConcurrencyManager concurrencyManager;
    private final StrideSchedulingPlanner planner;
    private final RunQueueProperties properties;
    private final Clock clock;

    @Override
    public Optional<CandidateQueue> chooseQueue(String masterQueue, String consumerId, int maxCount) {
        return distributeQueues(masterQueue, consumerId, maxCount).stream().findFirst();
    }

    @Override
    public List<CandidateQueue> distributeQueues(String masterQueue, String consumerId, int maxCount) {
        List<CandidateQueue> candidates = readyCandidates(masterQueue);
        if (candidates.isEmpty()) {
            return List.of();
        }

        Set<String> tenants = planner.groupByTenant(candidates).keySet();
        Map<String, Double> passes = luaScriptExecutor.executeSyncPasses(keyProducer.passKey(masterQueue), tenants);

        List<CandidateQueue> eligible = new ArrayList<>();
        for (CandidateQueue candidate : planner.order(candidates, passes)) {
            ConcurrencyCheckResult check = concurrencyManager.canProcess(candidate.descriptor());
            if (check.allowed()) {
                eligible.add(candidate);
            } else {
                log.debug("Skipping queue at capacity: queueKey={}, blockedBy={}",
                        candidate.queueKey(), check.blockedBy().groupName());
            }
        }

        log.debug("Distributed queues: masterQueue={}, consumerId={}, candidates={}, eligible={}",
                masterQueue, consumerId, candidates.size(), eligible.size());
        return eligible;
    }

    @Override
    public void recordDequeued(String masterQueue, CandidateQueue queue, int count) {
        if (count <= 0) {
            return;
        }
        String tenant = planner.tenantOf(queue);
        luaScriptExecutor.executeAdvancePass(keyProducer.passKey(masterQueue), tenant, planner.strideFor(tenant, count));
    }

    private List<CandidateQueue> readyCandidates(String masterQueue) {
        String masterQueueKey = keyProducer.masterQueueKey(masterQueue);
        Set<ZSetOperations.TypedTuple<String>> tuples = redisTemplate.opsForZSet().rangeByScoreWithScores(
                masterQueueKey,
                Double.NEGATIVE_INFINITY,
                clock.millis(),
                0,
                properties.selection().parentQueueLimit());

        if (tuples == null || tuples.isEmpty()) {
            return List.of();
        }

        List<CandidateQueue> candidates = new ArrayList<>(tuples.size());
        for (ZSetOperations.TypedTuple<String> tuple : tuples) {
            String queueKey = tuple.getValue();
            try {
                long score = tuple.getScore() != null ? tuple.getScore().longValue() : 0L;
                candidates.add(new CandidateQueue(queueKey, keyProducer.descriptorFromQueueKey(queueKey), score));
            } catch (InvalidQueueKeyException e) {
                log.error("Malformed queue key in master queue, skipping: masterQueue={}, queueKey={}",
                        masterQueue, queueKey);
            }
        }
        return candidates;
    }
}
