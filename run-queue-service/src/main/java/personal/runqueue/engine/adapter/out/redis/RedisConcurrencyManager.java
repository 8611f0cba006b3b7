package personal.runqueue.engine.adapter.out.redis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.port.out.ConcurrencyManager;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.domain.exception.InvalidConcurrencyLimitException;
import personal.runqueue.engine.domain.model.ConcurrencyCheckResult;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.ConcurrencyLimitPolicy;
import personal.runqueue.engine.domain.model.ConcurrencyState;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.ReservationResult;

import java.util.List;

/**
 * Redis 기반 Concurrency Manager
 *
 * 그룹마다 active set(SET)과 제한값 override(STRING)를 가집니다.
 * - 예약/해제는 Lua 스크립트 한 번으로 모든 그룹에 적용 (all-or-nothing)
 * - canProcess만 ConcurrencyLimitCache를 거치고, 조회 메서드와 스크립트는 Redis에서 바로 읽음
 */
@Slf4j
@Component
public class RedisConcurrencyManager implements ConcurrencyManager {

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisLuaScriptExecutor luaScriptExecutor;
    private final KeyProducer keyProducer;
    private final ConcurrencyLimitPolicy limitPolicy;
    private final ConcurrencyLimitCache limitCache;

    public RedisConcurrencyManager(
            RedisTemplate<String, String> redisTemplate,
            RedisLuaScriptExecutor luaScriptExecutor,
            KeyProducer keyProducer,
            ConcurrencyLimitPolicy limitPolicy,
            ConcurrencyLimitCache limitCache) {
        this.redisTemplate = redisTemplate;
        this.luaScriptExecutor = luaScriptExecutor;
        this.keyProducer = keyProducer;
        this.limitPolicy = limitPolicy;
        this.limitCache = limitCache;
    }

    @Override
    public ConcurrencyCheckResult canProcess(QueueDescriptor descriptor) {
        for (ConcurrencyGroup group : limitPolicy.groups()) {
            String groupId = group.groupId(descriptor);
            ConcurrencyState state = new ConcurrencyState(
                    group.groupName(), groupId, currentOf(group, groupId), cachedLimitOf(group, groupId));
            if (state.isAtCapacity()) {
                log.debug("Concurrency group at capacity: group={}, groupId={}, current={}, limit={}",
                        state.groupName(), state.groupId(), state.current(), state.limit());
                return ConcurrencyCheckResult.blocked(state);
            }
        }
        return ConcurrencyCheckResult.allow();
    }

    @Override
    public boolean reserve(QueueDescriptor descriptor, String messageId) {
        long result = executeReserve(descriptor, messageId, List.of(), null);
        return result == RedisLuaScriptExecutor.RESERVED;
    }

    @Override
    public ReservationResult reserveFromReady(QueueDescriptor descriptor, String messageId,
                                              List<String> readyKeys, long maxScore) {
        if (readyKeys.isEmpty()) {
            throw new IllegalArgumentException("readyKeys must not be empty");
        }

        long result = executeReserve(descriptor, messageId, readyKeys, maxScore);

        if (result == RedisLuaScriptExecutor.RESERVED) {
            return ReservationResult.RESERVED;
        }
        if (result == RedisLuaScriptExecutor.NOT_AVAILABLE) {
            return ReservationResult.NOT_AVAILABLE;
        }
        return ReservationResult.AT_CAPACITY;
    }

    @Override
    public void release(QueueDescriptor descriptor, String messageId) {
        luaScriptExecutor.executeRelease(activeSetKeys(descriptor), messageId);
    }

    @Override
    public void releaseGroup(ConcurrencyGroup group, QueueDescriptor descriptor, String messageId) {
        String activeKey = keyProducer.concurrencySetKey(group, group.groupId(descriptor));
        luaScriptExecutor.executeRelease(List.of(activeKey), messageId);
    }

    @Override
    public long getCurrentConcurrency(String groupName, String groupId) {
        return currentOf(ConcurrencyGroup.fromName(groupName), groupId);
    }

    @Override
    public long getConcurrencyLimit(String groupName, String groupId) {
        return limitOf(ConcurrencyGroup.fromName(groupName), groupId);
    }

    @Override
    public boolean isAtCapacity(String groupName, String groupId) {
        return getState(groupName, groupId).isAtCapacity();
    }

    @Override
    public ConcurrencyState getState(String groupName, String groupId) {
        return stateOf(ConcurrencyGroup.fromName(groupName), groupId);
    }

    @Override
    public List<ConcurrencyState> getStates(QueueDescriptor descriptor) {
        return limitPolicy.groups().stream()
                .map(group -> stateOf(group, group.groupId(descriptor)))
                .toList();
    }

    @Override
    public void clearGroup(String groupName, String groupId) {
        ConcurrencyGroup group = ConcurrencyGroup.fromName(groupName);
        String activeKey = keyProducer.concurrencySetKey(group, groupId);
        Boolean deleted = redisTemplate.delete(activeKey);

        log.info("Concurrency group cleared: group={}, groupId={}, deleted={}", groupName, groupId, deleted);
    }

    @Override
    public void setConcurrencyLimit(String groupName, String groupId, long limit) {
        if (limit < 0) {
            throw new InvalidConcurrencyLimitException(groupName, groupId, limit);
        }
        ConcurrencyGroup group = ConcurrencyGroup.fromName(groupName);
        String limitKey = keyProducer.concurrencyLimitKey(group, groupId);

        redisTemplate.opsForValue().set(limitKey, String.valueOf(limit));
        limitCache.invalidate(limitKey);

        log.info("Concurrency limit updated: group={}, groupId={}, limit={}", groupName, groupId, limit);
    }

    @Override
    public void removeConcurrencyLimit(String groupName, String groupId) {
        ConcurrencyGroup group = ConcurrencyGroup.fromName(groupName);
        String limitKey = keyProducer.concurrencyLimitKey(group, groupId);

        redisTemplate.delete(limitKey);
        limitCache.invalidate(limitKey);

        log.info("Concurrency limit removed: group={}, groupId={}", groupName, groupId);
    }

    @Override
    public List<String> activeSetKeys(QueueDescriptor descriptor) {
        return limitPolicy.groups().stream()
                .map(group -> keyProducer.concurrencySetKey(group, group.groupId(descriptor)))
                .toList();
    }

    @Override
    public List<ConcurrencyGroup> groups() {
        return limitPolicy.groups();
    }

    private long executeReserve(QueueDescriptor descriptor, String messageId, List<String> readyKeys, Long maxScore) {
        List<ConcurrencyGroup> groups = limitPolicy.groups();

        List<String> activeKeys = groups.stream()
                .map(group -> keyProducer.concurrencySetKey(group, group.groupId(descriptor)))
                .toList();
        List<String> limitKeys = groups.stream()
                .map(group -> keyProducer.concurrencyLimitKey(group, group.groupId(descriptor)))
                .toList();
        List<Long> defaultLimits = groups.stream()
                .map(group -> (long) limitPolicy.fallbackLimit(group, group.groupId(descriptor)))
                .toList();

        long result = luaScriptExecutor.executeReserve(
                activeKeys, limitKeys, defaultLimits, messageId, readyKeys, maxScore);

        if (result < 0) {
            ConcurrencyGroup blocked = groups.get((int) (-result) - 1);
            log.debug("Reservation rejected: messageId={}, blockedBy={}, groupId={}",
                    messageId, blocked.groupName(), blocked.groupId(descriptor));
        }
        return result;
    }

    private ConcurrencyState stateOf(ConcurrencyGroup group, String groupId) {
        return new ConcurrencyState(group.groupName(), groupId, currentOf(group, groupId), limitOf(group, groupId));
    }

    private long currentOf(ConcurrencyGroup group, String groupId) {
        Long size = redisTemplate.opsForSet().size(keyProducer.concurrencySetKey(group, groupId));
        return size != null ? size : 0L;
    }

    private long limitOf(ConcurrencyGroup group, String groupId) {
        return readLimit(keyProducer.concurrencyLimitKey(group, groupId), group, groupId);
    }

    private long cachedLimitOf(ConcurrencyGroup group, String groupId) {
        String limitKey = keyProducer.concurrencyLimitKey(group, groupId);
        return limitCache.get(limitKey, key -> readLimit(key, group, groupId));
    }

    private long readLimit(String limitKey, ConcurrencyGroup group, String groupId) {
        String stored = redisTemplate.opsForValue().get(limitKey);
        return stored != null ? Long.parseLong(stored) : limitPolicy.fallbackLimit(group, groupId);
    }
}
