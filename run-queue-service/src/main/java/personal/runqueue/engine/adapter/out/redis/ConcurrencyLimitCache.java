package personal.runqueue.engine.adapter.out.redis;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.config.RunQueueProperties;

import java.time.Duration;
import java.util.function.Function;

/**
 * 동시성 제한값 조회 캐시
 *
 * 조회용 경로(canProcess, 메트릭)에서만 사용하며 TTL 동안 이전 값을 볼 수 있습니다.
 * 예약 스크립트는 항상 Redis에서 최신 제한값을 읽습니다.
 * 제한값을 변경하는 쪽은 {@link #invalidate(String)}를 호출해야 합니다.
 */
@Slf4j
@Component
public class ConcurrencyLimitCache {

    private final Cache<String, Long> limits;
    private final Duration ttl;

    public ConcurrencyLimitCache(RunQueueProperties properties) {
        this(properties.concurrency().limitCacheTtl(), properties.concurrency().limitCacheMaxSize());
    }

    public ConcurrencyLimitCache(Duration ttl, long maximumSize) {
        this.ttl = ttl;
        this.limits = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * @param limitKey 제한값 override 키
     * @param loader   캐시에 없을 때 Redis에서 읽는 함수
     */
    public long get(String limitKey, Function<String, Long> loader) {
        return limits.get(limitKey, loader);
    }

    public void invalidate(String limitKey) {
        limits.invalidate(limitKey);
        log.debug("Concurrency limit cache invalidated: limitKey={}", limitKey);
    }

    public void invalidateAll() {
        limits.invalidateAll();
    }

    public Duration ttl() {
        return ttl;
    }
}
