package personal.runqueue.engine.adapter.out.redis;

import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.application.port.out.RateLimiter;
import personal.runqueue.engine.domain.model.RateLimitResult;
import personal.runqueue.engine.domain.model.RateLimitSettings;

import java.time.Clock;

/**
 * Redis 기반 GCRA Rate Limiter
 *
 * 식별자마다 TAT(Theoretical Arrival Time) 하나만 저장합니다.
 * 읽기와 쓰기는 gcra_check.lua 한 번으로 처리되어 같은 식별자에 대한 동시 호출도 선형화됩니다.
 *
 * 동작 예시 (emission=1000ms, burst=0):
 * - t=0    TAT 없음 → 허용, TAT=1000
 * - t=100  TAT=1000 → 거부, retryAfter=900
 * - t=1100 TAT=1000 → 허용, TAT=2100
 */
public class RedisGcraRateLimiter implements RateLimiter {

    private final String limiterName;
    private final RateLimitSettings settings;
    private final KeyProducer keyProducer;
    private final RedisLuaScriptExecutor luaScriptExecutor;
    private final Clock clock;

    public RedisGcraRateLimiter(
            String limiterName,
            RateLimitSettings settings,
            KeyProducer keyProducer,
            RedisLuaScriptExecutor luaScriptExecutor,
            Clock clock) {
        this.limiterName = limiterName;
        this.settings = settings;
        this.keyProducer = keyProducer;
        this.luaScriptExecutor = luaScriptExecutor;
        this.clock = clock;
    }

    @Override
    public RateLimitResult check(String identifier) {
        return check(identifier, clock.millis());
    }

    @Override
    public RateLimitResult check(String identifier, long nowMs) {
        String key = keyProducer.rateLimitKey(limiterName, identifier);
        return luaScriptExecutor.executeGcraCheck(key, nowMs, settings);
    }

    public RateLimitSettings settings() {
        return settings;
    }
}
