package personal.runqueue.engine.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.runqueue.engine.application.port.out.KeyProducer;
import personal.runqueue.engine.application.port.out.RateLimiter;
import personal.runqueue.engine.application.port.out.RateLimiterFactory;
import personal.runqueue.engine.domain.model.RateLimitSettings;

import java.time.Clock;

/**
 * GCRA Rate Limiter 생성
 */
@Component
@RequiredArgsConstructor
public class RedisGcraRateLimiterFactory implements RateLimiterFactory {

    private final KeyProducer keyProducer;
    private final RedisLuaScriptExecutor luaScriptExecutor;
    private final Clock clock;

    @Override
    public RateLimiter create(String limiterName, RateLimitSettings settings) {
        return new RedisGcraRateLimiter(limiterName, settings, keyProducer, luaScriptExecutor, clock);
    }
}
