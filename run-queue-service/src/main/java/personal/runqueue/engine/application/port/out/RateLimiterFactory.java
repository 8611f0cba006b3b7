package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.RateLimitSettings;

/**
 * 이름과 설정으로 RateLimiter 생성
 */
public interface RateLimiterFactory {

    RateLimiter create(String limiterName, RateLimitSettings settings);
}
