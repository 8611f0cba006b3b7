package personal.runqueue.engine.application.port.out;

import personal.runqueue.engine.domain.model.RateLimitResult;

/**
 * GCRA Rate Limiter (Output Port)
 * 하나의 이름 붙은 리소스에 대한 승인 제어
 *
 * 저장소 오류는 호출자에게 그대로 전파됩니다.
 */
public interface RateLimiter {

    /**
     * 현재 시각 기준 검사
     */
    RateLimitResult check(String identifier);

    /**
     * 호출자가 제공한 시각 기준 검사
     *
     * @param identifier 제한 대상 식별자
     * @param nowMs      현재 시각 (epoch ms)
     */
    RateLimitResult check(String identifier, long nowMs);
}
