package personal.runqueue.engine.domain.model;

/**
 * GCRA 검사 결과
 *
 * @param allowed      허용 여부
 * @param retryAfterMs 거부된 경우 재시도까지 대기 시간 (허용이면 null)
 */
public record RateLimitResult(
        boolean allowed,
        Long retryAfterMs
) {
    public static RateLimitResult allow() {
        return new RateLimitResult(true, null);
    }

    public static RateLimitResult deny(long retryAfterMs) {
        return new RateLimitResult(false, retryAfterMs);
    }
}
