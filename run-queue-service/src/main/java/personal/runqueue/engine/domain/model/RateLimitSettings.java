package personal.runqueue.engine.domain.model;

/**
 * GCRA 설정
 *
 * @param emissionIntervalMs 허용 간 최소 간격 (ms)
 * @param burstToleranceMs   burst를 허용하는 추가 크레딧 (ms)
 * @param keyExpirationMs    TAT 저장 TTL (ms)
 */
public record RateLimitSettings(
        long emissionIntervalMs,
        long burstToleranceMs,
        long keyExpirationMs
) {
    private static final long MIN_KEY_EXPIRATION_MS = 60_000L;

    public RateLimitSettings {
        if (emissionIntervalMs <= 0) {
            throw new IllegalArgumentException("emissionIntervalMs must be positive: " + emissionIntervalMs);
        }
        if (burstToleranceMs < 0) {
            throw new IllegalArgumentException("burstToleranceMs must not be negative: " + burstToleranceMs);
        }
        if (keyExpirationMs <= 0) {
            keyExpirationMs = defaultKeyExpiration(emissionIntervalMs, burstToleranceMs);
        }
    }

    /**
     * 기본 TTL로 생성: max(60000, emissionInterval + burstTolerance)
     */
    public static RateLimitSettings of(long emissionIntervalMs, long burstToleranceMs) {
        return new RateLimitSettings(emissionIntervalMs, burstToleranceMs,
                defaultKeyExpiration(emissionIntervalMs, burstToleranceMs));
    }

    private static long defaultKeyExpiration(long emissionIntervalMs, long burstToleranceMs) {
        return Math.max(MIN_KEY_EXPIRATION_MS, emissionIntervalMs + burstToleranceMs);
    }
}
