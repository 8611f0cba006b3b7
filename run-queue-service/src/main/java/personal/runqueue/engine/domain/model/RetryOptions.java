package personal.runqueue.engine.domain.model;

/**
 * 메시지 재시도 옵션
 *
 * @param maxAttempts    최대 시도 횟수 (도달 시 데드 레터)
 * @param factor         지수 백오프 배수
 * @param minTimeoutInMs 첫 재시도 지연
 * @param maxTimeoutInMs 지연 상한
 * @param randomize      지터 적용 여부
 */
public record RetryOptions(
        int maxAttempts,
        double factor,
        long minTimeoutInMs,
        long maxTimeoutInMs,
        boolean randomize
) {
    public static final RetryOptions DEFAULT = new RetryOptions(5, 2, 1_000, 3_600_000, true);

    public RetryOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (factor < 1) {
            throw new IllegalArgumentException("factor must be at least 1: " + factor);
        }
        if (minTimeoutInMs < 0 || maxTimeoutInMs < minTimeoutInMs) {
            throw new IllegalArgumentException(
                    "invalid timeout range: min=" + minTimeoutInMs + ", max=" + maxTimeoutInMs);
        }
    }
}
