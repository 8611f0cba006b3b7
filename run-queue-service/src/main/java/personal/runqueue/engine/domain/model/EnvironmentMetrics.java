package personal.runqueue.engine.domain.model;

/**
 * 환경 단위 메트릭 스냅샷
 */
public record EnvironmentMetrics(
        long length,
        long deadLetterLength,
        long concurrency,
        long concurrencyLimit,
        long capacity
) {
}
