package personal.runqueue.engine.domain.model;

/**
 * 큐 단위 메트릭 스냅샷
 *
 * @param length              ready 메시지 수
 * @param concurrency         in-flight 메시지 수
 * @param concurrencyLimit    유효 제한값
 * @param capacity            limit - current
 * @param oldestMessageAgeMs  가장 오래된 ready 메시지의 나이 (없으면 0)
 */
public record QueueMetrics(
        long length,
        long concurrency,
        long concurrencyLimit,
        long capacity,
        long oldestMessageAgeMs
) {
}
