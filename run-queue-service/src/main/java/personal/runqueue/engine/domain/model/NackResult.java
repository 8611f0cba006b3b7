package personal.runqueue.engine.domain.model;

/**
 * nack 처리 결과
 *
 * @param outcome 처리 결과
 * @param attempt 처리 후 attempt (메시지가 없으면 -1)
 * @param retryAt 재시도 가능 시각 (REQUEUED일 때만)
 */
public record NackResult(
        Outcome outcome,
        int attempt,
        Long retryAt
) {
    public enum Outcome {
        REQUEUED,
        DEAD_LETTERED,
        NOT_FOUND
    }

    public static NackResult requeued(int attempt, long retryAt) {
        return new NackResult(Outcome.REQUEUED, attempt, retryAt);
    }

    public static NackResult deadLettered(int attempt) {
        return new NackResult(Outcome.DEAD_LETTERED, attempt, null);
    }

    public static NackResult notFound() {
        return new NackResult(Outcome.NOT_FOUND, -1, null);
    }
}
