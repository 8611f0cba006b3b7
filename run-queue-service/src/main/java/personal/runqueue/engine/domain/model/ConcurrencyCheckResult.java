package personal.runqueue.engine.domain.model;

/**
 * canProcess 평가 결과
 *
 * @param allowed   모든 그룹에 여유가 있으면 true
 * @param blockedBy 처음으로 가득 찬 그룹의 상태 (allowed이면 null)
 */
public record ConcurrencyCheckResult(
        boolean allowed,
        ConcurrencyState blockedBy
) {
    public static ConcurrencyCheckResult allow() {
        return new ConcurrencyCheckResult(true, null);
    }

    public static ConcurrencyCheckResult blocked(ConcurrencyState state) {
        return new ConcurrencyCheckResult(false, state);
    }
}
