package personal.runqueue.engine.domain.model;

/**
 * 동시성 상태 (읽기 전용 뷰)
 * current는 active set의 크기이며 별도로 저장되지 않습니다.
 */
public record ConcurrencyState(
        String groupName,
        String groupId,
        long current,
        long limit
) {
    public boolean isAtCapacity() {
        return current >= limit;
    }

    /**
     * 남은 슬롯 수 (제한이 낮아진 경우 음수가 될 수 있음)
     */
    public long capacity() {
        return limit - current;
    }
}
