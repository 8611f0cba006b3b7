package personal.runqueue.engine.domain.model;

/**
 * 워커 큐 pop 결과
 *
 * @param entry           꺼낸 항목
 * @param remainingLength pop 이후 남은 길이
 */
public record WorkerQueuePopResult(
        String entry,
        long remainingLength
) {
}
