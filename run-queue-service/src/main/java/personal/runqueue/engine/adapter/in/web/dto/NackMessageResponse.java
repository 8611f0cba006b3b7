package personal.runqueue.engine.adapter.in.web.dto;

import personal.runqueue.engine.domain.model.NackResult;

/**
 * nack 결과 응답 DTO
 */
public record NackMessageResponse(
        String outcome,
        int attempt,
        Long retryAt
) {
    public static NackMessageResponse from(NackResult result) {
        return new NackMessageResponse(result.outcome().name(), result.attempt(), result.retryAt());
    }
}
