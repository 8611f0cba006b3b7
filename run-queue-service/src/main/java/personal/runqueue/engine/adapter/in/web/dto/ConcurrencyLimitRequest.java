package personal.runqueue.engine.adapter.in.web.dto;

import jakarta.validation.constraints.Min;

/**
 * 동시성 제한 변경 요청 DTO
 */
public record ConcurrencyLimitRequest(
        @Min(value = 0, message = "제한 값은 0 이상이어야 합니다.")
        long limit
) {
}
