package personal.runqueue.engine.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * 워커 큐 push 요청 DTO
 */
public record WorkerQueuePushRequest(
        @NotEmpty(message = "항목은 하나 이상 필요합니다.")
        List<@NotBlank String> entries
) {
}
