package personal.runqueue.engine.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import personal.runqueue.engine.application.port.in.DequeueMessageUseCase.DequeueMessageCommand;

/**
 * 메시지 dequeue 요청 DTO
 */
public record DequeueMessageRequest(
        @NotBlank(message = "컨슈머 ID는 필수입니다.")
        String consumerId,

        @NotBlank(message = "마스터 큐 이름은 필수입니다.")
        String masterQueue,

        @Min(value = 1, message = "maxCount는 1 이상이어야 합니다.")
        @Max(value = 1000, message = "maxCount는 1000 이하여야 합니다.")
        int maxCount
) {
    public DequeueMessageCommand toCommand() {
        return new DequeueMessageCommand(consumerId, masterQueue, maxCount);
    }
}
