package personal.runqueue.engine.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase.EnqueueMessageCommand;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentType;

import java.util.List;

/**
 * 메시지 등록 요청 DTO
 */
public record EnqueueMessageRequest(
        @NotBlank(message = "조직 ID는 필수입니다.")
        String orgId,

        @NotBlank(message = "프로젝트 ID는 필수입니다.")
        String projectId,

        @NotBlank(message = "환경 ID는 필수입니다.")
        String envId,

        @NotNull(message = "환경 유형은 필수입니다.")
        EnvironmentType envType,

        @NotBlank(message = "큐 이름은 필수입니다.")
        String queue,

        @NotBlank(message = "메시지 ID는 필수입니다.")
        String messageId,

        String payload,

        @NotEmpty(message = "마스터 큐는 하나 이상 필요합니다.")
        List<@NotBlank String> masterQueues,

        Long timestamp
) {
    public EnqueueMessageCommand toCommand() {
        return new EnqueueMessageCommand(
                new EnvironmentDescriptor(orgId, projectId, envId, envType),
                queue,
                messageId,
                payload,
                masterQueues,
                timestamp);
    }
}
