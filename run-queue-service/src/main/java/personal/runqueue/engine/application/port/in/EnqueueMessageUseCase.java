package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.EnvironmentDescriptor;

import java.util.List;

/**
 * 메시지 등록 UseCase
 */
public interface EnqueueMessageUseCase {

    /**
     * 메시지를 큐의 ready 구조에 등록합니다.
     * 동일 메시지 ID는 마지막 payload로 덮어씁니다.
     */
    void enqueue(EnqueueMessageCommand command);

    /**
     * @param env          메시지가 속한 환경
     * @param queue        대상 큐 이름
     * @param messageId    메시지 ID
     * @param payload      불투명 payload
     * @param masterQueues 큐를 등록할 마스터 큐 이름들
     * @param timestamp    ready 점수로 쓸 시각 (null이면 현재 시각)
     */
    record EnqueueMessageCommand(
            EnvironmentDescriptor env,
            String queue,
            String messageId,
            String payload,
            List<String> masterQueues,
            Long timestamp
    ) {
    }
}
