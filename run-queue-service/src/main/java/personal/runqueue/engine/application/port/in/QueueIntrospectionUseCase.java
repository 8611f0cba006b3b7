package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentMetrics;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.QueueMessage;
import personal.runqueue.engine.domain.model.QueueMetrics;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 조회 전용 UseCase
 * 상태나 예약을 변경하지 않습니다.
 */
public interface QueueIntrospectionUseCase {

    long lengthOfQueue(QueueDescriptor queue);

    Map<String, Long> lengthOfQueues(EnvironmentDescriptor env, List<String> queues);

    long lengthOfEnvQueue(EnvironmentDescriptor env);

    long lengthOfDeadLetterQueue(EnvironmentDescriptor env);

    long currentConcurrencyOfQueue(QueueDescriptor queue);

    Map<String, Long> currentConcurrencyOfQueues(EnvironmentDescriptor env, List<String> queues);

    long currentConcurrencyOfEnvironment(EnvironmentDescriptor env);

    long currentConcurrencyOfOrg(String orgId);

    /**
     * 큐 제한값 (환경 제한값으로 상한)
     */
    long getQueueConcurrencyLimit(QueueDescriptor queue);

    long getEnvConcurrencyLimit(EnvironmentDescriptor env);

    long getOrgConcurrencyLimit(String orgId);

    /**
     * 가장 오래된 ready 메시지의 점수 (epoch ms)
     */
    Optional<Long> oldestMessageInQueue(QueueDescriptor queue);

    Optional<QueueMessage> readMessage(String orgId, String messageId);

    boolean messageInDeadLetterQueue(String orgId, String messageId);

    QueueMetrics queueMetrics(QueueDescriptor queue);

    EnvironmentMetrics environmentMetrics(EnvironmentDescriptor env);
}
