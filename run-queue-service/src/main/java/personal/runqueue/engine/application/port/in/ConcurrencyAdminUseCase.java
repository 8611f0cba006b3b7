package personal.runqueue.engine.application.port.in;

import personal.runqueue.engine.domain.model.ConcurrencyState;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.QueueDescriptor;
import personal.runqueue.engine.domain.model.RateLimitSettings;

/**
 * 동시성 제한 / 큐 속도 제한 관리 UseCase
 */
public interface ConcurrencyAdminUseCase {

    void updateQueueConcurrencyLimit(QueueDescriptor queue, long limit);

    void removeQueueConcurrencyLimit(QueueDescriptor queue);

    void updateEnvConcurrencyLimit(EnvironmentDescriptor env, long limit);

    void removeEnvConcurrencyLimit(EnvironmentDescriptor env);

    void updateOrgConcurrencyLimit(String orgId, long limit);

    void removeOrgConcurrencyLimit(String orgId);

    ConcurrencyState getConcurrencyState(String groupName, String groupId);

    /**
     * 장애 복구용: 그룹의 active set 전체 삭제
     */
    void clearConcurrencyGroup(String groupName, String groupId);

    void setQueueRateLimit(QueueDescriptor queue, RateLimitSettings settings);

    void removeQueueRateLimit(QueueDescriptor queue);
}
