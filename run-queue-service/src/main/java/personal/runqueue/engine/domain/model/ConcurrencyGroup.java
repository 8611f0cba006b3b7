package personal.runqueue.engine.domain.model;

import personal.runqueue.engine.domain.exception.UnknownConcurrencyGroupException;

import java.util.Arrays;

/**
 * 동시성 그룹 (닫힌 집합)
 *
 * 각 그룹은 큐 디스크립터에서 그룹 ID를 추출하는 규칙을 가집니다.
 * 기본 제한값과 override 조회는 {@link ConcurrencyLimitPolicy}가 담당합니다.
 */
public enum ConcurrencyGroup {

    ORGANIZATION("organization") {
        @Override
        public String groupId(QueueDescriptor descriptor) {
            return descriptor.orgId();
        }
    },
    ENVIRONMENT("environment") {
        @Override
        public String groupId(QueueDescriptor descriptor) {
            return descriptor.envId();
        }
    },
    QUEUE("queue") {
        // 큐 이름은 환경 안에서만 유일하므로 환경 ID와 결합
        @Override
        public String groupId(QueueDescriptor descriptor) {
            return descriptor.envId() + ":" + descriptor.queue();
        }
    };

    private final String groupName;

    ConcurrencyGroup(String groupName) {
        this.groupName = groupName;
    }

    public abstract String groupId(QueueDescriptor descriptor);

    public String groupName() {
        return groupName;
    }

    /**
     * 그룹 이름으로 조회
     *
     * @throws UnknownConcurrencyGroupException 등록되지 않은 이름
     */
    public static ConcurrencyGroup fromName(String groupName) {
        return Arrays.stream(values())
                .filter(group -> group.groupName.equalsIgnoreCase(groupName))
                .findFirst()
                .orElseThrow(() -> new UnknownConcurrencyGroupException(groupName));
    }
}
