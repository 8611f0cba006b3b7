package personal.runqueue.engine.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 동시성 제한 정책
 *
 * @param groups        평가 순서대로 나열된 활성 그룹
 * @param defaultLimits 그룹별 기본 제한값
 * @param overrides     설정 파일로 고정한 그룹 ID별 제한값 (Redis override보다 우선순위 낮음)
 */
public record ConcurrencyLimitPolicy(
        List<ConcurrencyGroup> groups,
        Map<ConcurrencyGroup, Integer> defaultLimits,
        Map<ConcurrencyGroup, Map<String, Integer>> overrides
) {
    public ConcurrencyLimitPolicy {
        groups = List.copyOf(groups);
        defaultLimits = Map.copyOf(defaultLimits);
        overrides = Map.copyOf(overrides);
    }

    /**
     * Redis에 override가 없을 때 적용할 제한값
     */
    public int fallbackLimit(ConcurrencyGroup group, String groupId) {
        return Optional.ofNullable(overrides.get(group))
                .map(byId -> byId.get(groupId))
                .orElseGet(() -> defaultLimits.getOrDefault(group, Integer.MAX_VALUE));
    }
}
