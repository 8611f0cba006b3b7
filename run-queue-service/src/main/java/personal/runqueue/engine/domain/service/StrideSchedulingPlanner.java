package personal.runqueue.engine.domain.service;

import personal.runqueue.engine.domain.model.CandidateQueue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Stride Scheduling 기반 공정 순서 결정 (순수 로직)
 *
 * 테넌트마다 pass(가상 시간)를 가지고, 메시지를 꺼낼 때마다 pass += count / weight 만큼 증가합니다.
 * - pass 오름차순으로 서비스, 동률이면 테넌트 ID 사전순
 * - 테넌트 안에서는 가장 오래된 메시지를 가진 큐 우선, 동률이면 큐 키 사전순
 *
 * 기아 상한: 가중치가 같은 T개의 테넌트가 모두 메시지와 동시성 여유를 가지면,
 * 각 테넌트는 T번의 선택 안에 최소 한 번 서비스됩니다.
 *
 * 테넌트 단위(환경 또는 큐)는 tenantOf 함수로 결정합니다.
 */
public class StrideSchedulingPlanner {

    private static final double DEFAULT_WEIGHT = 1.0;

    private static final Comparator<CandidateQueue> OLDEST_FIRST = Comparator
            .comparingLong(CandidateQueue::oldestScore)
            .thenComparing(CandidateQueue::queueKey);

    private final Function<CandidateQueue, String> tenantOf;
    private final Map<String, Double> weights;

    public StrideSchedulingPlanner(Function<CandidateQueue, String> tenantOf, Map<String, Double> weights) {
        this.tenantOf = tenantOf;
        this.weights = Map.copyOf(weights);
    }

    public String tenantOf(CandidateQueue candidate) {
        return tenantOf.apply(candidate);
    }

    /**
     * 메시지 count개를 꺼냈을 때 증가할 pass
     */
    public double strideFor(String tenant, int count) {
        double weight = weights.getOrDefault(tenant, DEFAULT_WEIGHT);
        return count / (weight > 0 ? weight : DEFAULT_WEIGHT);
    }

    /**
     * 후보 큐를 테넌트별로 묶습니다 (입력 순서 유지).
     */
    public Map<String, List<CandidateQueue>> groupByTenant(List<CandidateQueue> candidates) {
        Map<String, List<CandidateQueue>> byTenant = new LinkedHashMap<>();
        for (CandidateQueue candidate : candidates) {
            byTenant.computeIfAbsent(tenantOf.apply(candidate), key -> new ArrayList<>()).add(candidate);
        }
        return byTenant;
    }

    /**
     * @param candidates 마스터 큐의 후보 큐
     * @param passes     테넌트별 pass (없는 테넌트는 0으로 간주)
     * @return 서비스할 순서대로 정렬된 큐
     */
    public List<CandidateQueue> order(List<CandidateQueue> candidates, Map<String, Double> passes) {
        Map<String, List<CandidateQueue>> byTenant = groupByTenant(candidates);

        List<String> tenants = byTenant.keySet().stream()
                .sorted(Comparator
                        .comparingDouble((String tenant) -> passes.getOrDefault(tenant, 0.0))
                        .thenComparing(Comparator.naturalOrder()))
                .toList();

        List<CandidateQueue> ordered = new ArrayList<>();
        for (String tenant : tenants) {
            byTenant.get(tenant).stream()
                    .sorted(OLDEST_FIRST)
                    .forEach(ordered::add);
        }
        return ordered;
    }
}
