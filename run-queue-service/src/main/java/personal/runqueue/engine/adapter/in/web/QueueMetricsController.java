package personal.runqueue.engine.adapter.in.web;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.runqueue.common.dto.ApiResponse;
import personal.runqueue.engine.application.port.in.QueueIntrospectionUseCase;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentMetrics;
import personal.runqueue.engine.domain.model.EnvironmentType;
import personal.runqueue.engine.domain.model.QueueMetrics;

import java.util.List;
import java.util.Map;

/**
 * 큐 / 환경 조회 Controller
 * 환경 유형은 키 구성에 쓰이지 않으므로 조회에서는 선택값입니다.
 */
@RestController
@RequestMapping("/api/v1/run-queue/orgs/{orgId}/projects/{projectId}/envs/{envId}")
@RequiredArgsConstructor
public class QueueMetricsController {

    private final QueueIntrospectionUseCase queueIntrospectionUseCase;

    /**
     * GET /api/v1/run-queue/orgs/{orgId}/projects/{projectId}/envs/{envId}/metrics
     */
    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<EnvironmentMetrics>> environmentMetrics(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId) {

        EnvironmentMetrics metrics = queueIntrospectionUseCase.environmentMetrics(env(orgId, projectId, envId));
        return ResponseEntity.ok(ApiResponse.success("환경 메트릭 조회 완료", metrics));
    }

    /**
     * GET .../queues/{queue}/metrics
     */
    @GetMapping("/queues/{queue}/metrics")
    public ResponseEntity<ApiResponse<QueueMetrics>> queueMetrics(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @PathVariable String queue) {

        QueueMetrics metrics = queueIntrospectionUseCase.queueMetrics(env(orgId, projectId, envId).queue(queue));
        return ResponseEntity.ok(ApiResponse.success("큐 메트릭 조회 완료", metrics));
    }

    /**
     * GET .../queues/lengths?queues=a,b
     */
    @GetMapping("/queues/lengths")
    public ResponseEntity<ApiResponse<Map<String, Long>>> lengthOfQueues(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @RequestParam List<String> queues) {

        Map<String, Long> lengths = queueIntrospectionUseCase.lengthOfQueues(env(orgId, projectId, envId), queues);
        return ResponseEntity.ok(ApiResponse.success("큐 길이 조회 완료", lengths));
    }

    /**
     * GET .../queues/concurrency?queues=a,b
     */
    @GetMapping("/queues/concurrency")
    public ResponseEntity<ApiResponse<Map<String, Long>>> currentConcurrencyOfQueues(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @RequestParam List<String> queues) {

        Map<String, Long> current = queueIntrospectionUseCase.currentConcurrencyOfQueues(
                env(orgId, projectId, envId), queues);
        return ResponseEntity.ok(ApiResponse.success("큐 동시성 조회 완료", current));
    }

    private EnvironmentDescriptor env(String orgId, String projectId, String envId) {
        return new EnvironmentDescriptor(orgId, projectId, envId, EnvironmentType.PRODUCTION);
    }
}
