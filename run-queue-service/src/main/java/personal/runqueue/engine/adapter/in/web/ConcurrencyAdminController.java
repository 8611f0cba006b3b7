package personal.runqueue.engine.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.runqueue.common.dto.ApiResponse;
import personal.runqueue.engine.adapter.in.web.dto.ConcurrencyLimitRequest;
import personal.runqueue.engine.adapter.in.web.dto.QueueRateLimitRequest;
import personal.runqueue.engine.application.port.in.ConcurrencyAdminUseCase;
import personal.runqueue.engine.domain.model.ConcurrencyState;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentType;
import personal.runqueue.engine.domain.model.QueueDescriptor;

/**
 * 운영자용 동시성 / 속도 제한 관리 Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/run-queue/admin")
@RequiredArgsConstructor
public class ConcurrencyAdminController {

    private static final String ENV_PATH = "/orgs/{orgId}/projects/{projectId}/envs/{envId}";
    private static final String QUEUE_PATH = ENV_PATH + "/queues/{queue}";

    private final ConcurrencyAdminUseCase concurrencyAdminUseCase;

    @PutMapping("/orgs/{orgId}/concurrency-limit")
    public ResponseEntity<ApiResponse<Void>> updateOrgLimit(
            @PathVariable String orgId,
            @Valid @RequestBody ConcurrencyLimitRequest request) {

        log.info("Update org concurrency limit: orgId={}, limit={}", orgId, request.limit());
        concurrencyAdminUseCase.updateOrgConcurrencyLimit(orgId, request.limit());
        return ResponseEntity.ok(ApiResponse.success("조직 동시성 제한이 변경되었습니다."));
    }

    @DeleteMapping("/orgs/{orgId}/concurrency-limit")
    public ResponseEntity<ApiResponse<Void>> removeOrgLimit(@PathVariable String orgId) {
        log.info("Remove org concurrency limit: orgId={}", orgId);
        concurrencyAdminUseCase.removeOrgConcurrencyLimit(orgId);
        return ResponseEntity.ok(ApiResponse.success("조직 동시성 제한이 기본값으로 복원되었습니다."));
    }

    @PutMapping(ENV_PATH + "/concurrency-limit")
    public ResponseEntity<ApiResponse<Void>> updateEnvLimit(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @Valid @RequestBody ConcurrencyLimitRequest request) {

        log.info("Update env concurrency limit: orgId={}, envId={}, limit={}", orgId, envId, request.limit());
        concurrencyAdminUseCase.updateEnvConcurrencyLimit(env(orgId, projectId, envId), request.limit());
        return ResponseEntity.ok(ApiResponse.success("환경 동시성 제한이 변경되었습니다."));
    }

    @DeleteMapping(ENV_PATH + "/concurrency-limit")
    public ResponseEntity<ApiResponse<Void>> removeEnvLimit(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId) {

        log.info("Remove env concurrency limit: orgId={}, envId={}", orgId, envId);
        concurrencyAdminUseCase.removeEnvConcurrencyLimit(env(orgId, projectId, envId));
        return ResponseEntity.ok(ApiResponse.success("환경 동시성 제한이 기본값으로 복원되었습니다."));
    }

    @PutMapping(QUEUE_PATH + "/concurrency-limit")
    public ResponseEntity<ApiResponse<Void>> updateQueueLimit(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @PathVariable String queue,
            @Valid @RequestBody ConcurrencyLimitRequest request) {

        log.info("Update queue concurrency limit: orgId={}, envId={}, queue={}, limit={}",
                orgId, envId, queue, request.limit());
        concurrencyAdminUseCase.updateQueueConcurrencyLimit(
                new QueueDescriptor(orgId, projectId, envId, queue), request.limit());
        return ResponseEntity.ok(ApiResponse.success("큐 동시성 제한이 변경되었습니다."));
    }

    @DeleteMapping(QUEUE_PATH + "/concurrency-limit")
    public ResponseEntity<ApiResponse<Void>> removeQueueLimit(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @PathVariable String queue) {

        log.info("Remove queue concurrency limit: orgId={}, envId={}, queue={}", orgId, envId, queue);
        concurrencyAdminUseCase.removeQueueConcurrencyLimit(new QueueDescriptor(orgId, projectId, envId, queue));
        return ResponseEntity.ok(ApiResponse.success("큐 동시성 제한이 기본값으로 복원되었습니다."));
    }

    @PutMapping(QUEUE_PATH + "/rate-limit")
    public ResponseEntity<ApiResponse<Void>> setQueueRateLimit(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @PathVariable String queue,
            @Valid @RequestBody QueueRateLimitRequest request) {

        concurrencyAdminUseCase.setQueueRateLimit(
                new QueueDescriptor(orgId, projectId, envId, queue), request.toSettings());
        return ResponseEntity.ok(ApiResponse.success("큐 속도 제한이 설정되었습니다."));
    }

    @DeleteMapping(QUEUE_PATH + "/rate-limit")
    public ResponseEntity<ApiResponse<Void>> removeQueueRateLimit(
            @PathVariable String orgId,
            @PathVariable String projectId,
            @PathVariable String envId,
            @PathVariable String queue) {

        concurrencyAdminUseCase.removeQueueRateLimit(new QueueDescriptor(orgId, projectId, envId, queue));
        return ResponseEntity.ok(ApiResponse.success("큐 속도 제한이 해제되었습니다."));
    }

    /**
     * GET /api/v1/run-queue/admin/concurrency/{groupName}/{groupId}
     */
    @GetMapping("/concurrency/{groupName}/{groupId}")
    public ResponseEntity<ApiResponse<ConcurrencyState>> getState(
            @PathVariable String groupName,
            @PathVariable String groupId) {

        ConcurrencyState state = concurrencyAdminUseCase.getConcurrencyState(groupName, groupId);
        return ResponseEntity.ok(ApiResponse.success("동시성 상태 조회 완료", state));
    }

    /**
     * 장애 복구용: 그룹의 in-flight 집합 초기화
     * DELETE /api/v1/run-queue/admin/concurrency/{groupName}/{groupId}
     */
    @DeleteMapping("/concurrency/{groupName}/{groupId}")
    public ResponseEntity<ApiResponse<Void>> clearGroup(
            @PathVariable String groupName,
            @PathVariable String groupId) {

        log.info("Clear concurrency group request: group={}, groupId={}", groupName, groupId);
        concurrencyAdminUseCase.clearConcurrencyGroup(groupName, groupId);
        return ResponseEntity.ok(ApiResponse.success("동시성 그룹이 초기화되었습니다."));
    }

    private EnvironmentDescriptor env(String orgId, String projectId, String envId) {
        return new EnvironmentDescriptor(orgId, projectId, envId, EnvironmentType.PRODUCTION);
    }
}
