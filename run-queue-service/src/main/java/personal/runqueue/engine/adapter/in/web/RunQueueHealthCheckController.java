package personal.runqueue.engine.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.runqueue.common.dto.ApiResponse;
import personal.runqueue.common.dto.HealthCheckResponse;
import personal.runqueue.common.health.HealthCheckService;

/**
 * Run Queue Service Health Check Controller
 * Redis 상태만 확인
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RunQueueHealthCheckController {

    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Run queue health check requested");

        HealthCheckResponse data = HealthCheckResponse.forRunQueueService(healthCheckService.checkRedis());

        if (data.healthy()) {
            return ResponseEntity.ok(ApiResponse.success("Run queue service is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
