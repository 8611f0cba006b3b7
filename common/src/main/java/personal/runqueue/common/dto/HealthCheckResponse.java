package personal.runqueue.common.dto;

import java.util.Map;

/**
 * Health Check 응답
 *
 * @param service    서비스 이름
 * @param components 컴포넌트별 상태 ("UP" / "DOWN")
 */
public record HealthCheckResponse(
        String service,
        Map<String, String> components
) {
    public static HealthCheckResponse forRunQueueService(String redisStatus) {
        return new HealthCheckResponse("run-queue-service", Map.of("redis", redisStatus));
    }

    public boolean healthy() {
        return components.values().stream().allMatch("UP"::equals);
    }
}
