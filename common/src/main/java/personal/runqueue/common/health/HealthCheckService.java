package personal.runqueue.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Health Check 공통 서비스
 * 런 큐의 유일한 인프라 의존성인 Redis 상태를 확인
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Redis 연결 상태 확인
     *
     * @return "UP" if Redis is reachable, "DOWN" otherwise
     */
    public String checkRedis() {
        try {
            String response = redisTemplate.execute((RedisConnection connection) -> connection.ping());
            return "PONG".equals(response) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Redis health check failed", e);
            return "DOWN";
        }
    }
}
