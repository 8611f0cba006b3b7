package personal.runqueue.engine.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Testcontainers 설정 클래스
 * 실제 Redis 컨테이너로 Lua 스크립트까지 검증
 */
@TestConfiguration(proxyBeanMethods = false)
public class RedisTestContainersConfiguration {

    /**
     * Redis 컨테이너
     * @ServiceConnection을 사용하여 자동으로 Redis 설정
     */
    @Bean
    @ServiceConnection(name = "redis")
    GenericContainer<?> redisContainer() {
        return new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine"))
                .withExposedPorts(6379);
    }
}
