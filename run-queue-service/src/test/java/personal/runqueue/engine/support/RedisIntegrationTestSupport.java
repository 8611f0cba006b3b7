package personal.runqueue.engine.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.test.context.ActiveProfiles;
import personal.runqueue.engine.adapter.out.redis.ConcurrencyLimitCache;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Redis 통합 테스트 공통 설정
 * Docker가 없는 환경에서는 건너뜁니다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(RedisTestContainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
public abstract class RedisIntegrationTestSupport {

    @Autowired
    protected RedisTemplate<String, String> redisTemplate;

    @Autowired
    private ConcurrencyLimitCache concurrencyLimitCache;

    @BeforeEach
    void flushRedis() {
        redisTemplate.execute((RedisCallback<Void>) (RedisConnection connection) -> {
            connection.serverCommands().flushDb();
            return null;
        });
        concurrencyLimitCache.invalidateAll();
    }
}
