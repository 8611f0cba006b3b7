package personal.runqueue.engine.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis Configuration
 * String Key, String Value 기반 RedisTemplate과 Lua Script 빈 설정
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        // Key Serializer: String
        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);

        // Value Serializer: String (메시지는 JSON 문자열로 저장)
        template.setValueSerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public RedisScript<Long> gcraCheckScript() {
        return RedisScript.of(new ClassPathResource("scripts/gcra_check.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> reserveConcurrencyScript() {
        return RedisScript.of(new ClassPathResource("scripts/reserve_concurrency.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> releaseConcurrencyScript() {
        return RedisScript.of(new ClassPathResource("scripts/release_concurrency.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> enqueueMessageScript() {
        return RedisScript.of(new ClassPathResource("scripts/enqueue_message.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> acknowledgeMessageScript() {
        return RedisScript.of(new ClassPathResource("scripts/acknowledge_message.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> nackMessageScript() {
        return RedisScript.of(new ClassPathResource("scripts/nack_message.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> moveToDeadLetterScript() {
        return RedisScript.of(new ClassPathResource("scripts/move_to_dead_letter.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> rebalanceMasterQueuesScript() {
        return RedisScript.of(new ClassPathResource("scripts/rebalance_master_queues.lua"), Long.class);
    }

    @Bean
    public RedisScript<String> strideSyncPassesScript() {
        return RedisScript.of(new ClassPathResource("scripts/stride_sync_passes.lua"), String.class);
    }

    @Bean
    public RedisScript<Long> strideAdvancePassScript() {
        return RedisScript.of(new ClassPathResource("scripts/stride_advance_pass.lua"), Long.class);
    }

    @Bean
    public RedisScript<String> workerQueuePopScript() {
        return RedisScript.of(new ClassPathResource("scripts/worker_queue_pop.lua"), String.class);
    }
}
