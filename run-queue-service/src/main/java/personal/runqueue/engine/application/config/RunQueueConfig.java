package personal.runqueue.engine.application.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.runqueue.engine.domain.model.CandidateQueue;
import personal.runqueue.engine.domain.model.ConcurrencyLimitPolicy;
import personal.runqueue.engine.domain.model.RetryOptions;
import personal.runqueue.engine.domain.service.RetryBackoffCalculator;
import personal.runqueue.engine.domain.service.StrideSchedulingPlanner;

import java.time.Clock;

/**
 * Run Queue 도메인 빈 설정
 */
@Configuration
@EnableConfigurationProperties(RunQueueProperties.class)
public class RunQueueConfig {

    @Bean
    public Clock runQueueClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConcurrencyLimitPolicy concurrencyLimitPolicy(RunQueueProperties properties) {
        return properties.concurrency().toLimitPolicy();
    }

    @Bean
    public RetryOptions retryOptions(RunQueueProperties properties) {
        return properties.retry().toRetryOptions();
    }

    @Bean
    public RetryBackoffCalculator retryBackoffCalculator() {
        return new RetryBackoffCalculator();
    }

    /**
     * 공정성 단위: 환경(기본) 또는 큐
     */
    @Bean
    public StrideSchedulingPlanner strideSchedulingPlanner(RunQueueProperties properties) {
        RunQueueProperties.Selection selection = properties.selection();
        if (selection.fairnessByQueue()) {
            return new StrideSchedulingPlanner(CandidateQueue::queueKey, selection.weights());
        }
        return new StrideSchedulingPlanner(candidate -> candidate.descriptor().envId(), selection.weights());
    }
}
