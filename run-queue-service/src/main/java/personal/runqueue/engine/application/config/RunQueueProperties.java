package personal.runqueue.engine.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import personal.runqueue.engine.domain.model.ConcurrencyGroup;
import personal.runqueue.engine.domain.model.ConcurrencyLimitPolicy;
import personal.runqueue.engine.domain.model.RateLimitSettings;
import personal.runqueue.engine.domain.model.RetryOptions;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Run Queue 설정 Properties
 * application.yml의 run-queue.* 설정을 바인딩
 *
 * 생략된 블록은 기본값으로 채워집니다.
 */
@ConfigurationProperties(prefix = "run-queue")
public record RunQueueProperties(
        String keyPrefix,
        boolean clusterHashTag,
        Concurrency concurrency,
        Retry retry,
        Selection selection,
        DequeueRateLimit dequeueRateLimit
) {
    public RunQueueProperties {
        keyPrefix = keyPrefix == null ? "runqueue" : keyPrefix;
        concurrency = concurrency == null ? Concurrency.defaults() : concurrency;
        retry = retry == null ? Retry.defaults() : retry;
        selection = selection == null ? Selection.defaults() : selection;
        dequeueRateLimit = dequeueRateLimit == null ? DequeueRateLimit.disabled() : dequeueRateLimit;
    }

    /**
     * @param groups            평가 순서대로 나열한 그룹 이름 (organization, environment, queue)
     * @param defaultOrgLimit   조직 기본 제한값
     * @param defaultEnvLimit   환경 기본 제한값
     * @param defaultQueueLimit 큐 기본 제한값
     * @param overrides         그룹 이름 → 그룹 ID → 제한값
     * @param limitCacheTtl     제한값 캐시 TTL
     * @param limitCacheMaxSize 제한값 캐시 최대 크기
     */
    public record Concurrency(
            List<String> groups,
            int defaultOrgLimit,
            int defaultEnvLimit,
            int defaultQueueLimit,
            Map<String, Map<String, Integer>> overrides,
            Duration limitCacheTtl,
            long limitCacheMaxSize
    ) {
        public Concurrency {
            groups = groups == null || groups.isEmpty()
                    ? List.of("organization", "environment", "queue")
                    : List.copyOf(groups);
            overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
            limitCacheTtl = limitCacheTtl == null ? Duration.ofSeconds(60) : limitCacheTtl;
            limitCacheMaxSize = limitCacheMaxSize <= 0 ? 10_000 : limitCacheMaxSize;
        }

        static Concurrency defaults() {
            return new Concurrency(null, 100, 100, 1_000_000, null, null, 0);
        }

        /**
         * 그룹 이름을 검증하고 정책으로 변환
         *
         * @throws personal.runqueue.engine.domain.exception.UnknownConcurrencyGroupException 알 수 없는 그룹 이름
         */
        public ConcurrencyLimitPolicy toLimitPolicy() {
            List<ConcurrencyGroup> resolved = groups.stream()
                    .map(ConcurrencyGroup::fromName)
                    .toList();

            Map<ConcurrencyGroup, Integer> defaults = new EnumMap<>(ConcurrencyGroup.class);
            defaults.put(ConcurrencyGroup.ORGANIZATION, defaultOrgLimit);
            defaults.put(ConcurrencyGroup.ENVIRONMENT, defaultEnvLimit);
            defaults.put(ConcurrencyGroup.QUEUE, defaultQueueLimit);

            Map<ConcurrencyGroup, Map<String, Integer>> staticOverrides = new EnumMap<>(ConcurrencyGroup.class);
            overrides.forEach((groupName, byId) ->
                    staticOverrides.put(ConcurrencyGroup.fromName(groupName), Map.copyOf(byId)));

            return new ConcurrencyLimitPolicy(resolved, defaults, staticOverrides);
        }
    }

    public record Retry(
            int maxAttempts,
            double factor,
            long minTimeoutInMs,
            long maxTimeoutInMs,
            boolean randomize
    ) {
        static Retry defaults() {
            RetryOptions options = RetryOptions.DEFAULT;
            return new Retry(options.maxAttempts(), options.factor(), options.minTimeoutInMs(),
                    options.maxTimeoutInMs(), options.randomize());
        }

        public RetryOptions toRetryOptions() {
            return new RetryOptions(maxAttempts, factor, minTimeoutInMs, maxTimeoutInMs, randomize);
        }
    }

    /**
     * @param fairnessUnit     공정성 단위 (environment | queue)
     * @param parentQueueLimit 마스터 큐에서 한 번에 조회할 후보 큐 수
     * @param weights          테넌트 ID → 몫 가중치 (기본 1)
     */
    public record Selection(
            String fairnessUnit,
            int parentQueueLimit,
            Map<String, Double> weights
    ) {
        public Selection {
            fairnessUnit = fairnessUnit == null ? "environment" : fairnessUnit;
            parentQueueLimit = parentQueueLimit <= 0 ? 100 : parentQueueLimit;
            weights = weights == null ? Map.of() : Map.copyOf(weights);
        }

        static Selection defaults() {
            return new Selection(null, 0, null);
        }

        public boolean fairnessByQueue() {
            return "queue".equalsIgnoreCase(fairnessUnit);
        }
    }

    /**
     * dequeue 엔드포인트의 컨슈머별 GCRA 설정 (ms)
     */
    public record DequeueRateLimit(
            boolean enabled,
            long emissionInterval,
            long burstTolerance,
            long keyExpiration
    ) {
        static DequeueRateLimit disabled() {
            return new DequeueRateLimit(false, 100, 1_000, 0);
        }

        public RateLimitSettings toSettings() {
            return new RateLimitSettings(emissionInterval, burstTolerance, keyExpiration);
        }
    }
}
