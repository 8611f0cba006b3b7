package personal.runqueue.engine.domain.service;

import personal.runqueue.engine.domain.model.RetryOptions;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 지연 계산기
 *
 * delay = min(maxTimeout, minTimeout * factor^(attempt - 1) * jitter)
 * jitter는 randomize일 때 [1, 2) 구간의 난수, 아니면 1
 */
public class RetryBackoffCalculator {

    private final DoubleSupplier random;

    public RetryBackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryBackoffCalculator(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * @param options 재시도 옵션
     * @param attempt 증가된 이후의 시도 횟수 (1부터 시작)
     * @return 지연 시간 (ms)
     */
    public long nextRetryDelay(RetryOptions options, int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double jitter = options.randomize() ? 1 + random.getAsDouble() : 1;
        double delay = options.minTimeoutInMs() * Math.pow(options.factor(), exponent) * jitter;

        return Math.round(Math.min(delay, options.maxTimeoutInMs()));
    }
}
