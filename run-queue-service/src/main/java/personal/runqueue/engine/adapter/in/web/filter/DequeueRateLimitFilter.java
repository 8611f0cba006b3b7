package personal.runqueue.engine.adapter.in.web.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import personal.runqueue.engine.application.config.RunQueueProperties;
import personal.runqueue.engine.application.port.out.RateLimiter;
import personal.runqueue.engine.application.port.out.RateLimiterFactory;
import personal.runqueue.engine.domain.model.RateLimitResult;

import java.io.IOException;

/**
 * Dequeue Rate Limit Filter
 * 컨슈머별 GCRA로 dequeue 요청 빈도 제한
 *
 * 컨슈머는 X-Consumer-Id 헤더로 식별하며, 없으면 원격 주소를 사용합니다.
 * Redis 오류 시에는 요청을 허용합니다 (fail-open).
 */
@Slf4j
@Component
public class DequeueRateLimitFilter extends OncePerRequestFilter {

    static final String CONSUMER_HEADER = "X-Consumer-Id";
    private static final String DEQUEUE_PATH = "/api/v1/run-queue/dequeue";
    private static final String LIMITER_NAME = "dequeue";

    private final boolean enabled;
    private final RateLimiter rateLimiter;

    public DequeueRateLimitFilter(RunQueueProperties properties, RateLimiterFactory rateLimiterFactory) {
        RunQueueProperties.DequeueRateLimit config = properties.dequeueRateLimit();
        this.enabled = config.enabled();
        this.rateLimiter = enabled ? rateLimiterFactory.create(LIMITER_NAME, config.toSettings()) : null;

        log.info("DequeueRateLimitFilter initialized: enabled={}", enabled);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled
                || !HttpMethod.POST.matches(request.getMethod())
                || !DEQUEUE_PATH.equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String consumerId = request.getHeader(CONSUMER_HEADER);
        if (consumerId == null || consumerId.isBlank()) {
            consumerId = request.getRemoteAddr();
        }

        RateLimitResult result = check(consumerId);
        if (!result.allowed()) {
            log.warn("Dequeue rate limit exceeded: consumerId={}, retryAfterMs={}", consumerId, result.retryAfterMs());
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setHeader("Retry-After", String.valueOf((long) Math.ceil(result.retryAfterMs() / 1000.0)));
            response.getWriter().write("Too many dequeue requests. Please slow down.");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private RateLimitResult check(String consumerId) {
        try {
            return rateLimiter.check(consumerId);
        } catch (Exception e) {
            log.error("Dequeue rate limit check failed: consumerId={}", consumerId, e);
            // fail-open
            return RateLimitResult.allow();
        }
    }
}
