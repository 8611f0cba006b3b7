package personal.runqueue.engine.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import personal.runqueue.engine.domain.model.RateLimitSettings;

/**
 * 큐 GCRA 설정 요청 DTO (ms 단위)
 *
 * @param keyExpirationMs 생략하면 max(60000, emission + burst)
 */
public record QueueRateLimitRequest(
        @Positive(message = "emissionIntervalMs는 양수여야 합니다.")
        long emissionIntervalMs,

        @Min(value = 0, message = "burstToleranceMs는 0 이상이어야 합니다.")
        long burstToleranceMs,

        Long keyExpirationMs
) {
    public RateLimitSettings toSettings() {
        return keyExpirationMs == null
                ? RateLimitSettings.of(emissionIntervalMs, burstToleranceMs)
                : new RateLimitSettings(emissionIntervalMs, burstToleranceMs, keyExpirationMs);
    }
}
