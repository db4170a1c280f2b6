package net.gantry.core.service;

import java.time.Duration;

/**
 * 풀 수명 정책.
 * maxTotalWorkers 0 이하면 무제한. minWarmWorkers 이하 풀은 총량 초과 축출 1차 대상에서 제외.
 */
public record PoolPolicy(
        int minWarmWorkers,
        int maxTotalWorkers,
        Duration drainTimeout,
        long defaultHoldSeconds,
        int batchSize
) {
    public static PoolPolicy defaults() {
        return new PoolPolicy(0, 8, Duration.ofMinutes(5), 300, 100);
    }

    void validate() {
        if (minWarmWorkers < 0) throw new IllegalArgumentException("min_warm_workers must be >= 0");
        if (drainTimeout == null || drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drain_timeout must be >= 0");
        }
        if (defaultHoldSeconds <= 0) throw new IllegalArgumentException("default_hold_seconds must be positive");
        if (batchSize <= 0) throw new IllegalArgumentException("batch_size must be positive");
    }
}
