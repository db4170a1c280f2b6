package net.gantry.core.service;

import java.time.Duration;
import java.time.Instant;

/** 초당 rate 로 채워지고 burst 까지 쌓이는 토큰 버킷 */
final class TokenBucket {
    private final double ratePerSecond;
    private final double burst;
    private double tokens;
    private Instant last;

    TokenBucket(double ratePerSecond, int burst, Instant now) {
        if (ratePerSecond < 0 || burst < 1) throw new IllegalArgumentException("rate >= 0 and burst >= 1 required");
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.tokens = burst;
        this.last = now;
    }

    synchronized boolean tryTake(Instant now) {
        refill(now);
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    /** now 기준으로 burst 까지 다 찼는지. 다 찬 버킷은 새로 만든 것과 같다 */
    synchronized boolean isFullAt(Instant now) {
        refill(now);
        return tokens >= burst;
    }

    private void refill(Instant now) {
        if (!now.isAfter(last)) return;
        double elapsed = Duration.between(last, now).toNanos() / 1_000_000_000.0;
        tokens = Math.min(burst, tokens + elapsed * ratePerSecond);
        last = now;
    }
}
