package net.gantry.core.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 실패한 잡의 재노출 지연. attempt 는 1부터 (방금 소진한 시도 수) */
public interface RetryPolicy {
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return new FixedRetryPolicy(backoff);
    }

    /** min(max, base * 2^(attempt-1)) 에 jitter 비율만큼 무작위 감산 */
    static RetryPolicy exponential(Duration base, Duration max, double jitter) {
        return new ExponentialRetryPolicy(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }
}
