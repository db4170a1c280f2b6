package net.gantry.core.service;

import java.time.Duration;
import java.util.function.DoubleSupplier;

final class ExponentialRetryPolicy implements RetryPolicy {
    private final Duration base;
    private final Duration max;
    private final double jitter;           // 0.0 ~ 1.0
    private final DoubleSupplier random;   // [0,1)

    ExponentialRetryPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("require 0 <= base <= max");
        }
        if (jitter < 0 || jitter > 1) throw new IllegalArgumentException("jitter must be in [0,1]");
        this.base = base;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long maxMs = max.toMillis();
        long capped = base.toMillis();
        for (long i = 1; i < attempt && capped < maxMs; i++) {
            capped *= 2;
        }
        capped = Math.min(capped, maxMs);
        long reduction = (long) (capped * jitter * random.getAsDouble());
        return Duration.ofMillis(capped - reduction);
    }
}
