package net.gantry.core.service;

import java.time.Duration;

/**
 * 임차 정책.
 * maxCapacityPerAgent 0 이하면 무제한, safeMode 면 모든 부여 거절.
 */
public record LeasePolicy(
        Duration defaultTtl,
        long maxCapacityPerAgent,
        boolean safeMode
) {
    public static LeasePolicy defaults() {
        return new LeasePolicy(Duration.ofHours(1), 0, false);
    }

    public LeasePolicy withDefaultTtl(Duration ttl) {
        return new LeasePolicy(ttl, maxCapacityPerAgent, safeMode);
    }

    public LeasePolicy withSafeMode(boolean on) {
        return new LeasePolicy(defaultTtl, maxCapacityPerAgent, on);
    }

    public LeasePolicy withMaxCapacityPerAgent(long max) {
        return new LeasePolicy(defaultTtl, max, safeMode);
    }
}
