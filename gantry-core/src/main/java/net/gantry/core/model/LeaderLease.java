package net.gantry.core.model;

import java.time.Instant;

/** 분산 락 보유 상태. fencingToken 은 보유자가 바뀔 때마다 증가 */
public record LeaderLease(
        String lockName,
        String holder,
        String holderHint,
        long fencingToken,
        Instant acquiredAt,
        Instant expiresAt
) {
    public boolean liveAt(Instant now) {
        return holder != null && expiresAt != null && expiresAt.isAfter(now);
    }
}
