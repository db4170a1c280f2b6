package net.gantry.core.model;

import java.time.Instant;
import java.util.Map;

public record Lease(
        String token,
        String agentName,
        Integer resourceIndex,   // null = CPU fallback
        Mode mode,
        String poolId,           // 풀 대신 잡은 임차면 풀 id
        long ttlSeconds,
        Instant createdAt,
        Instant expiresAt,
        Instant lastHeartbeat,
        Map<String, String> metadata
) {
    public enum Mode {
        GPU, CPU, UNKNOWN;

        public static Mode from(String s) {
            if (s == null) return UNKNOWN;
            try { return Mode.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    /** expires_at 이 지났으면 purge 전이라도 죽은 임차 */
    public boolean expiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
