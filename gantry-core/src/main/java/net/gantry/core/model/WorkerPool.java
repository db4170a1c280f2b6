package net.gantry.core.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public record WorkerPool(
        String poolId,
        String agentName,
        String modelId,
        String adapter,
        int desiredWorkers,
        int spawnedWorkers,
        Instant startedAt,
        Instant lastHeartbeat,
        Status status,
        long holdSeconds,
        Instant drainStartedAt,
        Map<String, String> metadata,
        Instant updatedAt,
        long spawnSeq            // 지금까지 발급한 워커 순번 (단조 증가)
) {
    public enum Status {
        STARTING, RUNNING, DRAINING, STOPPED, EVICTED, UNKNOWN;

        public static final Set<Status> ACTIVE = EnumSet.of(STARTING, RUNNING, DRAINING);
        public static final Set<Status> ACCEPTING = EnumSet.of(STARTING, RUNNING);

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() {
            return this == STOPPED || this == EVICTED;
        }
    }

    /** 신규 잡 owner_pool 이 될 수 있는지 */
    public boolean acceptsWork() {
        return Status.ACCEPTING.contains(status);
    }

    /** 마지막 생존 신호 (하트비트 없으면 시작 시각) */
    public Instant lastSeen() {
        return lastHeartbeat != null ? lastHeartbeat : startedAt;
    }

    public boolean idleAt(Instant now) {
        return !lastSeen().plusSeconds(holdSeconds).isAfter(now);
    }
}
