package net.gantry.core.service;

import net.gantry.core.model.Lease;

import java.util.Map;

/** ttlSeconds 가 null 이면 정책 기본값, mode 가 null 이면 GPU */
public record LeaseRequest(
        String agent,
        long minCapacity,
        Long ttlSeconds,
        Lease.Mode mode,
        boolean allowCpuFallback,
        String poolId,
        Map<String, String> metadata
) {
    public static LeaseRequest gpu(String agent, long minCapacity, long ttlSeconds) {
        return new LeaseRequest(agent, minCapacity, ttlSeconds, Lease.Mode.GPU, false, null, Map.of());
    }

    public Lease.Mode effectiveMode() {
        return mode == null ? Lease.Mode.GPU : mode;
    }
}
