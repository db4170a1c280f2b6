package net.gantry.core.service;

import java.util.Map;

/** poolId 가 없으면 agent-adapter(없으면 base) 로 정해진다 */
public record PoolRequest(
        String agent,
        String model,
        String adapter,
        int desiredWorkers,
        Long holdSeconds,
        String poolId,
        Map<String, String> metadata
) {
    public String resolvedPoolId() {
        if (poolId != null && !poolId.isBlank()) return poolId;
        return agent + "-" + (adapter == null || adapter.isBlank() ? "base" : adapter);
    }
}
