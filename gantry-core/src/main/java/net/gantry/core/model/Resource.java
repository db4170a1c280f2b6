package net.gantry.core.model;

import java.time.Instant;

/** 가속기 용량 단위 하나 (예: GPU 한 장, free는 마지막 관측값) */
public record Resource(
        int resourceIndex,
        String name,
        long totalCapacity,
        long freeCapacity,
        Instant updatedAt
) {
    public long usedCapacity() {
        return Math.max(0, totalCapacity - freeCapacity);
    }
}
