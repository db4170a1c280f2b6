package net.gantry.core.model;

import java.time.Instant;

/** 추가 전용 감사 로그 한 줄 */
public record AuditEvent(
        Long eventId,
        String entityType,
        String entityId,
        String action,
        String fromStatus,
        String toStatus,
        String actor,
        String detail,
        Instant createdAt
) {
    public static final String LEASE = "lease";
    public static final String POOL = "pool";
    public static final String JOB = "job";
    public static final String LEADER = "leader";
    public static final String POLICY = "policy";
}
