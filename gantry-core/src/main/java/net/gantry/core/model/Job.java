package net.gantry.core.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

public record Job(
        String jobId,            // 클라이언트가 준 멱등 키
        String type,
        String payload,
        Status status,
        String ownerPool,
        int attempts,
        Instant availableAt,
        Instant createdAt,
        Instant updatedAt,
        String lastError,
        String claimGroup,       // 선점한 전달의 컨슈머 그룹 (전달 없이 선점했으면 null)
        Long claimEntry          // 선점한 전달의 엔트리 id
) {
    public enum Status {
        PENDING, CLAIMED, RUNNING, DONE, FAILED, DEAD_LETTER, UNKNOWN;

        public static final Set<Status> IN_FLIGHT = EnumSet.of(CLAIMED, RUNNING);
        public static final Set<Status> RECLAIMABLE = EnumSet.of(PENDING, CLAIMED, RUNNING);

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() {
            return this == DONE || this == DEAD_LETTER;
        }
    }

    /** 이 전달이 잡을 선점한 전달인지. 전달 기록 없이 선점된 잡은 어떤 전달이든 주인으로 본다 */
    public boolean claimedThrough(String group, long entryId) {
        if (claimEntry == null) return true;
        return claimEntry == entryId && group.equals(claimGroup);
    }
}
