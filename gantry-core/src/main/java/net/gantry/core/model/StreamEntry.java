package net.gantry.core.model;

import java.time.Instant;
import java.util.Map;

public record StreamEntry(
        long entryId,
        String stream,
        String jobId,
        String jobType,
        Map<String, String> fields,
        Instant createdAt,
        Instant visibleAt,
        Instant settledAt
) {
    public boolean settled() {
        return settledAt != null;
    }
}
