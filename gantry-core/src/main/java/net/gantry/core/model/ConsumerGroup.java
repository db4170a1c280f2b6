package net.gantry.core.model;

import java.time.Instant;

public record ConsumerGroup(
        String stream,
        String groupName,
        String poolId,
        Instant createdAt
) {}
