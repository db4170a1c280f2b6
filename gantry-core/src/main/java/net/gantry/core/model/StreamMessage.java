package net.gantry.core.model;

import java.time.Instant;

/** 컨슈머 그룹에 전달된(미확인일 수 있는) 엔트리 */
public record StreamMessage(
        String group,
        long entryId,
        String stream,
        String jobId,
        String jobType,
        String consumer,
        Instant deliveredAt,
        int deliveryCount
) {}
