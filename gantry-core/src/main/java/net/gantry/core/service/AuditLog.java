package net.gantry.core.service;

import net.gantry.core.model.AuditEvent;
import net.gantry.core.spi.AuditRepository;
import net.gantry.core.spi.Clock;

/** 상태 변경과 같은 트랜잭션에서 감사 이벤트를 남긴다. actor 는 이 레플리카 id */
public final class AuditLog {
    private final AuditRepository repo;
    private final Clock clock;
    private final String actor;

    public AuditLog(AuditRepository repo, Clock clock, String actor) {
        this.repo = repo;
        this.clock = clock;
        this.actor = actor;
    }

    public void record(String entityType, String entityId, String action,
                       String fromStatus, String toStatus, String detail) throws Exception {
        repo.append(new AuditEvent(null, entityType, entityId, action,
                fromStatus, toStatus, actor, detail, clock.now()));
    }

    public String actor() {
        return actor;
    }
}
