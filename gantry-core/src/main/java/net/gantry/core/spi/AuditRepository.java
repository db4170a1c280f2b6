package net.gantry.core.spi;

import net.gantry.core.model.AuditEvent;

import java.util.List;

public interface AuditRepository {
    /** 호출자 트랜잭션 안에서 추가 */
    void append(AuditEvent event) throws Exception;

    List<AuditEvent> findByEntity(String entityType, String entityId) throws Exception;
}
