package net.gantry.adapter.jdbc.repo;

import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.spi.AuditRepository;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

/** 추가 전용. UPDATE/DELETE 경로 없음 */
public final class JdbcAuditRepository implements AuditRepository {
    private static final int MAX_DETAIL = 2000;

    private final DataSource ds;

    public JdbcAuditRepository(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public void append(AuditEvent e) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            INSERT INTO TB_AUDIT_EVENT(ENTITY_TYPE, ENTITY_ID, ACTION, FROM_STATUS, TO_STATUS, ACTOR, DETAIL, CREATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, e.entityType());
            ps.setString(2, e.entityId());
            ps.setString(3, e.action());
            ps.setString(4, e.fromStatus());
            ps.setString(5, e.toStatus());
            ps.setString(6, e.actor());
            String detail = e.detail();
            ps.setString(7, detail != null && detail.length() > MAX_DETAIL ? detail.substring(0, MAX_DETAIL) : detail);
            ps.setTimestamp(8, ts(e.createdAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<AuditEvent> findByEntity(String entityType, String entityId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            SELECT * FROM TB_AUDIT_EVENT
             WHERE ENTITY_TYPE = ? AND ENTITY_ID = ?
             ORDER BY EVENT_ID
        """)) {
            ps.setString(1, entityType);
            ps.setString(2, entityId);
            try (var rs = ps.executeQuery()) {
                List<AuditEvent> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toAuditEvent(rs));
                return out;
            }
        }
    }
}
