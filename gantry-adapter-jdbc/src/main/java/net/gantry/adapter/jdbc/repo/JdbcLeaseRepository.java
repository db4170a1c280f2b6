package net.gantry.adapter.jdbc.repo;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.Lease;
import net.gantry.core.spi.LeaseRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

public final class JdbcLeaseRepository implements LeaseRepository {
    private final DataSource ds;

    public JdbcLeaseRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void insert(Lease l) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_LEASE(TOKEN, AGENT_NAME, RESOURCE_INDEX, LEASE_MODE, POOL_ID, TTL_SECONDS,
                                 CREATED_AT, EXPIRES_AT, LAST_HEARTBEAT, METADATA)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, l.token());
            ps.setString(2, l.agentName());
            if (l.resourceIndex() == null) ps.setNull(3, Types.INTEGER); else ps.setInt(3, l.resourceIndex());
            ps.setString(4, l.mode().code());
            ps.setString(5, l.poolId());
            ps.setLong(6, l.ttlSeconds());
            ps.setTimestamp(7, ts(l.createdAt()));
            ps.setTimestamp(8, ts(l.expiresAt()));
            ps.setTimestamp(9, ts(l.lastHeartbeat()));
            ps.setString(10, JdbcUtil.toJson(l.metadata()));
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Lease> findByToken(String token) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_LEASE WHERE TOKEN = ?")) {
            ps.setString(1, token);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLease(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Lease> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_LEASE ORDER BY CREATED_AT, TOKEN");
             var rs = ps.executeQuery()) {
            List<Lease> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toLease(rs));
            return out;
        }
    }

    @Override
    public List<Lease> findByPool(String poolId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_LEASE WHERE POOL_ID = ? ORDER BY CREATED_AT")) {
            ps.setString(1, poolId);
            try (var rs = ps.executeQuery()) {
                List<Lease> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toLease(rs));
                return out;
            }
        }
    }

    @Override
    public Set<Integer> activeResourceIndexes(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT RESOURCE_INDEX FROM TB_LEASE
             WHERE RESOURCE_INDEX IS NOT NULL
               AND EXPIRES_AT > ?
        """)) {
            ps.setTimestamp(1, ts(now));
            try (var rs = ps.executeQuery()) {
                Set<Integer> out = new HashSet<>();
                while (rs.next()) out.add(rs.getInt(1));
                return out;
            }
        }
    }

    @Override
    public int deleteExpiredOn(int resourceIndex, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_LEASE WHERE RESOURCE_INDEX = ? AND EXPIRES_AT <= ?
        """)) {
            ps.setInt(1, resourceIndex);
            ps.setTimestamp(2, ts(now));
            return ps.executeUpdate();
        }
    }

    /** 살아있을 때만 연장 (만료 후 부활 금지) */
    @Override
    public boolean extend(String token, Instant newExpiresAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_LEASE
               SET EXPIRES_AT = ?,
                   LAST_HEARTBEAT = ?
             WHERE TOKEN = ?
               AND EXPIRES_AT > ?
        """)) {
            ps.setTimestamp(1, ts(newExpiresAt));
            ps.setTimestamp(2, ts(now));
            ps.setString(3, token);
            ps.setTimestamp(4, ts(now));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean delete(String token) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_LEASE WHERE TOKEN = ?")) {
            ps.setString(1, token);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean deleteIfExpired(String token, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_LEASE WHERE TOKEN = ? AND EXPIRES_AT <= ?")) {
            ps.setString(1, token);
            ps.setTimestamp(2, ts(now));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<Lease> findExpired(Instant now, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_LEASE
             WHERE EXPIRES_AT <= ?
             ORDER BY EXPIRES_AT
             LIMIT ?
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                List<Lease> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toLease(rs));
                return out;
            }
        }
    }

    @Override
    public int countActive(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_LEASE WHERE EXPIRES_AT > ?")) {
            ps.setTimestamp(1, ts(now));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }
}
