package net.gantry.adapter.jdbc.mapper;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.core.model.*;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Resource ---
    public static Resource toResource(ResultSet rs) throws SQLException {
        return new Resource(
                rs.getInt("RESOURCE_INDEX"),
                rs.getString("NAME"),
                rs.getLong("TOTAL_CAPACITY"),
                rs.getLong("FREE_CAPACITY"),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Lease ---
    public static Lease toLease(ResultSet rs) throws SQLException {
        Integer idx = rs.getInt("RESOURCE_INDEX");
        if (rs.wasNull()) idx = null;
        return new Lease(
                rs.getString("TOKEN"),
                rs.getString("AGENT_NAME"),
                idx,
                Lease.Mode.from(rs.getString("LEASE_MODE")),
                rs.getString("POOL_ID"),
                rs.getLong("TTL_SECONDS"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("EXPIRES_AT").toInstant(),
                rs.getTimestamp("LAST_HEARTBEAT").toInstant(),
                JdbcUtil.fromJson(rs.getString("METADATA"))
        );
    }

    // --- WorkerPool ---
    public static WorkerPool toWorkerPool(ResultSet rs) throws SQLException {
        return new WorkerPool(
                rs.getString("POOL_ID"),
                rs.getString("AGENT_NAME"),
                rs.getString("MODEL_ID"),
                rs.getString("ADAPTER"),
                rs.getInt("DESIRED_WORKERS"),
                rs.getInt("SPAWNED_WORKERS"),
                rs.getTimestamp("STARTED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_HEARTBEAT")),
                WorkerPool.Status.from(rs.getString("STATUS")),
                rs.getLong("HOLD_SECONDS"),
                JdbcUtil.toInstant(rs.getTimestamp("DRAIN_STARTED_AT")),
                JdbcUtil.fromJson(rs.getString("METADATA")),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                rs.getLong("SPAWN_SEQ")
        );
    }

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        Long claimEntry = rs.getLong("CLAIM_ENTRY");
        if (rs.wasNull()) claimEntry = null;
        return new Job(
                rs.getString("JOB_ID"),
                rs.getString("JOB_TYPE"),
                rs.getString("PAYLOAD"),
                Job.Status.from(rs.getString("STATUS")),
                rs.getString("OWNER_POOL"),
                rs.getInt("ATTEMPTS"),
                rs.getTimestamp("AVAILABLE_AT").toInstant(),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                rs.getString("LAST_ERROR"),
                rs.getString("CLAIM_GROUP"),
                claimEntry
        );
    }

    // --- AuditEvent ---
    public static AuditEvent toAuditEvent(ResultSet rs) throws SQLException {
        return new AuditEvent(
                rs.getLong("EVENT_ID"),
                rs.getString("ENTITY_TYPE"),
                rs.getString("ENTITY_ID"),
                rs.getString("ACTION"),
                rs.getString("FROM_STATUS"),
                rs.getString("TO_STATUS"),
                rs.getString("ACTOR"),
                rs.getString("DETAIL"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }

    // --- StreamEntry ---
    public static StreamEntry toStreamEntry(ResultSet rs) throws SQLException {
        return new StreamEntry(
                rs.getLong("ENTRY_ID"),
                rs.getString("STREAM"),
                rs.getString("JOB_ID"),
                rs.getString("JOB_TYPE"),
                JdbcUtil.fromJson(rs.getString("FIELDS")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("VISIBLE_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("SETTLED_AT"))
        );
    }

    // --- StreamMessage (delivery JOIN entry) ---
    public static StreamMessage toStreamMessage(ResultSet rs) throws SQLException {
        return new StreamMessage(
                rs.getString("GROUP_NAME"),
                rs.getLong("ENTRY_ID"),
                rs.getString("STREAM"),
                rs.getString("JOB_ID"),
                rs.getString("JOB_TYPE"),
                rs.getString("CONSUMER"),
                rs.getTimestamp("DELIVERED_AT").toInstant(),
                rs.getInt("DELIVERY_COUNT")
        );
    }

    // --- ConsumerGroup ---
    public static ConsumerGroup toConsumerGroup(ResultSet rs) throws SQLException {
        return new ConsumerGroup(
                rs.getString("STREAM"),
                rs.getString("GROUP_NAME"),
                rs.getString("POOL_ID"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }

    // --- LeaderLease ---
    public static LeaderLease toLeaderLease(ResultSet rs) throws SQLException {
        return new LeaderLease(
                rs.getString("LOCK_NAME"),
                rs.getString("HOLDER"),
                rs.getString("HOLDER_HINT"),
                rs.getLong("FENCING_TOKEN"),
                JdbcUtil.toInstant(rs.getTimestamp("ACQUIRED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("EXPIRES_AT"))
        );
    }
}
