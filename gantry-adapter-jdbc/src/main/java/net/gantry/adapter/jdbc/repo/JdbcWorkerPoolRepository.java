package net.gantry.adapter.jdbc.repo;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.spi.WorkerPoolRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

public final class JdbcWorkerPoolRepository implements WorkerPoolRepository {
    private final DataSource ds;

    public JdbcWorkerPoolRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public boolean insert(WorkerPool p) throws Exception {
        return JdbcUtil.insertUnique(mustConn(), """
            INSERT INTO TB_WORKER_POOL(POOL_ID, AGENT_NAME, MODEL_ID, ADAPTER, DESIRED_WORKERS, SPAWNED_WORKERS,
                                       STARTED_AT, LAST_HEARTBEAT, STATUS, HOLD_SECONDS, DRAIN_STARTED_AT,
                                       METADATA, UPDATED_AT, SPAWN_SEQ)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, ps -> {
            ps.setString(1, p.poolId());
            ps.setString(2, p.agentName());
            ps.setString(3, p.modelId());
            ps.setString(4, p.adapter());
            ps.setInt(5, p.desiredWorkers());
            ps.setInt(6, p.spawnedWorkers());
            ps.setTimestamp(7, ts(p.startedAt()));
            ps.setTimestamp(8, ts(p.lastHeartbeat()));
            ps.setString(9, p.status().code());
            ps.setLong(10, p.holdSeconds());
            ps.setTimestamp(11, ts(p.drainStartedAt()));
            ps.setString(12, JdbcUtil.toJson(p.metadata()));
            ps.setTimestamp(13, ts(p.updatedAt()));
            ps.setLong(14, p.spawnSeq());
        });
    }

    @Override
    public Optional<WorkerPool> findById(String poolId) throws Exception {
        return one("SELECT * FROM TB_WORKER_POOL WHERE POOL_ID = ?", poolId);
    }

    @Override
    public Optional<WorkerPool> lockById(String poolId) throws Exception {
        return one("SELECT * FROM TB_WORKER_POOL WHERE POOL_ID = ? FOR UPDATE", poolId);
    }

    private Optional<WorkerPool> one(String sql, String poolId) throws Exception {
        try (var ps = mustConn().prepareStatement(sql)) {
            ps.setString(1, poolId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWorkerPool(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<WorkerPool> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORKER_POOL ORDER BY STARTED_AT, POOL_ID");
             var rs = ps.executeQuery()) {
            List<WorkerPool> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toWorkerPool(rs));
            return out;
        }
    }

    @Override
    public List<WorkerPool> findByStatuses(Collection<WorkerPool.Status> statuses) throws Exception {
        if (statuses.isEmpty()) return List.of();
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_WORKER_POOL WHERE STATUS IN (" + JdbcUtil.placeholders(statuses.size()) + ")"
                        + " ORDER BY STARTED_AT, POOL_ID")) {
            JdbcUtil.bindCodes(ps, 1, statuses);
            try (var rs = ps.executeQuery()) {
                List<WorkerPool> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toWorkerPool(rs));
                return out;
            }
        }
    }

    @Override
    public boolean transition(String poolId, Collection<WorkerPool.Status> from, WorkerPool.Status to, Instant now)
            throws Exception {
        if (from.isEmpty()) return false;
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_WORKER_POOL SET STATUS = ?, UPDATED_AT = ? WHERE POOL_ID = ? AND STATUS IN ("
                        + JdbcUtil.placeholders(from.size()) + ")")) {
            ps.setString(1, to.code());
            ps.setTimestamp(2, ts(now));
            ps.setString(3, poolId);
            JdbcUtil.bindCodes(ps, 4, from);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markDraining(String poolId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORKER_POOL
               SET STATUS = 'DRAINING',
                   DRAIN_STARTED_AT = ?,
                   UPDATED_AT = ?
             WHERE POOL_ID = ?
               AND STATUS IN ('STARTING', 'RUNNING')
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setTimestamp(2, ts(now));
            ps.setString(3, poolId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean heartbeat(String poolId, int spawnedWorkers, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORKER_POOL
               SET LAST_HEARTBEAT = ?,
                   SPAWNED_WORKERS = ?,
                   UPDATED_AT = ?
             WHERE POOL_ID = ?
               AND STATUS IN ('STARTING', 'RUNNING', 'DRAINING')
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setInt(2, spawnedWorkers);
            ps.setTimestamp(3, ts(now));
            ps.setString(4, poolId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean updateSpawned(String poolId, int spawnedWorkers, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORKER_POOL
               SET SPAWNED_WORKERS = ?,
                   UPDATED_AT = ?
             WHERE POOL_ID = ?
               AND STATUS IN ('STARTING', 'RUNNING')
        """)) {
            ps.setInt(1, spawnedWorkers);
            ps.setTimestamp(2, ts(now));
            ps.setString(3, poolId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean advanceSpawnSeq(String poolId, int count, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORKER_POOL
               SET SPAWN_SEQ = SPAWN_SEQ + ?,
                   UPDATED_AT = ?
             WHERE POOL_ID = ?
        """)) {
            ps.setInt(1, count);
            ps.setTimestamp(2, ts(now));
            ps.setString(3, poolId);
            return ps.executeUpdate() == 1;
        }
    }
}
