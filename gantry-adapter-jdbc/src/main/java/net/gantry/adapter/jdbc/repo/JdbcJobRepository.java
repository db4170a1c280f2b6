package net.gantry.adapter.jdbc.repo;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.Job;
import net.gantry.core.spi.JobRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

/** 모든 상태 전이는 WHERE STATUS = 기대상태 조건부 UPDATE (CAS) */
public final class JdbcJobRepository implements JobRepository {
    private static final int MAX_ERROR = 2000;

    private final DataSource ds;

    public JdbcJobRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public boolean insert(Job j) throws Exception {
        return JdbcUtil.insertUnique(mustConn(), """
            INSERT INTO TB_JOB(JOB_ID, JOB_TYPE, PAYLOAD, STATUS, OWNER_POOL, ATTEMPTS,
                               AVAILABLE_AT, CREATED_AT, UPDATED_AT, LAST_ERROR)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, ps -> {
            ps.setString(1, j.jobId());
            ps.setString(2, j.type());
            ps.setString(3, j.payload());
            ps.setString(4, j.status().code());
            ps.setString(5, j.ownerPool());
            ps.setInt(6, j.attempts());
            ps.setTimestamp(7, ts(j.availableAt()));
            ps.setTimestamp(8, ts(j.createdAt()));
            ps.setTimestamp(9, ts(j.updatedAt()));
            ps.setString(10, j.lastError());
        });
    }

    @Override
    public Optional<Job> findById(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE JOB_ID = ?")) {
            ps.setString(1, jobId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean claim(String jobId, String ownerPool, String claimGroup, Long claimEntry, Instant now)
            throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET STATUS = 'CLAIMED',
                   OWNER_POOL = ?,
                   CLAIM_GROUP = ?,
                   CLAIM_ENTRY = ?,
                   UPDATED_AT = ?
             WHERE JOB_ID = ?
               AND STATUS = 'PENDING'
        """)) {
            ps.setString(1, ownerPool);
            ps.setString(2, claimGroup);
            if (claimEntry == null) ps.setNull(3, Types.BIGINT);
            else ps.setLong(3, claimEntry);
            ps.setTimestamp(4, ts(now));
            ps.setString(5, jobId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean start(String jobId, Instant now) throws Exception {
        return simpleTransition(jobId, "CLAIMED", "RUNNING", now);
    }

    @Override
    public boolean complete(String jobId, Instant now) throws Exception {
        return simpleTransition(jobId, "RUNNING", "DONE", now);
    }

    private boolean simpleTransition(String jobId, String from, String to, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB SET STATUS = ?, UPDATED_AT = ? WHERE JOB_ID = ? AND STATUS = ?
        """)) {
            ps.setString(1, to);
            ps.setTimestamp(2, ts(now));
            ps.setString(3, jobId);
            ps.setString(4, from);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markFailed(String jobId, String error, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET STATUS = 'FAILED',
                   ATTEMPTS = ATTEMPTS + 1,
                   LAST_ERROR = ?,
                   UPDATED_AT = ?
             WHERE JOB_ID = ?
               AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, truncate(error));
            ps.setTimestamp(2, ts(now));
            ps.setString(3, jobId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean requeue(String jobId, Collection<Job.Status> from, Instant availableAt, String error,
                           boolean incrementAttempts, Instant now) throws Exception {
        if (from.isEmpty()) return false;
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_JOB SET STATUS = 'PENDING', OWNER_POOL = NULL, CLAIM_GROUP = NULL, CLAIM_ENTRY = NULL,"
                        + " AVAILABLE_AT = ?,"
                        + " LAST_ERROR = COALESCE(?, LAST_ERROR), UPDATED_AT = ?,"
                        + " ATTEMPTS = ATTEMPTS + ?"
                        + " WHERE JOB_ID = ? AND STATUS IN (" + JdbcUtil.placeholders(from.size()) + ")")) {
            ps.setTimestamp(1, ts(availableAt));
            ps.setString(2, truncate(error));
            ps.setTimestamp(3, ts(now));
            ps.setInt(4, incrementAttempts ? 1 : 0);
            ps.setString(5, jobId);
            JdbcUtil.bindCodes(ps, 6, from);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean deadLetter(String jobId, Collection<Job.Status> from, String error,
                              boolean incrementAttempts, Instant now) throws Exception {
        if (from.isEmpty()) return false;
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_JOB SET STATUS = 'DEAD_LETTER', LAST_ERROR = ?, UPDATED_AT = ?,"
                        + " ATTEMPTS = ATTEMPTS + ?"
                        + " WHERE JOB_ID = ? AND STATUS IN (" + JdbcUtil.placeholders(from.size()) + ")")) {
            ps.setString(1, truncate(error));
            ps.setTimestamp(2, ts(now));
            ps.setInt(3, incrementAttempts ? 1 : 0);
            ps.setString(4, jobId);
            JdbcUtil.bindCodes(ps, 5, from);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int countInFlightByPool(String poolId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT COUNT(*) FROM TB_JOB WHERE OWNER_POOL = ? AND STATUS IN ('CLAIMED', 'RUNNING')
        """)) {
            ps.setString(1, poolId);
            return count(ps);
        }
    }

    @Override
    public int countByStatus(Job.Status status) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_JOB WHERE STATUS = ?")) {
            ps.setString(1, status.code());
            return count(ps);
        }
    }

    @Override
    public List<Job> findByStatus(Job.Status status, String type, int limit) throws Exception {
        String sql = type == null
                ? "SELECT * FROM TB_JOB WHERE STATUS = ? ORDER BY UPDATED_AT DESC, JOB_ID LIMIT ?"
                : "SELECT * FROM TB_JOB WHERE STATUS = ? AND JOB_TYPE = ? ORDER BY UPDATED_AT DESC, JOB_ID LIMIT ?";
        try (var ps = mustConn().prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, status.code());
            if (type != null) ps.setString(i++, type);
            ps.setInt(i, limit);
            return list(ps);
        }
    }

    @Override
    public List<Job> findStalePending(Instant olderThan, Instant now, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_JOB
             WHERE STATUS = 'PENDING'
               AND UPDATED_AT <= ?
               AND AVAILABLE_AT <= ?
             ORDER BY UPDATED_AT
             LIMIT ?
        """)) {
            ps.setTimestamp(1, ts(olderThan));
            ps.setTimestamp(2, ts(now));
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    @Override
    public List<Job> findCompletedSince(Instant since, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_JOB
             WHERE STATUS = 'DONE'
               AND UPDATED_AT >= ?
             ORDER BY UPDATED_AT DESC
             LIMIT ?
        """)) {
            ps.setTimestamp(1, ts(since));
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    private static List<Job> list(PreparedStatement ps) throws Exception {
        try (var rs = ps.executeQuery()) {
            List<Job> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    private static int count(PreparedStatement ps) throws Exception {
        try (var rs = ps.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= MAX_ERROR ? s : s.substring(0, MAX_ERROR);
    }
}
