package net.gantry.adapter.jdbc.lock;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.LeaderLease;
import net.gantry.core.spi.DistributedLock;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

/**
 * TB_LEADER_LOCK 한 행에 대한 조건부 UPDATE 락.
 * 보유자가 바뀔 때만 FENCING_TOKEN 이 1 증가한다.
 */
public final class JdbcDistributedLock implements DistributedLock {
    private final DataSource ds;

    public JdbcDistributedLock(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Optional<LeaderLease> tryAcquire(String lockName, String holder, String holderHint,
                                            Duration ttl, Instant now) throws Exception {
        Connection c = mustConn();
        JdbcUtil.insertUnique(c, """
            INSERT INTO TB_LEADER_LOCK(LOCK_NAME, HOLDER, HOLDER_HINT, FENCING_TOKEN, ACQUIRED_AT, EXPIRES_AT)
            VALUES (?, NULL, NULL, 0, NULL, NULL)
        """, ps -> ps.setString(1, lockName));

        int updated;
        try (var ps = c.prepareStatement("""
            UPDATE TB_LEADER_LOCK
               SET FENCING_TOKEN = CASE WHEN HOLDER = ? THEN FENCING_TOKEN ELSE FENCING_TOKEN + 1 END,
                   ACQUIRED_AT   = CASE WHEN HOLDER = ? THEN ACQUIRED_AT ELSE ? END,
                   HOLDER        = ?,
                   HOLDER_HINT   = ?,
                   EXPIRES_AT    = ?
             WHERE LOCK_NAME = ?
               AND (HOLDER IS NULL OR HOLDER = ? OR EXPIRES_AT <= ?)
        """)) {
            ps.setString(1, holder);
            ps.setString(2, holder);
            ps.setTimestamp(3, ts(now));
            ps.setString(4, holder);
            ps.setString(5, holderHint);
            ps.setTimestamp(6, ts(now.plus(ttl)));
            ps.setString(7, lockName);
            ps.setString(8, holder);
            ps.setTimestamp(9, ts(now));
            updated = ps.executeUpdate();
        }
        return updated == 1 ? current(lockName) : Optional.empty();
    }

    @Override
    public boolean release(String lockName, String holder, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_LEADER_LOCK SET HOLDER = NULL, EXPIRES_AT = ?
             WHERE LOCK_NAME = ? AND HOLDER = ?
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setString(2, lockName);
            ps.setString(3, holder);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<LeaderLease> current(String lockName) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_LEADER_LOCK WHERE LOCK_NAME = ?")) {
            ps.setString(1, lockName);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLeaderLease(rs)) : Optional.empty();
            }
        }
    }
}
