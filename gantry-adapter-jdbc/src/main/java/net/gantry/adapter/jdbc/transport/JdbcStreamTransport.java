package net.gantry.adapter.jdbc.transport;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.ConsumerGroup;
import net.gantry.core.model.StreamEntry;
import net.gantry.core.model.StreamMessage;
import net.gantry.core.spi.JobTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

/**
 * 테이블 세 개로 만든 스트림.
 * <ul>
 *   <li>TB_STREAM_ENTRY: 추가 전용 로그, ENTRY_ID 가 기록 순서</li>
 *   <li>TB_CONSUMER_GROUP: 그룹 행 락으로 같은 그룹의 read 를 직렬화</li>
 *   <li>TB_STREAM_DELIVERY: 그룹별 전달/확인 기록 (PEL)</li>
 * </ul>
 */
public final class JdbcStreamTransport implements JobTransport {
    private static final Logger log = LoggerFactory.getLogger(JdbcStreamTransport.class);

    private final DataSource ds;

    public JdbcStreamTransport(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public long publish(String stream, String jobId, String jobType, Map<String, String> fields,
                        Instant visibleAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_STREAM_ENTRY(STREAM, JOB_ID, JOB_TYPE, FIELDS, CREATED_AT, VISIBLE_AT)
            VALUES (?, ?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, stream);
            ps.setString(2, jobId);
            ps.setString(3, jobType);
            ps.setString(4, JdbcUtil.toJson(fields));
            ps.setTimestamp(5, ts(now));
            ps.setTimestamp(6, ts(visibleAt == null ? now : visibleAt));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated ENTRY_ID");
                long id = keys.getLong(1);
                log.debug("published {} job={} entry={}", stream, jobId, id);
                return id;
            }
        }
    }

    @Override
    public boolean ensureGroup(String stream, String group, String poolId, Instant now) throws Exception {
        return JdbcUtil.insertUnique(mustConn(), """
            INSERT INTO TB_CONSUMER_GROUP(GROUP_NAME, STREAM, POOL_ID, CREATED_AT) VALUES (?, ?, ?, ?)
        """, ps -> {
            ps.setString(1, group);
            ps.setString(2, stream);
            ps.setString(3, poolId);
            ps.setTimestamp(4, ts(now));
        });
    }

    @Override
    public Optional<StreamMessage> read(String stream, String group, String consumer, Instant now) throws Exception {
        Connection c = mustConn();
        if (!lockGroup(c, group)) {
            ensureGroup(stream, group, null, now);
            if (!lockGroup(c, group)) return Optional.empty();
        }

        long entryId;
        String jobId;
        String jobType;
        try (var ps = c.prepareStatement("""
            SELECT E.ENTRY_ID, E.JOB_ID, E.JOB_TYPE
              FROM TB_STREAM_ENTRY E
             WHERE E.STREAM = ?
               AND E.SETTLED_AT IS NULL
               AND E.VISIBLE_AT <= ?
               AND NOT EXISTS (SELECT 1 FROM TB_STREAM_DELIVERY D
                                WHERE D.GROUP_NAME = ? AND D.ENTRY_ID = E.ENTRY_ID)
             ORDER BY E.ENTRY_ID
             LIMIT 1
        """)) {
            ps.setString(1, stream);
            ps.setTimestamp(2, ts(now));
            ps.setString(3, group);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                entryId = rs.getLong(1);
                jobId = rs.getString(2);
                jobType = rs.getString(3);
            }
        }

        try (var ps = c.prepareStatement("""
            INSERT INTO TB_STREAM_DELIVERY(GROUP_NAME, ENTRY_ID, STREAM, CONSUMER, DELIVERED_AT, DELIVERY_COUNT)
            VALUES (?, ?, ?, ?, ?, 1)
        """)) {
            ps.setString(1, group);
            ps.setLong(2, entryId);
            ps.setString(3, stream);
            ps.setString(4, consumer);
            ps.setTimestamp(5, ts(now));
            ps.executeUpdate();
        }
        return Optional.of(new StreamMessage(group, entryId, stream, jobId, jobType, consumer, now, 1));
    }

    private static boolean lockGroup(Connection c, String group) throws Exception {
        try (var ps = c.prepareStatement("SELECT GROUP_NAME FROM TB_CONSUMER_GROUP WHERE GROUP_NAME = ? FOR UPDATE")) {
            ps.setString(1, group);
            try (var rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public boolean ack(String group, long entryId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_STREAM_DELIVERY SET ACKED_AT = ?
             WHERE GROUP_NAME = ? AND ENTRY_ID = ? AND ACKED_AT IS NULL
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setString(2, group);
            ps.setLong(3, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean touch(String group, long entryId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_STREAM_DELIVERY SET DELIVERED_AT = ?
             WHERE GROUP_NAME = ? AND ENTRY_ID = ? AND ACKED_AT IS NULL
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setString(2, group);
            ps.setLong(3, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean settle(long entryId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_STREAM_ENTRY SET SETTLED_AT = ? WHERE ENTRY_ID = ? AND SETTLED_AT IS NULL
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setLong(2, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<StreamMessage> pending(Instant idleBefore, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT D.GROUP_NAME, D.ENTRY_ID, D.STREAM, E.JOB_ID, E.JOB_TYPE,
                   D.CONSUMER, D.DELIVERED_AT, D.DELIVERY_COUNT
              FROM TB_STREAM_DELIVERY D
              JOIN TB_STREAM_ENTRY E ON E.ENTRY_ID = D.ENTRY_ID
             WHERE D.ACKED_AT IS NULL
               AND E.SETTLED_AT IS NULL
               AND D.DELIVERED_AT <= ?
             ORDER BY D.DELIVERED_AT, D.ENTRY_ID
             LIMIT ?
        """)) {
            ps.setTimestamp(1, ts(idleBefore));
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                List<StreamMessage> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toStreamMessage(rs));
                return out;
            }
        }
    }

    @Override
    public boolean hasLiveEntry(String stream, String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT COUNT(*) FROM TB_STREAM_ENTRY WHERE STREAM = ? AND JOB_ID = ? AND SETTLED_AT IS NULL
        """)) {
            ps.setString(1, stream);
            ps.setString(2, jobId);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1) > 0;
            }
        }
    }

    @Override
    public Map<String, Long> depths() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT STREAM, COUNT(*) FROM TB_STREAM_ENTRY WHERE SETTLED_AT IS NULL GROUP BY STREAM ORDER BY STREAM
        """); var rs = ps.executeQuery()) {
            Map<String, Long> out = new LinkedHashMap<>();
            while (rs.next()) out.put(rs.getString(1), rs.getLong(2));
            return out;
        }
    }

    @Override
    public List<StreamEntry> entries(String stream, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_STREAM_ENTRY WHERE STREAM = ? ORDER BY ENTRY_ID LIMIT ?
        """)) {
            ps.setString(1, stream);
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                List<StreamEntry> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toStreamEntry(rs));
                return out;
            }
        }
    }

    @Override
    public List<ConsumerGroup> groups() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_CONSUMER_GROUP ORDER BY STREAM, GROUP_NAME");
             var rs = ps.executeQuery()) {
            List<ConsumerGroup> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toConsumerGroup(rs));
            return out;
        }
    }

    @Override
    public int trimSettled(Instant olderThan, int limit) throws Exception {
        Connection c = mustConn();
        List<Long> ids = new ArrayList<>();
        try (var ps = c.prepareStatement("""
            SELECT ENTRY_ID FROM TB_STREAM_ENTRY WHERE SETTLED_AT <= ? ORDER BY ENTRY_ID LIMIT ?
        """)) {
            ps.setTimestamp(1, ts(olderThan));
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) ids.add(rs.getLong(1));
            }
        }
        if (ids.isEmpty()) return 0;

        try (var del = c.prepareStatement("DELETE FROM TB_STREAM_DELIVERY WHERE ENTRY_ID = ?")) {
            for (Long id : ids) {
                del.setLong(1, id);
                del.addBatch();
            }
            del.executeBatch();
        }
        int n = 0;
        try (var del = c.prepareStatement("DELETE FROM TB_STREAM_ENTRY WHERE ENTRY_ID = ? AND SETTLED_AT IS NOT NULL")) {
            for (Long id : ids) {
                del.setLong(1, id);
                n += del.executeUpdate();
            }
        }
        return n;
    }
}
