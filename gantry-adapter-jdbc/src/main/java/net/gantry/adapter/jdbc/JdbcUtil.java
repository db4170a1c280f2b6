package net.gantry.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class JdbcUtil {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final String UNIQUE_VIOLATION = "23505";

    private JdbcUtil() {}

    @FunctionalInterface
    public interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String toJson(Map<String, String> m) {
        if (m == null || m.isEmpty()) return null;
        try {
            return JSON.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metadata not serializable", e);
        }
    }

    public static Map<String, String> fromJson(String s) {
        if (s == null || s.isBlank()) return Map.of();
        try {
            return JSON.readValue(s, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("corrupt metadata column: " + s, e);
        }
    }

    public static boolean isDuplicate(SQLException e) {
        for (SQLException x = e; x != null; x = x.getNextException()) {
            if (UNIQUE_VIOLATION.equals(x.getSQLState())) return true;
        }
        return false;
    }

    /**
     * 유니크 충돌이면 false. 세이브포인트로 감싸서 PostgreSQL 에서도 바깥 트랜잭션이 살아있다.
     */
    public static boolean insertUnique(Connection c, String sql, Binder binder) throws SQLException {
        Savepoint sp = c.setSavepoint();
        try (var ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isDuplicate(e)) {
                c.rollback(sp);
                return false;
            }
            throw e;
        }
        c.releaseSavepoint(sp);
        return true;
    }

    /** IN (?, ?, ...) 자리표시자 */
    public static String placeholders(int n) {
        return IntStream.range(0, n).mapToObj(i -> "?").collect(Collectors.joining(", "));
    }

    public static <E extends Enum<E>> void bindCodes(PreparedStatement ps, int start, Collection<E> values)
            throws SQLException {
        int i = start;
        for (E v : values) ps.setString(i++, v.name());
    }
}
