package net.gantry.adapter.jdbc.repo;

import net.gantry.adapter.jdbc.JdbcUtil;
import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.mapper.RowMappers;
import net.gantry.core.model.Resource;
import net.gantry.core.spi.ResourceRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.gantry.adapter.jdbc.JdbcUtil.ts;

public final class JdbcResourceRepository implements ResourceRepository {
    private final DataSource ds;

    public JdbcResourceRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    /** UPDATE 후 없으면 INSERT (동시 시드면 한 번 더 UPDATE) */
    @Override
    public void upsert(Resource r) throws Exception {
        Connection c = mustConn();
        if (update(c, r) > 0) return;
        boolean inserted = JdbcUtil.insertUnique(c, """
            INSERT INTO TB_RESOURCE(RESOURCE_INDEX, NAME, TOTAL_CAPACITY, FREE_CAPACITY, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?)
        """, ps -> {
            ps.setInt(1, r.resourceIndex());
            ps.setString(2, r.name());
            ps.setLong(3, r.totalCapacity());
            ps.setLong(4, r.freeCapacity());
            ps.setTimestamp(5, ts(r.updatedAt()));
        });
        if (!inserted) update(c, r);
    }

    private int update(Connection c, Resource r) throws Exception {
        try (var ps = c.prepareStatement("""
            UPDATE TB_RESOURCE
               SET NAME = ?, TOTAL_CAPACITY = ?, FREE_CAPACITY = ?, UPDATED_AT = ?
             WHERE RESOURCE_INDEX = ?
        """)) {
            ps.setString(1, r.name());
            ps.setLong(2, r.totalCapacity());
            ps.setLong(3, r.freeCapacity());
            ps.setTimestamp(4, ts(r.updatedAt()));
            ps.setInt(5, r.resourceIndex());
            return ps.executeUpdate();
        }
    }

    /** 용량 테이블 전체 행 잠금: 임차 부여를 직렬화 */
    @Override
    public List<Resource> lockAll() throws Exception {
        return query("SELECT * FROM TB_RESOURCE ORDER BY RESOURCE_INDEX FOR UPDATE");
    }

    @Override
    public List<Resource> findAll() throws Exception {
        return query("SELECT * FROM TB_RESOURCE ORDER BY RESOURCE_INDEX");
    }

    private List<Resource> query(String sql) throws Exception {
        try (var ps = mustConn().prepareStatement(sql); var rs = ps.executeQuery()) {
            List<Resource> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toResource(rs));
            return out;
        }
    }

    @Override
    public Optional<Resource> findByIndex(int resourceIndex) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_RESOURCE WHERE RESOURCE_INDEX = ?")) {
            ps.setInt(1, resourceIndex);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toResource(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean updateFree(int resourceIndex, long freeCapacity, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_RESOURCE SET FREE_CAPACITY = ?, UPDATED_AT = ? WHERE RESOURCE_INDEX = ?
        """)) {
            ps.setLong(1, freeCapacity);
            ps.setTimestamp(2, ts(now));
            ps.setInt(3, resourceIndex);
            return ps.executeUpdate() == 1;
        }
    }
}
