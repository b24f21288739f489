package com.huntql.service.storage.impl;

import com.huntql.service.core.store.QueryStore;
import com.huntql.service.core.store.RowSet;
import com.huntql.service.core.store.StoreException;
import com.huntql.service.core.store.StoreOptions;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * {@link QueryStore} over a JDBC {@link DataSource}. The statement timeout and fetch limit are applied per call on
 * the driver, so the database cancels long-running statements itself.
 */
@Slf4j
public class JdbcQueryStore implements QueryStore {

    private final DataSource dataSource;

    public JdbcQueryStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public RowSet runParameterized(String sql, List<Object> params, StoreOptions options) {
        PositionalParameters.Rewritten rewritten = PositionalParameters.rewrite(sql, params, JdbcQueryStore::toJdbc);
        if (log.isDebugEnabled()) {
            log.debug("Running store query timeoutMs={} maxRows={} sql={}", options.timeoutMs(), options.maxRows(), sql);
        }
        try {
            return template(options).query(rewritten.sql(), rewritten.params(), extractor(options.maxRows()));
        } catch (DataAccessException e) {
            throw new StoreException("Store query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private NamedParameterJdbcTemplate template(StoreOptions options) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout((int) Math.max(1, Math.min(Integer.MAX_VALUE, (options.timeoutMs() + 999) / 1000)));
        jdbc.setMaxRows(options.maxRows());
        return new NamedParameterJdbcTemplate(jdbc);
    }

    private static ResultSetExtractor<RowSet> extractor(int maxRows) {
        return rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            int width = meta.getColumnCount();
            List<String> columns = new ArrayList<>(width);
            for (int i = 1; i <= width; i++) {
                columns.add(meta.getColumnLabel(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (rows.size() < maxRows && rs.next()) {
                rows.add(row(rs, width));
            }
            return new RowSet(columns, rows);
        };
    }

    private static List<Object> row(ResultSet rs, int width) throws SQLException {
        List<Object> row = new ArrayList<>(width);
        for (int i = 1; i <= width; i++) {
            row.add(fromJdbc(rs.getObject(i)));
        }
        return row;
    }

    static Object toJdbc(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }

    static Object fromJdbc(Object value) {
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        return value;
    }
}
