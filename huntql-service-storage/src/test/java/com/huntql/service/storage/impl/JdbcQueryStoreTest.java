package com.huntql.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.huntql.service.core.store.RowSet;
import com.huntql.service.core.store.StoreException;
import com.huntql.service.core.store.StoreOptions;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcQueryStoreTest {

    private static final StoreOptions OPTIONS = new StoreOptions(5_000, 100);
    private static final Instant LOGON = Instant.parse("2024-03-01T10:15:30Z");

    private JdbcQueryStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE TABLE security_events (org_id VARCHAR(64), account VARCHAR(64), event_id BIGINT,"
                + " time_generated TIMESTAMP)");
        jdbc.update("INSERT INTO security_events VALUES (?, ?, ?, ?)", "org-1", "alice", 4625L,
                Timestamp.from(LOGON));
        jdbc.update("INSERT INTO security_events VALUES (?, ?, ?, ?)", "org-1", "bob", 4625L,
                Timestamp.from(LOGON.plusSeconds(60)));
        jdbc.update("INSERT INTO security_events VALUES (?, ?, ?, ?)", "org-1", "carol", 4624L,
                Timestamp.from(LOGON.plusSeconds(120)));
        jdbc.update("INSERT INTO security_events VALUES (?, ?, ?, ?)", "org-2", "mallory", 4625L,
                Timestamp.from(LOGON));
        store = new JdbcQueryStore(dataSource);
    }

    @Test
    void bindsPositionalParametersAndKeepsColumnLabels() {
        RowSet rows = store.runParameterized(
                "SELECT account AS \"Account\", COUNT(*) AS \"count_\" FROM security_events"
                        + " WHERE event_id = $1 AND org_id = $2 GROUP BY account ORDER BY account",
                List.of(4625L, "org-1"),
                OPTIONS);

        assertThat(rows.columns()).containsExactly("Account", "count_");
        assertThat(rows.rows()).hasSize(2);
        assertThat(rows.rows().get(0).get(0)).isEqualTo("alice");
        assertThat(((Number) rows.rows().get(1).get(1)).longValue()).isEqualTo(1L);
    }

    @Test
    void instantsRoundTrip() {
        RowSet rows = store.runParameterized(
                "SELECT time_generated AS \"TimeGenerated\" FROM security_events"
                        + " WHERE time_generated > $1 AND org_id = $2 ORDER BY time_generated",
                List.of(LOGON, "org-1"),
                OPTIONS);

        assertThat(rows.rows()).extracting(r -> r.get(0))
                .containsExactly(LOGON.plusSeconds(60), LOGON.plusSeconds(120));
    }

    @Test
    void fetchesAtMostMaxRows() {
        RowSet rows = store.runParameterized(
                "SELECT account AS \"Account\" FROM security_events WHERE org_id = $1 ORDER BY account",
                List.of("org-1"),
                new StoreOptions(5_000, 2));

        assertThat(rows.rows()).extracting(r -> r.get(0)).containsExactly("alice", "bob");
    }

    @Test
    void emptyResultKeepsColumns() {
        RowSet rows = store.runParameterized(
                "SELECT account AS \"Account\" FROM security_events WHERE org_id = $1", List.of("org-3"), OPTIONS);

        assertThat(rows.columns()).containsExactly("Account");
        assertThat(rows.size()).isZero();
    }

    @Test
    void databaseErrorsBecomeStoreExceptions() {
        assertThatThrownBy(() -> store.runParameterized("SELECT nope FROM missing_table", List.of(), OPTIONS))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Store query failed");
    }
}
