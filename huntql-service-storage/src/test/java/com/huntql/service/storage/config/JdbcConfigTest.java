package com.huntql.service.storage.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.huntql.service.core.store.QueryStore;
import com.huntql.service.storage.impl.JdbcQueryStore;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcConfigTest {

    @Test
    void exposesAJdbcStoreOverTheDataSource() {
        new ApplicationContextRunner()
                .withUserConfiguration(JdbcConfig.class)
                .withBean(DataSource.class, () -> new DriverManagerDataSource("jdbc:h2:mem:jdbc-config"))
                .run(context -> assertThat(context).getBean(QueryStore.class).isInstanceOf(JdbcQueryStore.class));
    }
}
