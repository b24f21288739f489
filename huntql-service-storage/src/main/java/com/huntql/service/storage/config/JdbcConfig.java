package com.huntql.service.storage.config;

import com.huntql.service.core.store.QueryStore;
import com.huntql.service.storage.impl.JdbcQueryStore;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
public class JdbcConfig {

    @Bean
    @ConditionalOnMissingBean
    public QueryStore queryStore(DataSource dataSource) {
        return new JdbcQueryStore(dataSource);
    }
}
