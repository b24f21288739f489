package com.huntql.service.core.config;

import com.huntql.service.core.api.KqlQueryService;
import com.huntql.service.core.api.QueryService;
import com.huntql.service.core.executor.QueryExecutor;
import com.huntql.service.core.executor.QueryResultCache;
import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.completion.CompletionProvider;
import com.huntql.service.core.kql.optimizer.CostEstimator;
import com.huntql.service.core.kql.optimizer.QueryOptimizer;
import com.huntql.service.core.kql.sql.SqlGenerator;
import com.huntql.service.core.schema.ResourceSchemaProvider;
import com.huntql.service.core.schema.SchemaProvider;
import com.huntql.service.core.store.QueryStore;
import com.huntql.service.core.telemetry.QueryTelemetry;
import com.huntql.service.core.telemetry.QueryTelemetryRegistry;
import com.huntql.service.core.template.SecurityTemplateProvider;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.io.ResourceLoader;

@Configuration
@EnableConfigurationProperties(QueryEngineProperties.class)
@PropertySource("classpath:huntql-query-defaults.properties")
public class QueryEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public SchemaProvider schemaProvider(ResourceLoader resourceLoader, QueryEngineProperties props) {
        return new ResourceSchemaProvider(resourceLoader, props.getSchema().getResource());
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityTemplateProvider securityTemplateProvider(
            ResourceLoader resourceLoader, QueryEngineProperties props) {
        return new SecurityTemplateProvider(resourceLoader, props.getTemplates().getResource());
    }

    @Bean
    @ConditionalOnMissingBean
    public SemanticAnalyzer semanticAnalyzer(SchemaProvider schemaProvider) {
        return new SemanticAnalyzer(schemaProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public CostEstimator costEstimator(SchemaProvider schemaProvider, QueryEngineProperties props) {
        return new CostEstimator(schemaProvider, props.getOptimizer().getCost().toModel());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryOptimizer queryOptimizer(
            SemanticAnalyzer semanticAnalyzer, CostEstimator costEstimator, QueryEngineProperties props) {
        QueryEngineProperties.Optimizer optimizer = props.getOptimizer();
        return new QueryOptimizer(
                semanticAnalyzer, costEstimator, optimizer.getDisabledPasses(), optimizer.getMaxIterations());
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlGenerator sqlGenerator(SchemaProvider schemaProvider, QueryEngineProperties props) {
        return new SqlGenerator(schemaProvider, props.getOrgColumn());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryResultCache queryResultCache(QueryEngineProperties props) {
        return new QueryResultCache(props.getCache().getCapacity(), props.getCache().getTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryTelemetry queryTelemetry() {
        return new QueryTelemetryRegistry();
    }

    @Bean(name = "huntqlStoreWorkers", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "huntqlStoreWorkers")
    public ExecutorService huntqlStoreWorkers(QueryEngineProperties props) {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(props.getStore().getWorkers(), r -> {
            Thread thread = new Thread(r, "huntql-store-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryExecutor queryExecutor(
            SemanticAnalyzer semanticAnalyzer,
            QueryOptimizer queryOptimizer,
            SqlGenerator sqlGenerator,
            QueryStore queryStore,
            QueryResultCache queryResultCache,
            QueryTelemetry queryTelemetry,
            @Qualifier("huntqlStoreWorkers") ExecutorService storeWorkers,
            QueryEngineProperties props) {
        return new QueryExecutor(
                semanticAnalyzer,
                queryOptimizer,
                sqlGenerator,
                queryStore,
                queryResultCache,
                queryTelemetry,
                storeWorkers,
                props.getDefaultTimeout().toMillis(),
                props.getDefaultMaxRows());
    }

    @Bean
    @ConditionalOnMissingBean
    public CompletionProvider completionProvider(SchemaProvider schemaProvider, SemanticAnalyzer semanticAnalyzer) {
        return new CompletionProvider(schemaProvider, semanticAnalyzer);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryService queryService(
            QueryExecutor queryExecutor,
            SemanticAnalyzer semanticAnalyzer,
            QueryOptimizer queryOptimizer,
            CompletionProvider completionProvider) {
        return new KqlQueryService(queryExecutor, semanticAnalyzer, queryOptimizer, completionProvider);
    }
}
