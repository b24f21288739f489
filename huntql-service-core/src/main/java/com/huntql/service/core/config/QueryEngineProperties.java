package com.huntql.service.core.config;

import com.huntql.service.core.kql.optimizer.CostModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "huntql.query")
public class QueryEngineProperties {
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private int defaultMaxRows = 10000;
    private String orgColumn = "org_id";
    private Cache cache = new Cache();
    private Store store = new Store();
    private Optimizer optimizer = new Optimizer();
    private Schema schema = new Schema();
    private Templates templates = new Templates();

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getDefaultMaxRows() {
        return defaultMaxRows;
    }

    public void setDefaultMaxRows(int defaultMaxRows) {
        this.defaultMaxRows = defaultMaxRows;
    }

    public String getOrgColumn() {
        return orgColumn;
    }

    public void setOrgColumn(String orgColumn) {
        this.orgColumn = orgColumn;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Optimizer getOptimizer() {
        return optimizer;
    }

    public void setOptimizer(Optimizer optimizer) {
        this.optimizer = optimizer;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    public Templates getTemplates() {
        return templates;
    }

    public void setTemplates(Templates templates) {
        this.templates = templates;
    }

    public static class Cache {
        private long capacity = 1000;
        private Duration ttl = Duration.ofMinutes(5);

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Store {
        private int workers = 8;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class Optimizer {
        private List<String> disabledPasses = new ArrayList<>();
        private int maxIterations = 4;
        private Cost cost = new Cost();

        public List<String> getDisabledPasses() {
            return disabledPasses;
        }

        public void setDisabledPasses(List<String> disabledPasses) {
            this.disabledPasses = disabledPasses;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public Cost getCost() {
            return cost;
        }

        public void setCost(Cost cost) {
            this.cost = cost;
        }
    }

    /** Selectivity and reduction factors fed to the cost estimator; each in (0, 1]. */
    public static class Cost {
        private double equalitySelectivity = 0.1;
        private double rangeSelectivity = 0.3;
        private double stringMatchSelectivity = 0.25;
        private double regexSelectivity = 0.3;
        private double defaultSelectivity = 0.5;
        private double summarizeReduction = 0.01;
        private double distinctReduction = 0.8;

        public double getEqualitySelectivity() {
            return equalitySelectivity;
        }

        public void setEqualitySelectivity(double equalitySelectivity) {
            this.equalitySelectivity = equalitySelectivity;
        }

        public double getRangeSelectivity() {
            return rangeSelectivity;
        }

        public void setRangeSelectivity(double rangeSelectivity) {
            this.rangeSelectivity = rangeSelectivity;
        }

        public double getStringMatchSelectivity() {
            return stringMatchSelectivity;
        }

        public void setStringMatchSelectivity(double stringMatchSelectivity) {
            this.stringMatchSelectivity = stringMatchSelectivity;
        }

        public double getRegexSelectivity() {
            return regexSelectivity;
        }

        public void setRegexSelectivity(double regexSelectivity) {
            this.regexSelectivity = regexSelectivity;
        }

        public double getDefaultSelectivity() {
            return defaultSelectivity;
        }

        public void setDefaultSelectivity(double defaultSelectivity) {
            this.defaultSelectivity = defaultSelectivity;
        }

        public double getSummarizeReduction() {
            return summarizeReduction;
        }

        public void setSummarizeReduction(double summarizeReduction) {
            this.summarizeReduction = summarizeReduction;
        }

        public double getDistinctReduction() {
            return distinctReduction;
        }

        public void setDistinctReduction(double distinctReduction) {
            this.distinctReduction = distinctReduction;
        }

        public CostModel toModel() {
            return new CostModel(
                    equalitySelectivity,
                    rangeSelectivity,
                    stringMatchSelectivity,
                    regexSelectivity,
                    defaultSelectivity,
                    summarizeReduction,
                    distinctReduction);
        }
    }

    public static class Schema {
        private String resource = "classpath:/schema/security-catalog.yml";

        public String getResource() {
            return resource;
        }

        public void setResource(String resource) {
            this.resource = resource;
        }
    }

    public static class Templates {
        private String resource = "classpath:/templates/security-templates.yml";

        public String getResource() {
            return resource;
        }

        public void setResource(String resource) {
            this.resource = resource;
        }
    }
}
