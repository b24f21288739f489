package com.huntql.service.core.executor;

import com.huntql.service.core.error.InternalQueryException;
import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.lexer.KqlLexer;
import com.huntql.service.core.kql.lexer.Token;
import com.huntql.service.core.kql.optimizer.QueryOptimizer;
import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.kql.sql.GeneratedSql;
import com.huntql.service.core.kql.sql.SqlGenerator;
import com.huntql.service.core.kql.sql.TimeRange;
import com.huntql.service.core.store.QueryStore;
import com.huntql.service.core.store.RowSet;
import com.huntql.service.core.store.StoreOptions;
import com.huntql.service.core.telemetry.QueryTelemetry;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one query end to end: lex, parse and validate, look up the result cache, then optimize, generate SQL and
 * call the backing store under a timeout and a row cap.
 *
 * <p>The compile stages run on the calling thread. The store call runs on {@code storeWorkers}; when it exceeds
 * its budget the future is cancelled, which interrupts the worker, and the call ends in
 * {@link ExecutionState#TIMED_OUT}. Failures are rethrown as {@link QueryException} with the metrics gathered so far
 * attached; an unexpected runtime exception is wrapped into an {@link InternalQueryException} of the stage it came
 * from.
 */
@Slf4j
public class QueryExecutor {

    private final KqlLexer lexer = new KqlLexer();
    private final KqlParser parser = new KqlParser();
    private final SemanticAnalyzer analyzer;
    private final QueryOptimizer optimizer;
    private final SqlGenerator generator;
    private final QueryStore store;
    private final QueryResultCache cache;
    private final QueryTelemetry telemetry;
    private final ExecutorService storeWorkers;
    private final long defaultTimeoutMs;
    private final int defaultMaxRows;

    public QueryExecutor(
            SemanticAnalyzer analyzer,
            QueryOptimizer optimizer,
            SqlGenerator generator,
            QueryStore store,
            QueryResultCache cache,
            QueryTelemetry telemetry,
            ExecutorService storeWorkers,
            long defaultTimeoutMs,
            int defaultMaxRows) {
        this.analyzer = analyzer;
        this.optimizer = optimizer;
        this.generator = generator;
        this.store = store;
        this.cache = cache;
        this.telemetry = telemetry;
        this.storeWorkers = storeWorkers;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.defaultMaxRows = defaultMaxRows;
    }

    public ExecutionResult execute(String queryText, String orgId) {
        return execute(queryText, orgId, ExecutionOptions.defaults());
    }

    /**
     * @return a {@link ExecutionState#COMPLETED} or {@link ExecutionState#TIMED_OUT} result
     * @throws QueryException when any stage fails; {@link QueryException#stage()} names it
     */
    public ExecutionResult execute(String queryText, String orgId, ExecutionOptions options) {
        Objects.requireNonNull(queryText, "queryText");
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalArgumentException("orgId is required");
        }
        ExecutionOptions effective = options == null ? ExecutionOptions.defaults() : options;
        long timeoutMs = effective.timeoutMsOr(defaultTimeoutMs);
        int maxRows = effective.maxRowsOr(defaultMaxRows);

        Call call = new Call();
        call.advance(ExecutionState.PARSING);
        long started = System.nanoTime();
        List<Token> tokens;
        Query query;
        QueryStage stage = QueryStage.LEX;
        try {
            tokens = lexer.tokenize(queryText);
            stage = QueryStage.PARSE;
            query = parser.parse(tokens);
            stage = QueryStage.VALIDATE;
            analyzer.analyze(query);
        } catch (QueryException e) {
            call.parseMs = elapsedMs(started);
            throw fail(call, e);
        } catch (RuntimeException e) {
            call.parseMs = elapsedMs(started);
            throw fail(call, new InternalQueryException(stage, e));
        }
        call.parseMs = elapsedMs(started);

        String fingerprint =
                QueryFingerprint.of(lexer.normalize(tokens), orgId, bindings(maxRows, effective.timeRange()));
        Optional<CacheEntry> cached = effective.bypassCache() ? Optional.empty() : cache.get(fingerprint);
        if (cached.isPresent()) {
            CacheEntry entry = cached.get();
            call.cacheHit = true;
            call.rowCount = entry.result().size();
            call.advance(ExecutionState.COMPLETED);
            ExecutionMetrics metrics = call.snapshot();
            telemetry.recordCompleted(metrics, entry.truncated());
            log.debug("Query served from cache fingerprint={} rows={}", fingerprint, call.rowCount);
            return ExecutionResult.completed(entry.result(), entry.truncated(), metrics);
        }

        call.advance(ExecutionState.OPTIMIZING);
        started = System.nanoTime();
        QueryOptimizer.Result optimized;
        try {
            optimized = optimizer.optimizeWithReport(query);
        } catch (QueryException e) {
            call.optimizeMs = elapsedMs(started);
            throw fail(call, e);
        } catch (RuntimeException e) {
            call.optimizeMs = elapsedMs(started);
            throw fail(call, new InternalQueryException(QueryStage.OPTIMIZE, e));
        }
        call.optimizeMs = elapsedMs(started);
        telemetry.recordOptimizerPasses(optimized.appliedPasses());

        call.advance(ExecutionState.GENERATING);
        started = System.nanoTime();
        GeneratedSql sql;
        try {
            sql = generator.generate(optimized.query(), orgId, effective.timeRange());
        } catch (QueryException e) {
            call.generateMs = elapsedMs(started);
            throw fail(call, e);
        } catch (RuntimeException e) {
            call.generateMs = elapsedMs(started);
            throw fail(call, new InternalQueryException(QueryStage.GENERATE, e));
        }
        call.generateMs = elapsedMs(started);

        call.advance(ExecutionState.EXECUTING);
        started = System.nanoTime();
        StoreOptions storeOptions = new StoreOptions(timeoutMs, maxRows == Integer.MAX_VALUE ? maxRows : maxRows + 1);
        RowSet rows;
        try {
            rows = runOnStore(sql, storeOptions, timeoutMs);
        } catch (TimeoutException e) {
            call.executeMs = elapsedMs(started);
            call.advance(ExecutionState.TIMED_OUT);
            ExecutionMetrics metrics = call.snapshot();
            log.warn("Query timed out after {} ms (budget {} ms) fingerprint={}", call.executeMs, timeoutMs, fingerprint);
            telemetry.recordTimedOut(metrics);
            return ExecutionResult.timedOut(metrics);
        } catch (QueryExecutionException e) {
            call.executeMs = elapsedMs(started);
            throw fail(call, e);
        }
        call.executeMs = elapsedMs(started);

        boolean truncated = rows.size() > maxRows;
        RowSet capped = rows.limit(maxRows);
        if (!effective.bypassCache()) {
            cache.put(fingerprint, capped, truncated);
        }
        call.rowCount = capped.size();
        call.advance(ExecutionState.COMPLETED);
        ExecutionMetrics metrics = call.snapshot();
        telemetry.recordCompleted(metrics, truncated);
        log.debug("Query completed rows={} truncated={} metrics={}", capped.size(), truncated, metrics);
        return ExecutionResult.completed(capped, truncated, metrics);
    }

    /** Values besides the text and organization that change the result. */
    private static Map<String, Object> bindings(int maxRows, TimeRange timeRange) {
        Map<String, Object> bindings = new TreeMap<>();
        bindings.put("maxRows", maxRows);
        if (timeRange != null) {
            bindings.put("timeRangeStart", timeRange.start().toString());
            bindings.put("timeRangeEnd", timeRange.end().toString());
        }
        return bindings;
    }

    private RowSet runOnStore(GeneratedSql sql, StoreOptions options, long timeoutMs) throws TimeoutException {
        Future<RowSet> future;
        try {
            future = storeWorkers.submit(() -> store.runParameterized(sql.sql(), sql.params(), options));
        } catch (RejectedExecutionException e) {
            throw new QueryExecutionException("Backing store worker pool rejected the query", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for the backing store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new QueryExecutionException("Backing store failed: " + cause.getMessage(), cause);
        }
    }

    private QueryException fail(Call call, QueryException e) {
        call.advance(ExecutionState.FAILED);
        ExecutionMetrics metrics = call.snapshot();
        e.attachMetrics(metrics);
        telemetry.recordFailed(e.stage(), metrics);
        if (e.stage() == QueryStage.GENERATE) {
            log.error("Query could not be translated to SQL: {}", e.getMessage());
        } else if (e instanceof InternalQueryException) {
            log.error("Query failed unexpectedly at stage {}", e.stage(), e.getCause());
        } else if (e.stage() == QueryStage.EXECUTE) {
            log.warn("Query failed in the backing store: {}", e.getMessage(), e.getCause());
        } else if (log.isDebugEnabled()) {
            log.debug("Query rejected at stage {}: {}", e.stage(), e.getMessage());
        }
        return e;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    /** Mutable per-call state; confined to the calling thread. */
    private static final class Call {
        private ExecutionState state = ExecutionState.PENDING;
        private long parseMs;
        private long optimizeMs;
        private long generateMs;
        private long executeMs;
        private long rowCount;
        private boolean cacheHit;

        void advance(ExecutionState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal execution state transition " + state + " -> " + next);
            }
            state = next;
        }

        ExecutionMetrics snapshot() {
            return new ExecutionMetrics(parseMs, optimizeMs, generateMs, executeMs, rowCount, cacheHit);
        }
    }
}
