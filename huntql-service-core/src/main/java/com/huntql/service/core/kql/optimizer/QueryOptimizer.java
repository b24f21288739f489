package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.TableExpression;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the rewrite passes in a fixed order, repeating the sequence until nothing changes or
 * {@code maxIterations} rounds have run. Sub-queries (a parenthesised source, the right side of a join, union
 * branches) are optimized first, bottom-up.
 *
 * A pass that throws is logged and skipped for that round; the query it was given is kept as is.
 */
@Slf4j
public class QueryOptimizer {

    public static final List<String> PASS_ORDER = List.of(
            ConstantFoldingPass.NAME,
            PredicatePushdownPass.NAME,
            DeadOperationEliminationPass.NAME,
            ProjectionPushdownPass.NAME,
            StageReorderingPass.NAME);

    public static final int DEFAULT_MAX_ITERATIONS = 4;

    private final OptimizationContext context;
    private final List<OptimizerPass> passes;
    private final int maxIterations;

    public QueryOptimizer(SemanticAnalyzer analyzer, CostEstimator costEstimator) {
        this(analyzer, costEstimator, Set.of(), DEFAULT_MAX_ITERATIONS);
    }

    public QueryOptimizer(
            SemanticAnalyzer analyzer, CostEstimator costEstimator, Collection<String> disabledPasses, int maxIterations) {
        this(analyzer, costEstimator, defaultPasses(), disabledPasses, maxIterations);
    }

    public QueryOptimizer(
            SemanticAnalyzer analyzer,
            CostEstimator costEstimator,
            List<OptimizerPass> passes,
            Collection<String> disabledPasses,
            int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, was " + maxIterations);
        }
        Set<String> disabled = new LinkedHashSet<>();
        disabledPasses.forEach(name -> disabled.add(name.trim().toLowerCase(Locale.ROOT)));
        this.context = new OptimizationContext(analyzer, costEstimator);
        this.passes = passes.stream().filter(p -> !disabled.contains(p.name())).toList();
        this.maxIterations = maxIterations;
        if (!disabled.isEmpty()) {
            log.info("Optimizer passes disabled={} enabled={}", disabled, enabledPasses());
        }
    }

    public static List<OptimizerPass> defaultPasses() {
        return List.of(
                new ConstantFoldingPass(),
                new PredicatePushdownPass(),
                new DeadOperationEliminationPass(),
                new ProjectionPushdownPass(),
                new StageReorderingPass());
    }

    public List<String> enabledPasses() {
        return passes.stream().map(OptimizerPass::name).toList();
    }

    public CostEstimator costEstimator() {
        return context.costEstimator();
    }

    public Query optimize(Query query) {
        return optimizeWithReport(query).query();
    }

    /** Optimizes {@code query} and reports which passes changed it, in first-applied order. */
    public Result optimizeWithReport(Query query) {
        Set<String> applied = new LinkedHashSet<>();
        Query optimized = run(query, applied);
        return new Result(optimized, List.copyOf(applied));
    }

    private Query run(Query query, Set<String> applied) {
        Query current = optimizeNested(query, applied);
        for (int round = 0; round < maxIterations; round++) {
            Query before = current;
            for (OptimizerPass pass : passes) {
                Query rewritten = applySafely(pass, current);
                if (!rewritten.equals(current)) {
                    applied.add(pass.name());
                    current = rewritten;
                }
            }
            if (current.equals(before)) {
                break;
            }
        }
        return current;
    }

    private Query applySafely(OptimizerPass pass, Query query) {
        try {
            return pass.apply(query, context);
        } catch (RuntimeException ex) {
            log.warn("Optimizer pass {} failed, keeping input unchanged", pass.name(), ex);
            return query;
        }
    }

    private Query optimizeNested(Query query, Set<String> applied) {
        Query out = query.source().isSubquery()
                ? query.withSource(query.source().withSubquery(run(query.source().subquery(), applied)))
                : query;
        List<Operation> pipeline = new ArrayList<>(out.pipeline().size());
        for (Operation op : out.pipeline()) {
            if (op instanceof Operation.Join j && j.right().isSubquery()) {
                pipeline.add(new Operation.Join(j.kind(), nested(j.right(), applied), j.on()));
            } else if (op instanceof Operation.Union u) {
                pipeline.add(new Operation.Union(
                        u.kind(), u.others().stream().map(t -> nested(t, applied)).toList()));
            } else {
                pipeline.add(op);
            }
        }
        return out.withPipeline(pipeline);
    }

    private TableExpression nested(TableExpression table, Set<String> applied) {
        return table.isSubquery() ? table.withSubquery(run(table.subquery(), applied)) : table;
    }

    public record Result(Query query, List<String> appliedPasses) {}
}
