package com.huntql.service.core.kql.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Output column naming rules shared by the analyzer, optimizer and SQL generator.
 *
 * <ul>
 *   <li>an explicit {@code Name = expr} wins</li>
 *   <li>a column reference keeps the column's name</li>
 *   <li>aggregations are {@code count_}, {@code <fn>_<column>} or {@code <fn>_}</li>
 *   <li>{@code bin(col, ...)} keeps {@code col}</li>
 *   <li>anything else is {@code Column1}, {@code Column2}, ... numbered per operation</li>
 * </ul>
 */
public final class ColumnNaming {

    private ColumnNaming() {}

    /** Names for project/extend items. */
    public static List<String> names(List<ProjectItem> items) {
        Counter counter = new Counter();
        List<String> out = new ArrayList<>(items.size());
        for (ProjectItem item : items) {
            out.add(scalarName(item, counter));
        }
        return out;
    }

    /** Names of a summarize output: group keys first, then aggregations. */
    public static List<String> names(Operation.Summarize summarize) {
        Counter counter = new Counter();
        List<String> out = new ArrayList<>();
        for (ProjectItem key : summarize.groupBy()) {
            out.add(scalarName(key, counter));
        }
        for (ProjectItem agg : summarize.aggregations()) {
            out.add(aggregateName(agg, counter));
        }
        return out;
    }

    public static List<String> distinctNames(List<Expr> columns) {
        return names(columns.stream().map(ProjectItem::of).toList());
    }

    /** Copy of {@code items} where every item carries its effective name explicitly. */
    public static List<ProjectItem> materialize(List<ProjectItem> items) {
        List<String> names = names(items);
        List<ProjectItem> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            out.add(new ProjectItem(names.get(i), items.get(i).expr()));
        }
        return out;
    }

    public static Operation.Summarize materialize(Operation.Summarize summarize) {
        List<String> names = names(summarize);
        int keys = summarize.groupBy().size();
        List<ProjectItem> groupBy = new ArrayList<>();
        for (int i = 0; i < keys; i++) {
            groupBy.add(new ProjectItem(names.get(i), summarize.groupBy().get(i).expr()));
        }
        List<ProjectItem> aggs = new ArrayList<>();
        for (int i = 0; i < summarize.aggregations().size(); i++) {
            aggs.add(new ProjectItem(names.get(keys + i), summarize.aggregations().get(i).expr()));
        }
        return new Operation.Summarize(aggs, groupBy);
    }

    private static String scalarName(ProjectItem item, Counter counter) {
        if (item.hasExplicitName()) return item.name();
        Expr expr = item.expr();
        if (expr instanceof Expr.ColumnRef ref) {
            return ref.name();
        }
        if (expr instanceof Expr.FunctionCall call
                && call.name().equalsIgnoreCase("bin")
                && !call.args().isEmpty()
                && call.args().get(0) instanceof Expr.ColumnRef ref) {
            return ref.name();
        }
        return counter.next();
    }

    private static String aggregateName(ProjectItem item, Counter counter) {
        if (item.hasExplicitName()) return item.name();
        if (item.expr() instanceof Expr.FunctionCall call) {
            String fn = call.name().toLowerCase(Locale.ROOT);
            if (fn.equals("count") || call.args().isEmpty()) {
                return fn + "_";
            }
            if (call.args().get(0) instanceof Expr.ColumnRef ref) {
                return fn + "_" + ref.name();
            }
            return fn + "_";
        }
        return counter.next();
    }

    private static final class Counter {
        private int next = 1;

        String next() {
            return "Column" + next++;
        }
    }
}
