package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.ast.BinaryOperator;
import com.huntql.service.core.kql.ast.ColumnNaming;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.SortKey;
import com.huntql.service.core.kql.ast.UnaryOperator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Reference evaluator over in-memory rows; covers the subset of KQL the optimizer property test generates. */
final class PipelineInterpreter {

    private final Map<String, List<Map<String, Object>>> tables;

    PipelineInterpreter(Map<String, List<Map<String, Object>>> tables) {
        this.tables = tables;
    }

    List<Map<String, Object>> run(Query query) {
        List<Map<String, Object>> rows = query.source().isSubquery()
                ? run(query.source().subquery())
                : copy(tables.get(query.source().name()));
        for (Operation op : query.pipeline()) {
            rows = apply(op, rows);
        }
        return rows;
    }

    private List<Map<String, Object>> apply(Operation op, List<Map<String, Object>> rows) {
        if (op instanceof Operation.Where w) {
            return rows.stream().filter(r -> Boolean.TRUE.equals(eval(w.predicate(), r))).toList();
        }
        if (op instanceof Operation.Project p) {
            List<String> names = ColumnNaming.names(p.columns());
            List<Map<String, Object>> out = new ArrayList<>();
            for (Map<String, Object> row : rows) {
                Map<String, Object> next = new LinkedHashMap<>();
                for (int i = 0; i < names.size(); i++) {
                    next.put(names.get(i), eval(p.columns().get(i).expr(), row));
                }
                out.add(next);
            }
            return out;
        }
        if (op instanceof Operation.Extend e) {
            List<String> names = ColumnNaming.names(e.columns());
            List<Map<String, Object>> out = new ArrayList<>();
            for (Map<String, Object> row : rows) {
                Map<String, Object> next = new LinkedHashMap<>(row);
                for (int i = 0; i < names.size(); i++) {
                    next.put(names.get(i), eval(e.columns().get(i).expr(), next));
                }
                out.add(next);
            }
            return out;
        }
        if (op instanceof Operation.Summarize s) {
            return summarize(s, rows);
        }
        if (op instanceof Operation.OrderBy o) {
            return sorted(rows, o.keys());
        }
        if (op instanceof Operation.Top t) {
            List<Map<String, Object>> ordered = t.keys().isEmpty() ? rows : sorted(rows, t.keys());
            return ordered.subList(0, (int) Math.min(t.count(), ordered.size()));
        }
        if (op instanceof Operation.Limit l) {
            return rows.subList(0, (int) Math.min(l.count(), rows.size()));
        }
        if (op instanceof Operation.Distinct d && d.allColumns()) {
            return new ArrayList<>(new LinkedHashSet<>(rows));
        }
        throw new UnsupportedOperationException(op.keyword());
    }

    private List<Map<String, Object>> summarize(Operation.Summarize s, List<Map<String, Object>> rows) {
        List<String> names = ColumnNaming.names(s);
        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<Object> key = new ArrayList<>();
            for (ProjectItem k : s.groupBy()) {
                key.add(eval(k.expr(), row));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (groups.isEmpty() && s.groupBy().isEmpty()) {
            groups.put(List.of(), List.of());
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map.Entry<List<Object>, List<Map<String, Object>>> group : groups.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            int i = 0;
            for (Object keyValue : group.getKey()) {
                row.put(names.get(i++), keyValue);
            }
            for (ProjectItem agg : s.aggregations()) {
                row.put(names.get(i++), aggregate(agg.expr(), group.getValue()));
            }
            out.add(row);
        }
        return out;
    }

    private Object aggregate(Expr expr, List<Map<String, Object>> group) {
        if (expr instanceof Expr.Literal lit) {
            return lit.value();
        }
        if (expr instanceof Expr.BinaryOp b) {
            return arithmetic(b.op(), aggregate(b.left(), group), aggregate(b.right(), group));
        }
        Expr.FunctionCall call = (Expr.FunctionCall) expr;
        switch (call.name().toLowerCase(Locale.ROOT)) {
            case "count" -> {
                return (long) group.size();
            }
            case "sum" -> {
                long sum = 0;
                for (Map<String, Object> row : group) {
                    sum += (Long) eval(call.args().get(0), row);
                }
                return sum;
            }
            case "max" -> {
                Long max = null;
                for (Map<String, Object> row : group) {
                    long v = (Long) eval(call.args().get(0), row);
                    max = max == null ? v : Math.max(max, v);
                }
                return max;
            }
            default -> throw new UnsupportedOperationException(call.name());
        }
    }

    private static List<Map<String, Object>> sorted(List<Map<String, Object>> rows, List<SortKey> keys) {
        Comparator<Map<String, Object>> comparator = null;
        for (SortKey key : keys) {
            Comparator<Map<String, Object>> next = (a, b) -> compare(eval(key.expr(), a), eval(key.expr(), b));
            if (key.descending()) next = next.reversed();
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        List<Map<String, Object>> out = new ArrayList<>(rows);
        out.sort(comparator);
        return out;
    }

    @SuppressWarnings("unchecked")
    private static int compare(Object a, Object b) {
        return ((Comparable<Object>) a).compareTo(b);
    }

    static Object eval(Expr expr, Map<String, Object> row) {
        if (expr instanceof Expr.Literal lit) {
            return lit.value();
        }
        if (expr instanceof Expr.ColumnRef ref) {
            if (row.containsKey(ref.name())) return row.get(ref.name());
            for (Map.Entry<String, Object> e : row.entrySet()) {
                if (e.getKey().equalsIgnoreCase(ref.name())) return e.getValue();
            }
            throw new IllegalStateException("No column " + ref.name() + " in " + row.keySet());
        }
        if (expr instanceof Expr.UnaryOp u) {
            Object v = eval(u.operand(), row);
            if (u.op() == UnaryOperator.NOT) {
                return !(Boolean) v;
            }
            return -(Long) v;
        }
        if (expr instanceof Expr.FunctionCall f && f.name().equalsIgnoreCase("strlen")) {
            return (long) ((String) eval(f.args().get(0), row)).length();
        }
        if (expr instanceof Expr.BinaryOp b) {
            if (b.op() == BinaryOperator.AND) {
                return (Boolean) eval(b.left(), row) && (Boolean) eval(b.right(), row);
            }
            if (b.op() == BinaryOperator.OR) {
                return (Boolean) eval(b.left(), row) || (Boolean) eval(b.right(), row);
            }
            Object l = eval(b.left(), row);
            Object r = eval(b.right(), row);
            return switch (b.op()) {
                case EQ -> l.equals(r);
                case NE -> !l.equals(r);
                case LT -> compare(l, r) < 0;
                case LE -> compare(l, r) <= 0;
                case GT -> compare(l, r) > 0;
                case GE -> compare(l, r) >= 0;
                case CONTAINS -> ((String) l).toLowerCase(Locale.ROOT).contains(((String) r).toLowerCase(Locale.ROOT));
                default -> arithmetic(b.op(), l, r);
            };
        }
        throw new UnsupportedOperationException(expr.toString());
    }

    private static Object arithmetic(BinaryOperator op, Object l, Object r) {
        long a = (Long) l;
        long b = (Long) r;
        return switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            default -> throw new UnsupportedOperationException(op.symbol());
        };
    }

    private static List<Map<String, Object>> copy(List<Map<String, Object>> rows) {
        return rows.stream().<Map<String, Object>>map(LinkedHashMap::new).toList();
    }
}
