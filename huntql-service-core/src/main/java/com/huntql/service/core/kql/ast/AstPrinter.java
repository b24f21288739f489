package com.huntql.service.core.kql.ast;

import com.huntql.service.core.kql.lexer.KqlLexer;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders an AST back to canonical KQL. The output re-parses to an equal tree; it is also the plan text shown by
 * {@code explain}.
 */
public final class AstPrinter {

    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private AstPrinter() {}

    public static String print(Query query) {
        StringBuilder sb = new StringBuilder(table(query.source()));
        for (Operation op : query.pipeline()) {
            sb.append(" | ").append(print(op));
        }
        return sb.toString();
    }

    /** One stage per line; used for explain output. */
    public static String printMultiline(Query query) {
        StringBuilder sb = new StringBuilder(table(query.source()));
        for (Operation op : query.pipeline()) {
            sb.append("\n| ").append(print(op));
        }
        return sb.toString();
    }

    public static String print(Operation op) {
        if (op instanceof Operation.Where w) {
            return "where " + print(w.predicate());
        }
        if (op instanceof Operation.Project p) {
            return "project " + items(p.columns());
        }
        if (op instanceof Operation.Extend e) {
            return "extend " + items(e.columns());
        }
        if (op instanceof Operation.Summarize s) {
            StringBuilder sb = new StringBuilder("summarize");
            if (!s.aggregations().isEmpty()) sb.append(' ').append(items(s.aggregations()));
            if (!s.groupBy().isEmpty()) sb.append(" by ").append(items(s.groupBy()));
            return sb.toString();
        }
        if (op instanceof Operation.OrderBy o) {
            return "order by " + keys(o.keys());
        }
        if (op instanceof Operation.Top t) {
            return t.keys().isEmpty() ? "top " + t.count() : "top " + t.count() + " by " + keys(t.keys());
        }
        if (op instanceof Operation.Limit l) {
            return "limit " + l.count();
        }
        if (op instanceof Operation.Distinct d) {
            return d.allColumns()
                    ? "distinct *"
                    : "distinct " + d.columns().stream().map(AstPrinter::print).collect(Collectors.joining(", "));
        }
        if (op instanceof Operation.Join j) {
            return "join kind=" + j.kind().kql() + " " + table(j.right()) + " on " + print(j.on());
        }
        if (op instanceof Operation.Union u) {
            return "union kind=" + u.kind().name().toLowerCase(Locale.ROOT) + " "
                    + u.others().stream().map(AstPrinter::table).collect(Collectors.joining(", "));
        }
        throw new IllegalArgumentException("Unknown operation: " + op);
    }

    public static String print(Expr expr) {
        if (expr instanceof Expr.Literal lit) {
            return literal(lit);
        }
        if (expr instanceof Expr.ColumnRef ref) {
            return ref.isQualified() ? ref.qualifier() + "." + dotted(ref.name()) : name(ref.name());
        }
        if (expr instanceof Expr.BinaryOp b) {
            return operand(b.left()) + " " + b.op().symbol() + " " + operand(b.right());
        }
        if (expr instanceof Expr.UnaryOp u) {
            return u.op() == UnaryOperator.NOT ? "not (" + print(u.operand()) + ")" : "-(" + print(u.operand()) + ")";
        }
        if (expr instanceof Expr.FunctionCall f) {
            return f.name() + "(" + f.args().stream().map(AstPrinter::print).collect(Collectors.joining(", ")) + ")";
        }
        if (expr instanceof Expr.Case c) {
            StringBuilder sb = new StringBuilder("case(");
            for (Expr.CaseBranch branch : c.branches()) {
                sb.append(print(branch.when())).append(", ").append(print(branch.then())).append(", ");
            }
            return sb.append(print(c.otherwise())).append(')').toString();
        }
        if (expr instanceof Expr.ListExpr l) {
            return "(" + l.items().stream().map(AstPrinter::print).collect(Collectors.joining(", ")) + ")";
        }
        throw new IllegalArgumentException("Unknown expression: " + expr);
    }

    /** Quotes a column or table name when it would not read back as the same plain identifier. */
    public static String name(String name) {
        if (PLAIN_NAME.matcher(name).matches()
                && !KqlLexer.KEYWORDS.contains(name.toLowerCase(Locale.ROOT))
                && !isLiteralWord(name)) {
            return name;
        }
        return "['" + name + "']";
    }

    private static String dotted(String path) {
        return path.chars().allMatch(ch -> ch == '.' || Character.isLetterOrDigit(ch) || ch == '_')
                ? path
                : name(path);
    }

    private static boolean isLiteralWord(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("true") || lower.equals("false") || lower.equals("null");
    }

    private static String operand(Expr e) {
        return e instanceof Expr.BinaryOp ? "(" + print(e) + ")" : print(e);
    }

    private static String table(TableExpression t) {
        String base = t.isSubquery() ? "(" + print(t.subquery()) + ")" : name(t.name());
        return t.alias() == null ? base : base + " as " + name(t.alias());
    }

    private static String items(List<ProjectItem> items) {
        return items.stream()
                .map(i -> i.hasExplicitName() ? name(i.name()) + " = " + print(i.expr()) : print(i.expr()))
                .collect(Collectors.joining(", "));
    }

    private static String keys(List<SortKey> keys) {
        return keys.stream()
                .map(k -> print(k.expr()) + (k.descending() ? " desc" : " asc"))
                .collect(Collectors.joining(", "));
    }

    private static String literal(Expr.Literal lit) {
        return switch (lit.kind()) {
            case STRING -> quote((String) lit.value());
            case LONG, REAL, BOOL -> String.valueOf(lit.value());
            case DATETIME -> "datetime(" + lit.value() + ")";
            case TIMESPAN -> timespan((Duration) lit.value());
            case GUID -> "guid(" + lit.value() + ")";
            case NULL -> "null";
        };
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** Compound form, largest unit first: {@code 1d2h30m}, {@code 150ms}, {@code 0s}. */
    public static String timespan(Duration d) {
        if (d.isZero()) return "0s";
        if (d.isNegative()) return "-" + timespan(d.negated());
        StringBuilder sb = new StringBuilder();
        long nanos = d.getNano();
        append(sb, d.toDays(), "d");
        append(sb, d.toHoursPart(), "h");
        append(sb, d.toMinutesPart(), "m");
        append(sb, d.toSecondsPart(), "s");
        append(sb, nanos / 1_000_000, "ms");
        append(sb, (nanos / 1_000) % 1_000, "us");
        append(sb, (nanos / 100) % 10, "tick");
        return sb.toString();
    }

    private static void append(StringBuilder sb, long amount, String unit) {
        if (amount > 0) sb.append(amount).append(unit);
    }
}
