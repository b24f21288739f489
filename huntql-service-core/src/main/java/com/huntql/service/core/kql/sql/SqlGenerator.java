package com.huntql.service.core.kql.sql;

import com.huntql.service.core.kql.analysis.JoinLayout;
import com.huntql.service.core.kql.analysis.Scope;
import com.huntql.service.core.kql.ast.BinaryOperator;
import com.huntql.service.core.kql.ast.ColumnNaming;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.LiteralKind;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.SortKey;
import com.huntql.service.core.kql.ast.TableExpression;
import com.huntql.service.core.kql.ast.UnaryOperator;
import com.huntql.service.core.kql.ast.UnionKind;
import com.huntql.service.core.schema.ColumnInfo;
import com.huntql.service.core.schema.ColumnType;
import com.huntql.service.core.schema.SchemaProvider;
import com.huntql.service.core.schema.TableInfo;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lowers a query to PostgreSQL/Timescale SQL with positional {@code $n} parameters.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>every literal becomes a bound parameter; the SQL text only ever contains catalog identifiers, quoted
 *       output aliases and fixed keywords</li>
 *   <li>every scan of a catalog table, wherever it appears (source, sub-query, join right side, union branch),
 *       carries {@code <org column> = $n} as the last top-level conjunct of its {@code WHERE}</li>
 *   <li>with a {@link TimeRange}, every such scan also carries {@code <time column> BETWEEN $a AND $b} right before
 *       the organization predicate</li>
 * </ul>
 *
 * Stages fold into one {@code SELECT} while that stays equivalent (a filter after {@code project}, a limit after
 * {@code order by}); otherwise the block built so far becomes a sub-query.
 */
public class SqlGenerator {

    public static final String DEFAULT_ORG_COLUMN = "org_id";

    private final SchemaProvider schema;
    private final String orgColumn;

    public SqlGenerator(SchemaProvider schema) {
        this(schema, DEFAULT_ORG_COLUMN);
    }

    public SqlGenerator(SchemaProvider schema, String orgColumn) {
        this.schema = Objects.requireNonNull(schema, "schema");
        if (orgColumn == null || orgColumn.isBlank()) {
            throw new IllegalArgumentException("orgColumn is required");
        }
        this.orgColumn = orgColumn;
    }

    public String orgColumn() {
        return orgColumn;
    }

    /**
     * @throws GenerationException when the query holds a construct with no SQL lowering
     * @throws IllegalArgumentException when {@code orgId} is blank
     */
    public GeneratedSql generate(Query query, String orgId) {
        return generate(query, orgId, null);
    }

    /**
     * @param timeRange optional window; a scanned table without a time column is then a {@link GenerationException}
     */
    public GeneratedSql generate(Query query, String orgId, TimeRange timeRange) {
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalArgumentException("orgId is required");
        }
        return new Run(orgId, timeRange).query(query).render().render();
    }

    @FunctionalInterface
    private interface Columns {
        SqlText resolve(Expr.ColumnRef ref);
    }

    private final class Run {
        private final String orgId;
        private final TimeRange timeRange;
        private int aliases;

        Run(String orgId, TimeRange timeRange) {
            this.orgId = orgId;
            this.timeRange = timeRange;
        }

        SelectBlock query(Query query) {
            SelectBlock block = source(query.source());
            for (Operation op : query.pipeline()) {
                block = operation(block, op, query.source().alias());
            }
            return block;
        }

        SelectBlock source(TableExpression table) {
            if (table.isSubquery()) {
                return wrap(query(table.subquery()));
            }
            TableInfo info = schema.findTable(table.name())
                    .orElseThrow(() -> new GenerationException(
                            "table " + table.name(), "Unknown table '" + table.name() + "'"));
            List<SelectBlock.Column> columns = info.columns().stream()
                    .map(c -> new SelectBlock.Column(c.name(), SqlText.raw(SqlText.identifier(c.sqlName()))))
                    .toList();
            SqlText scope = SqlText.concat(SqlText.identifier(orgColumn) + " = ", SqlText.param(orgId));
            if (timeRange != null) {
                scope = SqlText.concat(timeWindow(info), " AND ", scope);
            }
            return SelectBlock.table(SqlText.raw(SqlText.identifier(info.sqlName())), columns, scope);
        }

        private SqlText timeWindow(TableInfo info) {
            ColumnInfo time = info.findTimeColumn()
                    .orElseThrow(() -> new GenerationException(
                            "time range on " + info.name(),
                            "Table '" + info.name() + "' has no time column to apply the time range to"));
            return SqlText.concat(
                    SqlText.identifier(time.sqlName()) + " BETWEEN ",
                    SqlText.param(timeRange.start(), "timestamptz"),
                    " AND ",
                    SqlText.param(timeRange.end(), "timestamptz"));
        }

        SelectBlock wrap(SelectBlock inner) {
            String alias = nextAlias();
            return SelectBlock.derived(
                    SqlText.concat("(", inner.render(), ") AS " + alias), aliased(inner.names(), alias));
        }

        private String nextAlias() {
            return "q" + (++aliases);
        }

        SelectBlock operation(SelectBlock block, Operation op, String sourceAlias) {
            if (op instanceof Operation.Where w) {
                SelectBlock target = block.isGrouped() || block.isLimited() || block.isDistinct() ? wrap(block) : block;
                target.where(condition(w.predicate(), columnsOf(target.columns())));
                return target;
            }
            if (op instanceof Operation.Project p) {
                SelectBlock target = block.isGrouped() || block.isDistinct() ? wrap(block) : block;
                target.columns(items(p.columns(), columnsOf(target.columns())));
                return target;
            }
            if (op instanceof Operation.Extend e) {
                SelectBlock target = block.isGrouped() || block.isDistinct() ? wrap(block) : block;
                target.columns(extend(e, target.columns()));
                return target;
            }
            if (op instanceof Operation.Summarize s) {
                SelectBlock target = block.isGrouped() || block.isDistinct() || block.isLimited() || block.isOrdered()
                        ? wrap(block)
                        : block;
                summarize(s, target);
                return target;
            }
            if (op instanceof Operation.OrderBy o) {
                SelectBlock target = block.isLimited() || block.isGrouped() || block.isDistinct() ? wrap(block) : block;
                target.orderBy(sortKeys(o.keys(), columnsOf(target.columns())));
                return target;
            }
            if (op instanceof Operation.Top t) {
                SelectBlock target = block.isLimited() || block.isGrouped() || block.isDistinct() ? wrap(block) : block;
                if (!t.keys().isEmpty()) {
                    target.orderBy(sortKeys(t.keys(), columnsOf(target.columns())));
                }
                target.limit(t.count());
                return target;
            }
            if (op instanceof Operation.Limit l) {
                block.limit(l.count());
                return block;
            }
            if (op instanceof Operation.Distinct d) {
                SelectBlock target =
                        block.isGrouped() || block.isLimited() || block.isOrdered() || block.isDistinct()
                                ? wrap(block)
                                : block;
                if (!d.allColumns()) {
                    target.columns(items(d.columns().stream().map(ProjectItem::of).toList(),
                            columnsOf(target.columns())));
                }
                target.distinct();
                return target;
            }
            if (op instanceof Operation.Join j) {
                return join(block, j, sourceAlias);
            }
            if (op instanceof Operation.Union u) {
                return union(block, u);
            }
            throw new GenerationException(op.keyword(), "Operation '" + op.keyword() + "' has no SQL translation");
        }

        private List<SelectBlock.Column> items(List<ProjectItem> items, Columns columns) {
            List<String> names = ColumnNaming.names(items);
            List<SelectBlock.Column> out = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                out.add(new SelectBlock.Column(names.get(i), expr(items.get(i).expr(), columns, false)));
            }
            return out;
        }

        private List<SelectBlock.Column> extend(Operation.Extend e, List<SelectBlock.Column> input) {
            List<String> names = ColumnNaming.names(e.columns());
            List<SelectBlock.Column> current = new ArrayList<>(input);
            for (int i = 0; i < e.columns().size(); i++) {
                SqlText value = expr(e.columns().get(i).expr(), columnsOf(List.copyOf(current)), false);
                SelectBlock.Column column = new SelectBlock.Column(names.get(i), value);
                int existing = indexOf(current, names.get(i));
                if (existing >= 0) {
                    current.set(existing, column);
                } else {
                    current.add(column);
                }
            }
            return current;
        }

        private void summarize(Operation.Summarize s, SelectBlock target) {
            Columns columns = columnsOf(target.columns());
            List<String> names = ColumnNaming.names(s);
            List<SelectBlock.Column> out = new ArrayList<>();
            List<SqlText> groupBy = new ArrayList<>();
            int i = 0;
            for (ProjectItem key : s.groupBy()) {
                SqlText value = expr(key.expr(), columns, false);
                out.add(new SelectBlock.Column(names.get(i), value));
                // a key with bound values is grouped by ordinal so its parameters are not bound twice
                groupBy.add(value.hasParams() ? SqlText.raw(String.valueOf(i + 1)) : value);
                i++;
            }
            for (ProjectItem agg : s.aggregations()) {
                out.add(new SelectBlock.Column(names.get(i++), expr(agg.expr(), columns, true)));
            }
            target.columns(out);
            target.groupBy(groupBy);
        }

        private List<SqlText> sortKeys(List<SortKey> keys, Columns columns) {
            List<SqlText> out = new ArrayList<>();
            for (SortKey key : keys) {
                out.add(SqlText.concat(
                        expr(key.expr(), columns, false), key.descending() ? " DESC NULLS LAST" : " ASC NULLS FIRST"));
            }
            return out;
        }

        private SelectBlock join(SelectBlock left, Operation.Join j, String sourceAlias) {
            SelectBlock right = j.right().isSubquery() ? query(j.right().subquery()) : source(j.right());
            String leftAlias = nextAlias();
            String rightAlias = nextAlias();
            List<SelectBlock.Column> leftColumns = aliased(left.names(), leftAlias);
            List<SelectBlock.Column> rightColumns = aliased(right.names(), rightAlias);
            Columns resolver = ref -> {
                if (ref.isQualified()) {
                    JoinLayout.Side side = JoinLayout.sideOf(ref.qualifier(), sourceAlias, j.right().alias());
                    if (side != null) {
                        return lookup(side == JoinLayout.Side.LEFT ? leftColumns : rightColumns, ref.name());
                    }
                    return property(either(leftColumns, rightColumns, ref.qualifier()), ref.name());
                }
                return either(leftColumns, rightColumns, ref.name());
            };
            SqlText on = expr(j.on(), resolver, false);
            JoinLayout layout = JoinLayout.of(anyTyped(left.names()), anyTyped(right.names()));
            List<SelectBlock.Column> out = new ArrayList<>();
            for (JoinLayout.Entry entry : layout.columns()) {
                String alias = entry.side() == JoinLayout.Side.LEFT ? leftAlias : rightAlias;
                out.add(new SelectBlock.Column(
                        entry.outputName(), SqlText.raw(alias + "." + SqlText.quoted(entry.source().name()))));
            }
            SqlText from = SqlText.concat(
                    "(", left.render(), ") AS " + leftAlias + " " + j.kind().sql() + " (",
                    right.render(), ") AS " + rightAlias + " ON ", on);
            return SelectBlock.derived(from, out);
        }

        private SelectBlock union(SelectBlock first, Operation.Union u) {
            List<SelectBlock> branches = new ArrayList<>();
            branches.add(first);
            for (TableExpression other : u.others()) {
                branches.add(other.isSubquery() ? query(other.subquery()) : source(other));
            }
            List<String> merged = new ArrayList<>();
            Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            for (SelectBlock branch : branches) {
                for (String name : branch.names()) {
                    if (seen.add(name)) merged.add(name);
                }
            }
            List<SqlText> rendered = new ArrayList<>();
            for (SelectBlock branch : branches) {
                SelectBlock aligned = branch;
                if (!branch.names().equals(merged)) {
                    aligned = wrap(branch);
                    List<SelectBlock.Column> columns = new ArrayList<>();
                    for (String name : merged) {
                        columns.add(aligned.find(name)
                                .map(c -> new SelectBlock.Column(name, c.expr()))
                                .orElseGet(() -> new SelectBlock.Column(name, SqlText.raw("NULL"))));
                    }
                    aligned.columns(columns);
                }
                rendered.add(aligned.render().parenthesized());
            }
            String separator = u.kind() == UnionKind.DISTINCT ? " UNION " : " UNION ALL ";
            String alias = nextAlias();
            return SelectBlock.derived(
                    SqlText.concat("(", SqlText.join(separator, rendered), ") AS " + alias), aliased(merged, alias));
        }

        // ------------------------------------------------------------------ expressions

        private SqlText condition(Expr predicate, Columns columns) {
            SqlText sql = expr(predicate, columns, false);
            boolean loose = predicate instanceof Expr.BinaryOp b && b.op() == BinaryOperator.OR;
            return loose ? sql.parenthesized() : sql;
        }

        SqlText expr(Expr expr, Columns columns, boolean aggregates) {
            if (expr instanceof Expr.Literal lit) {
                return literal(lit);
            }
            if (expr instanceof Expr.ColumnRef ref) {
                return columns.resolve(ref);
            }
            if (expr instanceof Expr.BinaryOp b) {
                return binary(b, columns, aggregates);
            }
            if (expr instanceof Expr.UnaryOp u) {
                SqlText operand = expr(u.operand(), columns, aggregates).parenthesized();
                return SqlText.concat(u.op() == UnaryOperator.NOT ? "NOT " : "-", operand);
            }
            if (expr instanceof Expr.FunctionCall f) {
                boolean aggregate = SqlFunctions.isAggregate(f.name());
                if (aggregate && !aggregates) {
                    throw new GenerationException("aggregate " + f.name(),
                            "Aggregation '" + f.name() + "' is only allowed at the top of a summarize expression");
                }
                List<SqlText> args = new ArrayList<>();
                for (Expr arg : f.args()) {
                    args.add(expr(arg, columns, !aggregate && aggregates));
                }
                return SqlFunctions.lower(f, args);
            }
            if (expr instanceof Expr.Case c) {
                List<Object> parts = new ArrayList<>();
                parts.add("CASE");
                for (Expr.CaseBranch branch : c.branches()) {
                    parts.add(" WHEN ");
                    parts.add(expr(branch.when(), columns, aggregates));
                    parts.add(" THEN ");
                    parts.add(expr(branch.then(), columns, aggregates));
                }
                parts.add(" ELSE ");
                parts.add(expr(c.otherwise(), columns, aggregates));
                parts.add(" END");
                return SqlText.concat(parts.toArray());
            }
            if (expr instanceof Expr.ListExpr) {
                throw new GenerationException("list", "A value list is only allowed on the right of in / !in");
            }
            throw new GenerationException(expr.getClass().getSimpleName(), "Unsupported expression: " + expr);
        }

        private SqlText binary(Expr.BinaryOp b, Columns columns, boolean aggregates) {
            BinaryOperator op = b.op();
            switch (op) {
                case IN, NOT_IN -> {
                    return membership(b, columns, aggregates);
                }
                case CONTAINS, NOT_CONTAINS, STARTS_WITH, NOT_STARTS_WITH, ENDS_WITH, NOT_ENDS_WITH -> {
                    return like(b, columns, aggregates);
                }
                case HAS, NOT_HAS -> {
                    return has(b, columns, aggregates);
                }
                default -> {
                    // fall through to the infix forms below
                }
            }
            if ((op == BinaryOperator.EQ || op == BinaryOperator.NE) && isNullLiteral(b.right())) {
                return SqlText.concat(
                        operand(b.left(), op, columns, aggregates), op == BinaryOperator.EQ ? " IS NULL" : " IS NOT NULL");
            }
            SqlText left = operand(b.left(), op, columns, aggregates);
            SqlText right = operand(b.right(), op, columns, aggregates);
            return switch (op) {
                case AND -> SqlText.concat(left, " AND ", right);
                case OR -> SqlText.concat(left, " OR ", right);
                case EQ -> SqlText.concat(left, " = ", right);
                case NE -> SqlText.concat(left, " <> ", right);
                case EQ_IGNORE_CASE -> SqlText.concat("LOWER(", left, ") = LOWER(", right, ")");
                case NE_IGNORE_CASE -> SqlText.concat("LOWER(", left, ") <> LOWER(", right, ")");
                case MATCHES_REGEX -> SqlText.concat(left, " ~ ", right);
                case LT, LE, GT, GE, ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULO ->
                        SqlText.concat(left, " " + op.symbol() + " ", right);
                default -> throw new GenerationException(
                        "operator " + op.symbol(), "Operator '" + op.symbol() + "' has no SQL translation");
            };
        }

        private SqlText operand(Expr child, BinaryOperator parent, Columns columns, boolean aggregates) {
            SqlText sql = expr(child, columns, aggregates);
            if (child instanceof Expr.BinaryOp b) {
                boolean associative = b.op() == parent
                        && (parent == BinaryOperator.AND || parent == BinaryOperator.OR);
                if (!associative && b.op().precedence() <= parent.precedence()) {
                    return sql.parenthesized();
                }
            }
            if (child instanceof Expr.UnaryOp u && u.op() == UnaryOperator.NOT) {
                return sql.parenthesized();
            }
            return sql;
        }

        private SqlText membership(Expr.BinaryOp b, Columns columns, boolean aggregates) {
            if (!(b.right() instanceof Expr.ListExpr list) || list.items().isEmpty()) {
                throw new GenerationException("operator " + b.op().symbol(),
                        "'" + b.op().symbol() + "' requires a non-empty value list");
            }
            List<SqlText> items = new ArrayList<>();
            for (Expr item : list.items()) {
                items.add(expr(item, columns, aggregates));
            }
            return SqlText.concat(
                    operand(b.left(), b.op(), columns, aggregates),
                    b.op() == BinaryOperator.IN ? " IN (" : " NOT IN (",
                    SqlText.join(", ", items),
                    ")");
        }

        private SqlText like(Expr.BinaryOp b, Columns columns, boolean aggregates) {
            SqlText left = operand(b.left(), b.op(), columns, aggregates);
            boolean negated = b.op().isNegated();
            if (b.right() instanceof Expr.Literal lit && lit.kind() == LiteralKind.STRING) {
                String escaped = escapeLike((String) lit.value());
                String pattern = switch (b.op()) {
                    case CONTAINS, NOT_CONTAINS -> "%" + escaped + "%";
                    case STARTS_WITH, NOT_STARTS_WITH -> escaped + "%";
                    default -> "%" + escaped;
                };
                return SqlText.concat(left, negated ? " NOT ILIKE " : " ILIKE ", SqlText.param(pattern));
            }
            SqlText right = expr(b.right(), columns, aggregates);
            SqlText test = switch (b.op()) {
                case CONTAINS, NOT_CONTAINS -> SqlText.concat("POSITION(LOWER(", right, ") IN LOWER(", left, ")) > 0");
                case STARTS_WITH, NOT_STARTS_WITH ->
                        SqlText.concat("LEFT(LOWER(", left, "), LENGTH(", right, ")) = LOWER(", right, ")");
                default -> SqlText.concat("RIGHT(LOWER(", left, "), LENGTH(", right, ")) = LOWER(", right, ")");
            };
            return negated ? SqlText.concat("NOT (", test, ")") : test;
        }

        private SqlText has(Expr.BinaryOp b, Columns columns, boolean aggregates) {
            if (!(b.right() instanceof Expr.Literal lit) || lit.kind() != LiteralKind.STRING) {
                throw new GenerationException("operator " + b.op().symbol(),
                        "'" + b.op().symbol() + "' requires a string literal on the right");
            }
            String pattern = "\\m" + escapeRegex((String) lit.value()) + "\\M";
            return SqlText.concat(
                    operand(b.left(), b.op(), columns, aggregates),
                    b.op() == BinaryOperator.HAS ? " ~* " : " !~* ",
                    SqlText.param(pattern));
        }

        private SqlText literal(Expr.Literal lit) {
            return switch (lit.kind()) {
                case NULL -> SqlText.raw("NULL");
                case STRING, LONG, REAL, BOOL -> SqlText.param(lit.value());
                case DATETIME -> SqlText.param(lit.value(), "timestamptz");
                case TIMESPAN -> SqlText.param(interval((Duration) lit.value()), "interval");
                case GUID -> SqlText.param(lit.value().toString(), "uuid");
            };
        }

        private Columns columnsOf(List<SelectBlock.Column> columns) {
            return ref -> ref.isQualified()
                    ? property(lookup(columns, ref.qualifier()), ref.name())
                    : lookup(columns, ref.name());
        }
    }

    /** Text of a dynamic property, {@code ->>} for one level and {@code #>>} for a path. */
    private static SqlText property(SqlText column, String path) {
        String[] parts = path.split("\\.");
        if (parts.length == 1) {
            return SqlText.concat("(", column, " ->> ", SqlText.param(path), ")");
        }
        StringBuilder array = new StringBuilder("{");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) array.append(',');
            array.append('"').append(parts[i].replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        }
        array.append('}');
        return SqlText.concat("(", column, " #>> ", SqlText.param(array.toString(), "text[]"), ")");
    }

    private static SqlText lookup(List<SelectBlock.Column> columns, String name) {
        int index = indexOf(columns, name);
        if (index < 0) {
            throw new GenerationException("column " + name, "Unknown column '" + name + "'");
        }
        return columns.get(index).expr();
    }

    private static SqlText either(List<SelectBlock.Column> left, List<SelectBlock.Column> right, String name) {
        return indexOf(left, name) >= 0 ? lookup(left, name) : lookup(right, name);
    }

    private static int indexOf(List<SelectBlock.Column> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(name)) return i;
        }
        return -1;
    }

    private static List<SelectBlock.Column> aliased(List<String> names, String alias) {
        return names.stream()
                .map(n -> new SelectBlock.Column(n, SqlText.raw(alias + "." + SqlText.quoted(n))))
                .toList();
    }

    private static Scope anyTyped(List<String> names) {
        return Scope.of(names.stream().map(n -> new Scope.Column(n, ColumnType.ANY)).toList());
    }

    private static boolean isNullLiteral(Expr expr) {
        return expr instanceof Expr.Literal lit && lit.isNull();
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    static String escapeRegex(String value) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            if ("\\.^$|?*+()[]{}".indexOf(c) >= 0) sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    /** PostgreSQL interval text in seconds, e.g. {@code 5400 seconds}. */
    static String interval(Duration duration) {
        BigDecimal seconds = BigDecimal.valueOf(duration.getSeconds())
                .add(BigDecimal.valueOf(duration.getNano(), 9));
        return seconds.stripTrailingZeros().toPlainString() + " seconds";
    }
}
