package com.huntql.service.core.kql.sql;

import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.LiteralKind;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** PostgreSQL lowering of the KQL functions the generator supports. */
final class SqlFunctions {

    private static final String EPOCH = "TIMESTAMPTZ '1970-01-01 00:00:00+00'";

    @FunctionalInterface
    private interface Lowering {
        SqlText lower(List<Expr> args, List<SqlText> sql);
    }

    private record Entry(int minArgs, int maxArgs, boolean aggregate, Lowering lowering) {}

    private static final Map<String, Entry> FUNCTIONS = new TreeMap<>();

    static {
        // aggregates
        aggregate("count", 0, 0, (a, s) -> SqlText.raw("COUNT(*)"));
        aggregate("countif", 1, 1, (a, s) -> SqlText.concat("COUNT(*) FILTER (WHERE ", s.get(0), ")"));
        aggregate("sum", 1, 1, (a, s) -> call("SUM", s));
        aggregate("avg", 1, 1, (a, s) -> call("AVG", s));
        aggregate("min", 1, 1, (a, s) -> call("MIN", s));
        aggregate("max", 1, 1, (a, s) -> call("MAX", s));
        aggregate("dcount", 1, 1, (a, s) -> SqlText.concat("COUNT(DISTINCT ", s.get(0), ")"));

        // strings
        scalar("strlen", 1, 1, (a, s) -> call("LENGTH", s));
        scalar("tolower", 1, 1, (a, s) -> call("LOWER", s));
        scalar("toupper", 1, 1, (a, s) -> call("UPPER", s));
        scalar("trim", 1, 1, (a, s) -> call("BTRIM", s));
        scalar("substring", 2, 3, (a, s) -> s.size() == 2
                ? SqlText.concat("SUBSTRING(", s.get(0), " FROM (", s.get(1), ") + 1)")
                : SqlText.concat("SUBSTRING(", s.get(0), " FROM (", s.get(1), ") + 1 FOR ", s.get(2), ")"));
        scalar("strcat", 1, -1, (a, s) -> call("CONCAT", s));
        scalar("replace_string", 3, 3, (a, s) -> call("REPLACE", s));
        scalar("isempty", 1, 1, (a, s) -> SqlText.concat(
                "(", s.get(0), " IS NULL OR CAST(", s.get(0), " AS TEXT) = '')"));
        scalar("isnotempty", 1, 1, (a, s) -> SqlText.concat(
                "(", s.get(0), " IS NOT NULL AND CAST(", s.get(0), " AS TEXT) <> '')"));

        // date and time
        scalar("now", 0, 0, (a, s) -> SqlText.raw("NOW()"));
        scalar("ago", 1, 1, (a, s) -> SqlText.concat("(NOW() - ", s.get(0), ")"));
        scalar("bin", 2, 2, SqlFunctions::bin);
        scalar("startofday", 1, 1, (a, s) -> SqlText.concat("date_trunc('day', ", s.get(0), ")"));

        // math
        scalar("floor", 1, 1, (a, s) -> call("FLOOR", s));
        scalar("ceiling", 1, 1, (a, s) -> call("CEIL", s));
        scalar("round", 1, 2, (a, s) -> s.size() == 1
                ? call("ROUND", s)
                : SqlText.concat("ROUND(CAST(", s.get(0), " AS NUMERIC), ", s.get(1), ")"));
        scalar("abs", 1, 1, (a, s) -> call("ABS", s));
        scalar("sqrt", 1, 1, (a, s) -> call("SQRT", s));
        scalar("log", 1, 1, (a, s) -> call("LN", s));
        scalar("exp", 1, 1, (a, s) -> call("EXP", s));
        scalar("pow", 2, 2, (a, s) -> call("POWER", s));

        // null handling and conditionals
        scalar("coalesce", 2, -1, (a, s) -> call("COALESCE", s));
        scalar("isnull", 1, 1, (a, s) -> SqlText.concat("(", s.get(0), " IS NULL)"));
        scalar("isnotnull", 1, 1, (a, s) -> SqlText.concat("(", s.get(0), " IS NOT NULL)"));
        Lowering iif = (a, s) -> SqlText.concat("CASE WHEN ", s.get(0), " THEN ", s.get(1), " ELSE ", s.get(2), " END");
        scalar("iif", 3, 3, iif);
        scalar("iff", 3, 3, iif);

        // conversions
        scalar("tostring", 1, 1, (a, s) -> cast(s.get(0), "TEXT"));
        scalar("toint", 1, 1, (a, s) -> cast(s.get(0), "INTEGER"));
        scalar("tolong", 1, 1, (a, s) -> cast(s.get(0), "BIGINT"));
        scalar("todouble", 1, 1, (a, s) -> cast(s.get(0), "DOUBLE PRECISION"));
    }

    private SqlFunctions() {}

    static boolean isSupported(String name) {
        return FUNCTIONS.containsKey(key(name));
    }

    static boolean isAggregate(String name) {
        Entry entry = FUNCTIONS.get(key(name));
        return entry != null && entry.aggregate();
    }

    static Set<String> supported() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }

    /**
     * @param call the KQL call, used by lowerings that depend on argument shape
     * @param args the already lowered arguments
     */
    static SqlText lower(Expr.FunctionCall call, List<SqlText> args) {
        Entry entry = FUNCTIONS.get(key(call.name()));
        if (entry == null) {
            throw new GenerationException(
                    "function " + call.name(), "Function '" + call.name() + "' has no SQL translation");
        }
        int n = args.size();
        if (n < entry.minArgs() || (entry.maxArgs() >= 0 && n > entry.maxArgs())) {
            throw new GenerationException(
                    "function " + call.name(),
                    "Function '" + call.name() + "' cannot be translated with " + n + " argument(s)");
        }
        return entry.lowering().lower(call.args(), args);
    }

    /** {@code bin(ts, 1h)} buckets timestamps with {@code date_bin}; numeric bins round down to a multiple. */
    private static SqlText bin(List<Expr> args, List<SqlText> sql) {
        if (args.get(1) instanceof Expr.Literal lit && lit.kind() == LiteralKind.TIMESPAN) {
            return SqlText.concat("date_bin(", sql.get(1), ", ", sql.get(0), ", " + EPOCH + ")");
        }
        SqlText size = sql.get(1).parenthesized();
        return SqlText.concat("(FLOOR(", sql.get(0).parenthesized(), " / ", size, ") * ", size, ")");
    }

    private static SqlText call(String function, List<SqlText> args) {
        return SqlText.concat(function, "(", SqlText.join(", ", args), ")");
    }

    private static SqlText cast(SqlText value, String type) {
        return SqlText.concat("CAST(", value, " AS ", type, ")");
    }

    private static void scalar(String name, int min, int max, Lowering lowering) {
        FUNCTIONS.put(name, new Entry(min, max, false, lowering));
    }

    private static void aggregate(String name, int min, int max, Lowering lowering) {
        FUNCTIONS.put(name, new Entry(min, max, true, lowering));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
