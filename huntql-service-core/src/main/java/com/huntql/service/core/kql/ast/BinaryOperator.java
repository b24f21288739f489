package com.huntql.service.core.kql.ast;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Binary operators with their KQL spelling and binding strength (higher binds tighter).
 */
public enum BinaryOperator {
    OR("or", 1, Category.LOGICAL),
    AND("and", 2, Category.LOGICAL),

    EQ("==", 3, Category.COMPARISON),
    NE("!=", 3, Category.COMPARISON),
    LT("<", 3, Category.COMPARISON),
    LE("<=", 3, Category.COMPARISON),
    GT(">", 3, Category.COMPARISON),
    GE(">=", 3, Category.COMPARISON),
    EQ_IGNORE_CASE("=~", 3, Category.COMPARISON),
    NE_IGNORE_CASE("!~", 3, Category.COMPARISON),

    CONTAINS("contains", 3, Category.STRING),
    NOT_CONTAINS("!contains", 3, Category.STRING),
    HAS("has", 3, Category.STRING),
    NOT_HAS("!has", 3, Category.STRING),
    STARTS_WITH("startswith", 3, Category.STRING),
    NOT_STARTS_WITH("!startswith", 3, Category.STRING),
    ENDS_WITH("endswith", 3, Category.STRING),
    NOT_ENDS_WITH("!endswith", 3, Category.STRING),
    MATCHES_REGEX("matches regex", 3, Category.STRING),

    IN("in", 3, Category.MEMBERSHIP),
    NOT_IN("!in", 3, Category.MEMBERSHIP),

    ADD("+", 4, Category.ARITHMETIC),
    SUBTRACT("-", 4, Category.ARITHMETIC),
    MULTIPLY("*", 5, Category.ARITHMETIC),
    DIVIDE("/", 5, Category.ARITHMETIC),
    MODULO("%", 5, Category.ARITHMETIC);

    public enum Category {
        LOGICAL,
        COMPARISON,
        STRING,
        MEMBERSHIP,
        ARITHMETIC
    }

    private static final Map<String, BinaryOperator> BY_SYMBOL = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    private final String symbol;
    private final int precedence;
    private final Category category;

    BinaryOperator(String symbol, int precedence, Category category) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Category category() {
        return category;
    }

    /** Comparison, string-match and membership operators: all produce a boolean from non-boolean operands. */
    public boolean isPredicate() {
        return category == Category.COMPARISON || category == Category.STRING || category == Category.MEMBERSHIP;
    }

    public boolean isNegated() {
        return symbol.startsWith("!");
    }

    public static Optional<BinaryOperator> fromSymbol(String text) {
        String key = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return Optional.ofNullable(BY_SYMBOL.get(key));
    }
}
