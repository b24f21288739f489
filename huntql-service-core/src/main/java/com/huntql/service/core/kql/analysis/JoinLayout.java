package com.huntql.service.core.kql.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Output columns of a join: every left column, then every right column. A right column whose name is already
 * taken is renamed with a numeric suffix ({@code Account} becomes {@code Account1}).
 */
public record JoinLayout(List<Entry> columns) {

    public enum Side {
        LEFT,
        RIGHT
    }

    public record Entry(String outputName, Side side, Scope.Column source) {}

    public static JoinLayout of(Scope left, Scope right) {
        List<Entry> out = new ArrayList<>();
        Set<String> taken = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Scope.Column c : left.columns()) {
            taken.add(c.name());
            out.add(new Entry(c.name(), Side.LEFT, c));
        }
        for (Scope.Column c : right.columns()) {
            String name = c.name();
            for (int n = 1; taken.contains(name); n++) {
                name = c.name() + n;
            }
            taken.add(name);
            out.add(new Entry(name, Side.RIGHT, c));
        }
        return new JoinLayout(List.copyOf(out));
    }

    public Scope scope(boolean known) {
        if (!known) return Scope.unknown();
        return Scope.of(columns.stream().map(e -> new Scope.Column(e.outputName(), e.source().type())).toList());
    }

    /** True when {@code name} in the join output is a left-side column that kept its name. */
    public boolean isUnrenamedLeft(String name) {
        return columns.stream()
                .anyMatch(e -> e.side() == Side.LEFT && e.outputName().equalsIgnoreCase(name));
    }

    /**
     * Which side a qualifier in a join condition refers to: {@code $left} or the left alias, {@code $right} or the
     * right alias; {@code null} when it names neither.
     */
    public static Side sideOf(String qualifier, String leftAlias, String rightAlias) {
        if (qualifier == null) return null;
        if (qualifier.equalsIgnoreCase("$left") || qualifier.equalsIgnoreCase(leftAlias)) return Side.LEFT;
        if (qualifier.equalsIgnoreCase("$right") || qualifier.equalsIgnoreCase(rightAlias)) return Side.RIGHT;
        return null;
    }
}
