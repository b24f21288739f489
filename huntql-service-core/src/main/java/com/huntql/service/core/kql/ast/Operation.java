package com.huntql.service.core.kql.ast;

import java.util.List;
import java.util.Objects;

/** One pipeline stage ({@code | where ...}, {@code | project ...}, ...). */
public sealed interface Operation
        permits Operation.Where,
                Operation.Project,
                Operation.Extend,
                Operation.Summarize,
                Operation.OrderBy,
                Operation.Top,
                Operation.Limit,
                Operation.Distinct,
                Operation.Join,
                Operation.Union {

    /** Name of the operator as written in KQL. */
    String keyword();

    record Where(Expr predicate) implements Operation {
        public Where {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public String keyword() {
            return "where";
        }
    }

    record Project(List<ProjectItem> columns) implements Operation {
        public Project {
            columns = List.copyOf(columns);
        }

        @Override
        public String keyword() {
            return "project";
        }
    }

    record Extend(List<ProjectItem> columns) implements Operation {
        public Extend {
            columns = List.copyOf(columns);
        }

        @Override
        public String keyword() {
            return "extend";
        }
    }

    record Summarize(List<ProjectItem> aggregations, List<ProjectItem> groupBy) implements Operation {
        public Summarize {
            aggregations = List.copyOf(aggregations);
            groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        }

        @Override
        public String keyword() {
            return "summarize";
        }
    }

    record OrderBy(List<SortKey> keys) implements Operation {
        public OrderBy {
            keys = List.copyOf(keys);
        }

        @Override
        public String keyword() {
            return "order";
        }
    }

    /** {@code top n [by keys]}; without keys it behaves as {@code limit n}. */
    record Top(long count, List<SortKey> keys) implements Operation {
        public Top {
            if (count < 0) throw new IllegalArgumentException("top count must be >= 0");
            keys = keys == null ? List.of() : List.copyOf(keys);
        }

        @Override
        public String keyword() {
            return "top";
        }
    }

    record Limit(long count) implements Operation {
        public Limit {
            if (count < 0) throw new IllegalArgumentException("limit count must be >= 0");
        }

        @Override
        public String keyword() {
            return "limit";
        }
    }

    /** Empty {@code columns} means {@code distinct *}. */
    record Distinct(List<Expr> columns) implements Operation {
        public Distinct {
            columns = columns == null ? List.of() : List.copyOf(columns);
        }

        public boolean allColumns() {
            return columns.isEmpty();
        }

        @Override
        public String keyword() {
            return "distinct";
        }
    }

    record Join(JoinKind kind, TableExpression right, Expr on) implements Operation {
        public Join {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(on, "on");
        }

        @Override
        public String keyword() {
            return "join";
        }
    }

    record Union(UnionKind kind, List<TableExpression> others) implements Operation {
        public Union {
            Objects.requireNonNull(kind, "kind");
            others = List.copyOf(others);
            if (others.isEmpty()) throw new IllegalArgumentException("union requires at least one table");
        }

        @Override
        public String keyword() {
            return "union";
        }
    }
}
