package com.huntql.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PositionalParametersTest {

    @Test
    void placeholdersBecomeNamedParameters() {
        PositionalParameters.Rewritten rewritten = PositionalParameters.rewrite(
                "SELECT a FROM t WHERE b = $1 AND c > $2::interval LIMIT $3", List.of("x", "1 seconds", 5L), v -> v);

        assertThat(rewritten.sql()).isEqualTo("SELECT a FROM t WHERE b = :p1 AND c > :p2::interval LIMIT :p3");
        assertThat(rewritten.params().getValue("p1")).isEqualTo("x");
        assertThat(rewritten.params().getValue("p3")).isEqualTo(5L);
    }

    @Test
    void quotedTextIsLeftAlone() {
        PositionalParameters.Rewritten rewritten = PositionalParameters.rewrite(
                "SELECT a AS \"$1\", 'it''s $2' FROM t WHERE b = $1", List.of("x"), v -> v);

        assertThat(rewritten.sql()).isEqualTo("SELECT a AS \"$1\", 'it''s $2' FROM t WHERE b = :p1");
        assertThat(rewritten.params().getParameterNames()).containsExactly("p1");
    }

    @Test
    void repeatedPlaceholderIsBoundOnce() {
        PositionalParameters.Rewritten rewritten =
                PositionalParameters.rewrite("$1 + $1", List.of(2L), v -> ((Long) v) * 10);

        assertThat(rewritten.sql()).isEqualTo(":p1 + :p1");
        assertThat(rewritten.params().getValue("p1")).isEqualTo(20L);
    }

    @Test
    void placeholderWithoutValueIsRejected() {
        assertThatThrownBy(() -> PositionalParameters.rewrite("a = $2", List.of("x"), v -> v))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("$2");
    }
}
