package com.strata.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SelectBuilder
 */
@DisplayName("SelectBuilder Tests")
class SelectBuilderTest {

    @Test
    @DisplayName("Should bind values as positional arguments in order of appearance")
    void shouldBindValuesInOrder() {
        // Given: Clauses registered out of textual order
        SelectBuilder sb = new SelectBuilder();
        sb.select("Timestamp", "UUID").from("logs");
        String second = sb.equal("SeverityText", "error");
        String first = sb.equal("ProjectId", 1);
        sb.where(first, second).orderBy("Timestamp DESC").limit(10);

        // When: Building the query
        BuiltQuery query = sb.build();

        // Then: Placeholders follow the text, not the registration order
        assertThat(query.getSql()).isEqualTo(
            "SELECT Timestamp, UUID FROM logs WHERE ProjectId = ? AND SeverityText = ? ORDER BY Timestamp DESC LIMIT 10");
        assertThat(query.getArgs()).containsExactly(1, "error");
    }

    @Test
    @DisplayName("Should select star when no columns are given")
    void shouldSelectStarByDefault() {
        SelectBuilder sb = new SelectBuilder().from("traces");

        assertThat(sb.build().getSql()).isEqualTo("SELECT * FROM traces");
    }

    @Test
    @DisplayName("Should render an empty IN list as a false predicate")
    void shouldRenderEmptyInAsFalse() {
        SelectBuilder sb = new SelectBuilder();

        assertThat(sb.in("UUID", List.of())).isEqualTo("0 = 1");
        assertThat(sb.build().getArgs()).isEmpty();
    }

    @Test
    @DisplayName("Should compile nested subqueries with their own arguments")
    void shouldCompileNestedSubqueries() {
        // Given: An inner query with one argument used as a FROM source and an IN source
        SelectBuilder inner = new SelectBuilder();
        inner.select("UUID").from("logs").where(inner.equal("ProjectId", 7));

        SelectBuilder outer = new SelectBuilder();
        outer.select("count()").from(inner, "inner").where(outer.greaterThan("Timestamp", 5L));

        SelectBuilder other = new SelectBuilder();
        other.from("logs").where(other.in("UUID", inner));

        // When: Building both
        BuiltQuery fromQuery = outer.build();
        BuiltQuery inQuery = other.build();

        // Then: Inner arguments are spliced in position
        assertThat(fromQuery.getSql()).isEqualTo(
            "SELECT count() FROM (SELECT UUID FROM logs WHERE ProjectId = ?) AS inner WHERE Timestamp > ?");
        assertThat(fromQuery.getArgs()).containsExactly(7, 5L);
        assertThat(inQuery.getSql()).isEqualTo("SELECT * FROM logs WHERE UUID IN (SELECT UUID FROM logs WHERE ProjectId = ?)");
        assertThat(inQuery.getArgs()).containsExactly(7);
    }

    @Test
    @DisplayName("Should combine predicates with parenthesized OR and AND")
    void shouldCombinePredicates() {
        SelectBuilder sb = new SelectBuilder();

        String expr = sb.or(sb.and(sb.lessThan("a", 1), sb.notEqual("b", 2)), sb.lessEqualThan("c", 3));

        assertThat(expr).isEqualTo("((a < ${0} AND b != ${1}) OR c <= ${2})");
    }

    @Test
    @DisplayName("Should render DISTINCT, joins and GROUP BY in clause order")
    void shouldRenderAllClauses() {
        SelectBuilder sb = new SelectBuilder();
        sb.select(List.of("g0", sb.as("count()", "c")))
            .distinct()
            .from("events")
            .join("LEFT JOIN fields f ON f.UUID = events.UUID")
            .groupBy("g0")
            .orderBy("c DESC");

        assertThat(sb.build().getSql()).isEqualTo(
            "SELECT DISTINCT g0, count() AS c FROM events LEFT JOIN fields f ON f.UUID = events.UUID GROUP BY g0 ORDER BY c DESC");
    }

    @Test
    @DisplayName("Should prefix a built query without touching its arguments")
    void shouldPrefixBuiltQuery() {
        BuiltQuery query = new BuiltQuery("SELECT 1 WHERE a = ?", List.of(3)).withPrefix("EXPLAIN ESTIMATE ");

        assertThat(query.getSql()).isEqualTo("EXPLAIN ESTIMATE SELECT 1 WHERE a = ?");
        assertThat(query.getArgs()).containsExactly(3);
    }
}
