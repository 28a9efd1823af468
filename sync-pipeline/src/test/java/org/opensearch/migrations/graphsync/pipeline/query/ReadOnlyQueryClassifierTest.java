package org.opensearch.migrations.graphsync.pipeline.query;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadOnlyQueryClassifierTest {

    static Stream<String> writeQueries() {
        return Stream.of(
            "MATCH (n) SET n.x = 1",
            "match (n) set n.x = 1 return n",
            "MATCH (n)\n\tDETACH\n   DELETE n",
            "CREATE (n:Person {name: 'Alice'})",
            "MATCH (a), (b) MERGE (a)-[:KNOWS]->(b)",
            "MATCH (n) REMOVE n:Label RETURN n",
            "mAtCh (n) DeLeTe n",
            "DROP INDEX ON :Person(name)",
            "MATCH (n) FOREACH (x IN [1] | SET n.y = x)",
            "MATCH (n) RETURN n UNION MATCH (m) CREATE (m)-[:R]->(k)",
            "MATCH (n) WHERE n.name = 'SET' SET n.flag = true",
            "CALL apoc.create.node(['X'], {}) YIELD node RETURN node",
            "CALL apoc.merge.node(['X'], {id: 1}) YIELD node RETURN node",
            "MATCH (n) WITH n LIMIT 1SET n.x = 1 RETURN n",
            "MATCH (n) WITH n SKIP 0DETACH DELETE n",
            "CALL apoc.cypher.doIt('CREATE (m) RETURN m', {}) YIELD value RETURN value",
            "CALL apoc.periodic.iterate('MATCH (n) RETURN n', 'SET n.x = 1', {}) YIELD batches RETURN batches",
            "CALL periodic.iterate(\"MATCH (n) RETURN n\", \"SET n.x = 1\", {batch_size: 10}) YIELD * RETURN *",
            "MATCH (n) CALL APOC.Cypher.run('MERGE (m)', {}) YIELD value RETURN n",
            "REVOKE MATCH FROM alice",
            "GRANT MATCH TO alice",
            "DENY MATCH TO alice",
            "MATCH (n) RETURN n; ALTER USER alice SET PASSWORD 'x'",
            "MATCH (n) RETURN n; TRUNCATE"
        );
    }

    @ParameterizedTest(name = "rejects_{0}")
    @MethodSource("writeQueries")
    void rejectsWriteClausesInAnyCaseOrSpacing(String query) {
        var classification = ReadOnlyQueryClassifier.classify(query);

        assertFalse(classification.allowed());
        assertThat(classification.reason(), containsString("'"));
    }

    static Stream<String> readQueries() {
        return Stream.of(
            "MATCH (n) RETURN n.x",
            "MATCH (n) WHERE n.name = 'SET' RETURN n.name AS x",
            "MATCH (n) RETURN n.name AS x, \"DELETE me\" AS note",
            "MATCH (n:Set)-[:CREATED]->(m) RETURN n.set, m.create",
            "MATCH (n) // CREATE (m)\nRETURN n",
            "MATCH (n) /* MERGE (m) */ RETURN n",
            "MATCH (n) RETURN n.`delete` AS `set`",
            "MATCH (n) WHERE n.kind = $create RETURN n SKIP $skip LIMIT $limit",
            "CALL db.labels() YIELD label RETURN label",
            "CALL periodicals.list() YIELD name RETURN name",
            "MATCH (n) WHERE n.score > 1.5e3 AND n.mask = 0x1F RETURN n LIMIT 10",
            "UNWIND [1, 2, 3] AS x WITH x RETURN x",
            "OPTIONAL MATCH (n)-[r]->(m) RETURN type(r), count(*) ORDER BY n.id"
        );
    }

    @ParameterizedTest(name = "accepts_{0}")
    @MethodSource("readQueries")
    void acceptsReadOnlyQueries(String query) {
        var classification = ReadOnlyQueryClassifier.classify(query);

        assertTrue(classification.allowed(), () -> "Expected read-only: " + classification.reason());
        assertNull(classification.reason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t"})
    void rejectsBlankText(String query) {
        var classification = ReadOnlyQueryClassifier.classify(query);

        assertFalse(classification.allowed());
        assertThat(classification.reason(), containsString("empty"));
    }

    @Test
    void rejectsNullText() {
        assertFalse(ReadOnlyQueryClassifier.classify(null).allowed());
    }

    @Test
    void requiresMatchOrReturn() {
        var classification = ReadOnlyQueryClassifier.classify("SHOW INDEX INFO");

        assertFalse(classification.allowed());
        assertThat(classification.reason(), containsString("MATCH or RETURN"));
    }

    @Test
    void keywordOnlyInsideLiteralDoesNotCountAsReadClause() {
        assertFalse(ReadOnlyQueryClassifier.classify("WITH 'MATCH' AS m UNWIND [m] AS x").allowed());
    }

    @Test
    void rejectsTextThatCannotBeScanned() {
        var classification = ReadOnlyQueryClassifier.classify("MATCH (n) RETURN 'unterminated");

        assertFalse(classification.allowed());
        assertThat(classification.reason(), containsString("cannot be parsed"));
    }

    @Test
    void mapKeySpellingAWriteKeywordIsRejected() {
        assertFalse(ReadOnlyQueryClassifier.classify("MATCH (n) RETURN {set: n.x} AS m").allowed());
    }

    @Test
    void referencesParameterIgnoresLiteralsAndComments() {
        assertTrue(ReadOnlyQueryClassifier.referencesParameter("MATCH (n) RETURN n SKIP $skip", "skip"));
        assertFalse(ReadOnlyQueryClassifier.referencesParameter("MATCH (n) RETURN '$skip' // $skip", "skip"));
        assertFalse(ReadOnlyQueryClassifier.referencesParameter("MATCH (n) RETURN n SKIP $skipped", "skip"));
    }
}
