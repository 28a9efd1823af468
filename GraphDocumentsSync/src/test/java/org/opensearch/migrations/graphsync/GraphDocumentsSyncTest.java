package org.opensearch.migrations.graphsync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.opensearch.migrations.graphsync.common.bolt.BoltConnectionContext;
import org.opensearch.migrations.graphsync.common.http.ConnectionContext;
import org.opensearch.migrations.graphsync.config.SettingsResolver;
import org.opensearch.migrations.graphsync.pipeline.exceptions.GraphQueryException;
import org.opensearch.migrations.graphsync.pipeline.sink.DocumentSink;
import org.opensearch.migrations.graphsync.pipeline.sink.InMemoryDocumentSink;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

class GraphDocumentsSyncTest {
    private static final String SUBJECTS_QUERY =
        "MATCH (s:subject) RETURN s.id AS id, s.name AS name SKIP $skip LIMIT $limit";
    private static final String STUDIES_QUERY =
        "MATCH (t:study) RETURN t.id AS study_id SKIP $skip LIMIT $limit";

    @TempDir
    Path workDir;

    private InMemoryDocumentSink sink;
    private final Map<String, String> env = new HashMap<>();
    private final List<String> graphConnections = new ArrayList<>();
    private final List<String> searchConnections = new ArrayList<>();
    private final List<Long> subjectPageOffsets = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        sink = new InMemoryDocumentSink();
        Files.writeString(workDir.resolve("indices.yaml"), String.join("\n",
            "indices:",
            "  - index_name: subjects",
            "    id_field: id",
            "    initial_query:",
            "      query: \"" + SUBJECTS_QUERY + "\"",
            "  - index_name: studies",
            "    id_field: study_id",
            "    initial_query:",
            "      query: \"" + STUDIES_QUERY + "\"",
            ""));
    }

    private GraphQueryClient graphClient() {
        return (text, variables, skip, limit) -> {
            if (text.equals(SUBJECTS_QUERY)) {
                subjectPageOffsets.add(skip);
            }
            if (skip > 0) {
                return List.of();
            }
            if (text.equals(SUBJECTS_QUERY)) {
                return List.of(Map.of("id", "s1", "name", "Ada"), Map.of("id", "s2", "name", "Grace"));
            }
            throw new GraphQueryException("Connection to graph database lost");
        };
    }

    private int run(String... args) {
        var clients = new GraphDocumentsSync.ClientFactory() {
            @Override
            public GraphQueryClient graphClient(BoltConnectionContext connectionContext) {
                graphConnections.add(connectionContext.getUri());
                return GraphDocumentsSyncTest.this.graphClient();
            }

            @Override
            public DocumentSink documentSink(ConnectionContext connectionContext) {
                searchConnections.add(connectionContext.getUri().toString());
                return sink;
            }
        };
        return new GraphDocumentsSync(env::get, new SettingsResolver(workDir), clients).run(args);
    }

    private String specFile() {
        return workDir.resolve("indices.yaml").toString();
    }

    @Test
    void allIndicesDone_exitsZero() {
        int exitCode = run("--index-spec-file", specFile(), "--selected-indices", "subjects");

        assertThat(exitCode, equalTo(GraphDocumentsSync.SUCCESS_EXIT_CODE));
        assertThat(sink.getDocuments("subjects"), aMapWithSize(2));
        assertThat(sink.getCreatedIndices(), contains("subjects"));
        assertThat(graphConnections, contains("bolt://localhost:7687"));
        assertThat(searchConnections, contains("http://localhost:9200"));
    }

    @Test
    void failedIndex_exitsTwoAfterProcessingTheOthers() {
        int exitCode = run("--index-spec-file", specFile());

        assertThat(exitCode, equalTo(GraphDocumentsSync.INDEX_FAILED_EXIT_CODE));
        assertThat(sink.getDocuments("subjects"), aMapWithSize(2));
    }

    @Test
    void environmentSuppliesSettings() {
        env.put("OS_LOADER_INDEX_SPEC_FILE", specFile());
        env.put("OS_LOADER_SELECTED_INDICES", "subjects");
        env.put("OS_LOADER_MEMGRAPH_HOST", "graph.internal");
        env.put("OS_LOADER_OPENSEARCH_HOST", "search.internal:9200");
        env.put("OS_LOADER_OPENSEARCH_USE_SSL", "true");

        int exitCode = run();

        assertThat(exitCode, equalTo(GraphDocumentsSync.SUCCESS_EXIT_CODE));
        assertThat(graphConnections, contains("bolt://graph.internal:7687"));
        assertThat(searchConnections, contains("https://search.internal:9200"));
    }

    @Test
    void switchesOnTheCommandLineStayOnWhenTheEnvironmentAlsoSetsThem() {
        env.put("OS_LOADER_TEST_MODE", "true");
        env.put("OS_LOADER_CLEAR_EXISTING_INDICES", "true");
        sink.putDocument("subjects", "stale", Map.of("id", "stale"));

        int exitCode = run("--index-spec-file", specFile(), "--selected-indices", "subjects",
            "--default-page-size", "2", "--test-mode", "--clear-existing-indices");

        assertThat(exitCode, equalTo(GraphDocumentsSync.SUCCESS_EXIT_CODE));
        assertThat(subjectPageOffsets, contains(0L));
        assertThat(sink.getDeletedIndices(), contains("subjects"));
        assertThat(sink.getDocuments("subjects"), aMapWithSize(2));
    }

    @Test
    void missingSpecFile_exitsOneWithoutConnecting() {
        int exitCode = run("--index-spec-file", workDir.resolve("absent.yaml").toString());

        assertThat(exitCode, equalTo(GraphDocumentsSync.CONFIGURATION_ERROR_EXIT_CODE));
        assertThat(graphConnections, empty());
        assertThat(searchConnections, empty());
    }

    @Test
    void malformedSpec_exitsOneWithoutConnecting() throws IOException {
        var spec = workDir.resolve("bad.yaml");
        Files.writeString(spec, "indices:\n  - index_name: subjects\n");

        int exitCode = run("--index-spec-file", spec.toString());

        assertThat(exitCode, equalTo(GraphDocumentsSync.CONFIGURATION_ERROR_EXIT_CODE));
        assertThat(graphConnections, empty());
    }

    @Test
    void unknownArgument_exitsOne() {
        assertThat(run("--no-such-flag"), equalTo(GraphDocumentsSync.CONFIGURATION_ERROR_EXIT_CODE));
    }

    @Test
    void help_exitsZero() {
        assertThat(run("--help"), equalTo(GraphDocumentsSync.SUCCESS_EXIT_CODE));
        assertThat(graphConnections, empty());
    }
}
