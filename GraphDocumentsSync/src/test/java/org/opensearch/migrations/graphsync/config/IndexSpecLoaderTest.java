package org.opensearch.migrations.graphsync.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException;
import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IndexSpecLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String... lines) throws IOException {
        var file = tempDir.resolve("indices.yaml");
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    @Test
    void loadsIndicesWithInitialAndUpdateQueries() throws IOException {
        var file = write(
            "indices:",
            "  - index_name: ' subjects '",
            "    id_field: id",
            "    initial_query:",
            "      query: |",
            "        MATCH (s:subject)",
            "        RETURN s.id AS id, s.name AS name",
            "        SKIP $skip LIMIT $limit",
            "      variables: {project: p1}",
            "      page_size: 500",
            "    update_queries:",
            "      - name: add_study",
            "        query: MATCH (s:subject)-->(t:study) RETURN s.id AS id, t.name AS study SKIP $skip LIMIT $limit",
            "      - query: MATCH (s:subject)-->(d:diagnosis) RETURN s.id AS id SKIP $skip LIMIT $limit",
            "    description: ignored",
            "  - index_name: studies",
            "    id_field: study_id",
            "    initial_query:",
            "      query: MATCH (t:study) RETURN t.id AS study_id SKIP $skip LIMIT $limit"
        );

        var specs = IndexSpecLoader.load(file);

        assertThat(specs, hasSize(2));
        var subjects = specs.get(0);
        assertThat(subjects.indexName(), equalTo("subjects"));
        assertThat(subjects.idField(), equalTo("id"));
        assertThat(subjects.initialQuery().name(), equalTo(QuerySpec.INITIAL_QUERY_NAME));
        assertThat(subjects.initialQuery().text(), containsString("SKIP $skip LIMIT $limit"));
        assertThat(subjects.initialQuery().variables(), equalTo(Map.of("project", "p1")));
        assertThat(subjects.initialQuery().pageSize(), equalTo(500));
        assertThat(subjects.updateQueries().stream().map(QuerySpec::name).toList(),
            contains("add_study", "update-2"));

        var studies = specs.get(1);
        assertThat(studies.updateQueries(), empty());
        assertThat(studies.initialQuery().pageSize(), nullValue());
        assertThat(studies.initialQuery().variables(), equalTo(Map.of()));
    }

    @Test
    void missingPiecesAreLeftForTheValidator() throws IOException {
        var file = write(
            "indices:",
            "  - index_name: subjects"
        );

        var specs = IndexSpecLoader.load(file);

        assertThat(specs.get(0).idField(), nullValue());
        assertThat(specs.get(0).initialQuery(), nullValue());
    }

    @Test
    void emptyFileHasNoIndices() throws IOException {
        assertThat(IndexSpecLoader.load(write("")), empty());
        assertThat(IndexSpecLoader.load(write("indices: []")), empty());
    }

    @Test
    void missingFileIsAConfigurationError() {
        var e = assertThrows(SyncConfigurationException.class,
            () -> IndexSpecLoader.load(tempDir.resolve("absent.yaml")));
        assertThat(e.getMessage(), containsString("not found"));
    }

    @Test
    void malformedYamlIsAConfigurationError() throws IOException {
        var file = write("indices: [ {index_name: subjects");

        assertThrows(SyncConfigurationException.class, () -> IndexSpecLoader.load(file));
    }
}
