package org.opensearch.migrations.graphsync.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException;
import org.opensearch.migrations.graphsync.pipeline.ir.IndexSpec;
import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the index specification file.
 *
 * <pre>
 * indices:
 *   - index_name: subjects
 *     id_field: id
 *     initial_query:
 *       query: "MATCH (s:subject) RETURN s.id AS id SKIP $skip LIMIT $limit"
 *       variables: {}
 *       page_size: 1000
 *     update_queries:
 *       - name: add_study
 *         query: "..."
 * </pre>
 *
 * Only the shape is checked here; the content is checked by the orchestrator's validator. Update queries
 * without a name are called {@code update-1}, {@code update-2}, ... in declaration order.
 */
@Slf4j
public class IndexSpecLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String UNNAMED_UPDATE_PREFIX = "update-";

    private IndexSpecLoader() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SpecFile {
        @JsonProperty("indices")
        public List<IndexEntry> indices;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class IndexEntry {
        @JsonProperty("index_name")
        public String indexName;
        @JsonProperty("id_field")
        public String idField;
        @JsonProperty("initial_query")
        public QueryEntry initialQuery;
        @JsonProperty("update_queries")
        public List<QueryEntry> updateQueries;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class QueryEntry {
        @JsonProperty("name")
        public String name;
        @JsonProperty("query")
        public String query;
        @JsonProperty("variables")
        public Map<String, Object> variables;
        @JsonProperty("page_size")
        public Integer pageSize;
    }

    public static List<IndexSpec> load(Path specFile) {
        if (!Files.isRegularFile(specFile)) {
            throw new SyncConfigurationException("Index specification file not found: " + specFile);
        }
        SpecFile parsed;
        try {
            var tree = YAML_MAPPER.readTree(specFile.toFile());
            parsed = tree == null || tree.isMissingNode() || tree.isNull()
                ? new SpecFile()
                : YAML_MAPPER.treeToValue(tree, SpecFile.class);
        } catch (IOException e) {
            throw new SyncConfigurationException("Unable to read index specification file " + specFile + ": "
                + e.getMessage(), e);
        }
        var specs = toIndexSpecs(parsed);
        log.info("Loaded {} index specs from {}", specs.size(), specFile);
        return specs;
    }

    static List<IndexSpec> toIndexSpecs(SpecFile parsed) {
        var specs = new ArrayList<IndexSpec>();
        if (parsed.indices == null) {
            return specs;
        }
        for (var entry : parsed.indices) {
            if (entry == null) {
                continue;
            }
            var initial = entry.initialQuery == null
                ? null
                : toQuerySpec(entry.initialQuery, QuerySpec.INITIAL_QUERY_NAME);
            var updates = new ArrayList<QuerySpec>();
            if (entry.updateQueries != null) {
                for (int i = 0; i < entry.updateQueries.size(); i++) {
                    var update = entry.updateQueries.get(i);
                    if (update != null) {
                        updates.add(toQuerySpec(update, UNNAMED_UPDATE_PREFIX + (i + 1)));
                    }
                }
            }
            specs.add(new IndexSpec(trim(entry.indexName), trim(entry.idField), initial, updates));
        }
        return specs;
    }

    private static QuerySpec toQuerySpec(QueryEntry entry, String defaultName) {
        var name = trim(entry.name);
        return new QuerySpec(
            name == null || name.isEmpty() ? defaultName : name,
            entry.query == null ? null : entry.query.strip(),
            entry.variables,
            entry.pageSize
        );
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
