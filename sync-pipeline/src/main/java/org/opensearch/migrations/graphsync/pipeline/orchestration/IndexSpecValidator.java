package org.opensearch.migrations.graphsync.pipeline.orchestration;

import java.util.HashSet;
import java.util.List;

import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException;
import org.opensearch.migrations.graphsync.pipeline.ir.IndexSpec;
import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

/**
 * Structural checks over the whole set of index specs. Runs before any index is touched, so a single
 * malformed spec stops the run without side effects.
 */
public final class IndexSpecValidator {

    private IndexSpecValidator() {}

    public static void validate(List<IndexSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new SyncConfigurationException("No indices defined in specification file");
        }
        var indexNames = new HashSet<String>();
        for (int i = 0; i < specs.size(); i++) {
            var spec = specs.get(i);
            if (isBlank(spec.indexName())) {
                throw new SyncConfigurationException("Index #" + (i + 1) + " has no index_name");
            }
            if (!indexNames.add(spec.indexName())) {
                throw new SyncConfigurationException("Duplicate index_name '" + spec.indexName() + "'");
            }
            validateIndex(spec);
        }
    }

    private static void validateIndex(IndexSpec spec) {
        var index = spec.indexName();
        if (isBlank(spec.idField())) {
            throw new SyncConfigurationException("Index '" + index + "' has no id_field");
        }
        if (spec.initialQuery() == null) {
            throw new SyncConfigurationException("Index '" + index + "' has no initial_query");
        }
        var queryNames = new HashSet<String>();
        for (var query : spec.allQueries()) {
            if (isBlank(query.name())) {
                throw new SyncConfigurationException("Index '" + index + "' has a query without a name");
            }
            if (!queryNames.add(query.name())) {
                throw new SyncConfigurationException(
                    "Index '" + index + "' declares query '" + query.name() + "' more than once");
            }
            validateQuery(index, query);
        }
    }

    private static void validateQuery(String index, QuerySpec query) {
        var where = "Query '" + query.name() + "' of index '" + index + "'";
        if (isBlank(query.text())) {
            throw new SyncConfigurationException(where + " has empty query text");
        }
        if (query.pageSize() != null && query.pageSize() <= 0) {
            throw new SyncConfigurationException(where + " has non-positive page_size " + query.pageSize());
        }
        for (var reserved : List.of(GraphQueryClient.SKIP_PARAMETER, GraphQueryClient.LIMIT_PARAMETER)) {
            if (query.variables().containsKey(reserved)) {
                throw new SyncConfigurationException(
                    where + " declares variable '" + reserved + "', which is reserved for pagination");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
