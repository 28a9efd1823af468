package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares one target index: where its documents come from and which column identifies them.
 * Immutable for the duration of a run.
 */
public record IndexSpec(
    String indexName,
    String idField,
    QuerySpec initialQuery,
    List<QuerySpec> updateQueries
) {
    public IndexSpec {
        updateQueries = updateQueries == null ? List.of() : List.copyOf(updateQueries);
    }

    /** The initial query followed by the update queries, in execution order. */
    public List<QuerySpec> allQueries() {
        var queries = new ArrayList<QuerySpec>(updateQueries.size() + 1);
        if (initialQuery != null) {
            queries.add(initialQuery);
        }
        queries.addAll(updateQueries);
        return queries;
    }
}
