package org.opensearch.migrations.graphsync.pipeline.source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Port for running one page of a read query against a graph database.
 */
public interface GraphQueryClient extends AutoCloseable {
    String SKIP_PARAMETER = "skip";
    String LIMIT_PARAMETER = "limit";

    /**
     * Run {@code text} with {@code variables} plus the pagination parameters {@code $skip} and {@code $limit},
     * returning the rows in the order the database produced them. Each row maps column name to a
     * JSON-compatible value.
     *
     * @throws org.opensearch.migrations.graphsync.pipeline.exceptions.GraphQueryException when the database
     *         is unreachable or rejects the query or its parameters
     */
    List<Map<String, Object>> execute(String text, Map<String, Object> variables, long skip, int limit);

    /** The query's own variables with the page's {@code skip} and {@code limit} bound next to them. */
    static Map<String, Object> withPagination(Map<String, Object> variables, long skip, int limit) {
        var parameters = new LinkedHashMap<String, Object>(variables);
        parameters.put(SKIP_PARAMETER, skip);
        parameters.put(LIMIT_PARAMETER, limit);
        return parameters;
    }

    @Override
    default void close() {
        // Default no-op for clients that don't hold connections
    }
}
