package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One Cypher query of an index spec. The text pages through {@code $skip} and {@code $limit};
 * {@code variables} are bound unchanged on every page. A null {@code pageSize} means the run default.
 */
public record QuerySpec(
    String name,
    String text,
    Map<String, Object> variables,
    Integer pageSize
) {
    public static final String INITIAL_QUERY_NAME = "initial";

    public QuerySpec {
        variables = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public int effectivePageSize(int defaultPageSize) {
        return pageSize != null ? pageSize : defaultPageSize;
    }
}
